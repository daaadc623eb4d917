package com.lendingledger.policy;

import com.lendingledger.common.Money;
import com.lendingledger.common.exception.InvalidValueException;
import com.lendingledger.common.exception.LendingErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Service owning the lending policy and the steward/curator roles.
 *
 * Every setter validates its input, requires the steward, and writes a
 * {@link PolicyChange} with the old and new value. Loans already open keep the
 * deposit they were opened with; duration changes apply to their next
 * transition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyService {

    private final PolicyRepository policyRepository;
    private final PolicyChangeRepository policyChangeRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public LendingPolicy current() {
        return policyRepository.findById(LendingPolicy.SINGLETON_ID)
            .orElseThrow(() -> new IllegalStateException("Lending policy has not been initialized"));
    }

    @Transactional(readOnly = true)
    public AccessPolicy accessFor(String callerId) {
        LendingPolicy policy = current();
        return AccessPolicy.of(callerId, policy.getStewardId(), policy.getCuratorIds());
    }

    @Transactional
    public LendingPolicy setLoanDuration(AccessPolicy access, Duration loanDuration) {
        access.requireSteward("set the loan duration");
        requirePositive(loanDuration, "Loan duration");

        LendingPolicy policy = current();
        Duration old = policy.getLoanDuration();
        policy.setLoanDurationSeconds(loanDuration.getSeconds());
        return save(policy, PolicyParameter.LOAN_DURATION, old, loanDuration, access);
    }

    @Transactional
    public LendingPolicy setDepositAmount(AccessPolicy access, Money depositAmount) {
        access.requireSteward("set the deposit amount");
        if (depositAmount == null || !depositAmount.isPositive()) {
            throw new InvalidValueException(LendingErrorCode.ZERO_DEPOSIT,
                "Deposit amount must be positive: " + depositAmount);
        }

        LendingPolicy policy = current();
        Money old = policy.getDepositAmount();
        if (!old.isSameCurrency(depositAmount)) {
            throw new InvalidValueException(LendingErrorCode.INVALID_AMOUNT,
                String.format("Deposit currency cannot change from %s to %s",
                    old.getCurrency(), depositAmount.getCurrency()));
        }
        policy.setDepositAmount(depositAmount);
        return save(policy, PolicyParameter.DEPOSIT_AMOUNT, old, depositAmount, access);
    }

    /**
     * Zero is allowed: a return is then late as soon as it is after the due date.
     */
    @Transactional
    public LendingPolicy setGracePeriod(AccessPolicy access, Duration gracePeriod) {
        access.requireSteward("set the grace period");
        if (gracePeriod == null || gracePeriod.isNegative()) {
            throw new InvalidValueException(LendingErrorCode.ZERO_DURATION,
                "Grace period cannot be negative: " + gracePeriod);
        }

        LendingPolicy policy = current();
        Duration old = policy.getGracePeriod();
        policy.setGracePeriodSeconds(gracePeriod.getSeconds());
        return save(policy, PolicyParameter.GRACE_PERIOD, old, gracePeriod, access);
    }

    @Transactional
    public LendingPolicy setExtensionDuration(AccessPolicy access, Duration extensionDuration) {
        access.requireSteward("set the extension duration");
        requirePositive(extensionDuration, "Extension duration");

        LendingPolicy policy = current();
        Duration old = policy.getExtensionDuration();
        policy.setExtensionDurationSeconds(extensionDuration.getSeconds());
        return save(policy, PolicyParameter.EXTENSION_DURATION, old, extensionDuration, access);
    }

    @Transactional
    public LendingPolicy setMaxExtensions(AccessPolicy access, int maxExtensions) {
        access.requireSteward("set the maximum number of extensions");
        if (maxExtensions < 0) {
            throw new InvalidValueException(LendingErrorCode.INVALID_AMOUNT,
                "Maximum extensions cannot be negative: " + maxExtensions);
        }

        LendingPolicy policy = current();
        int old = policy.getMaxExtensions();
        policy.setMaxExtensions(maxExtensions);
        return save(policy, PolicyParameter.MAX_EXTENSIONS, old, maxExtensions, access);
    }

    @Transactional
    public LendingPolicy setCustodian(AccessPolicy access, String custodianId) {
        access.requireSteward("set the custodian");
        if (custodianId == null || custodianId.isBlank()) {
            throw new InvalidValueException(LendingErrorCode.ZERO_BRANCH, "Custodian cannot be blank");
        }

        LendingPolicy policy = current();
        String old = policy.getCustodianId();
        policy.setCustodianId(custodianId);
        return save(policy, PolicyParameter.CUSTODIAN, old, custodianId, access);
    }

    @Transactional
    public LendingPolicy transferStewardship(AccessPolicy access, String newStewardId) {
        access.requireSteward("transfer stewardship");
        requireAccount(newStewardId, "New steward");

        LendingPolicy policy = current();
        String old = policy.getStewardId();
        policy.setStewardId(newStewardId);
        return save(policy, PolicyParameter.STEWARD, old, newStewardId, access);
    }

    /**
     * Leaves the ledger without a steward. Nothing inside the ledger can appoint
     * a new one afterwards.
     */
    @Transactional
    public LendingPolicy renounceStewardship(AccessPolicy access) {
        access.requireSteward("renounce stewardship");

        LendingPolicy policy = current();
        String old = policy.getStewardId();
        policy.setStewardId(null);
        return save(policy, PolicyParameter.STEWARD, old, null, access);
    }

    @Transactional
    public LendingPolicy grantCurator(AccessPolicy access, String curatorId) {
        access.requireSteward("grant the curator role");
        requireAccount(curatorId, "Curator");

        LendingPolicy policy = current();
        if (!policy.getCuratorIds().add(curatorId)) {
            return policy;
        }
        return save(policy, PolicyParameter.CURATOR_GRANTED, null, curatorId, access);
    }

    @Transactional
    public LendingPolicy revokeCurator(AccessPolicy access, String curatorId) {
        access.requireSteward("revoke the curator role");

        LendingPolicy policy = current();
        if (!policy.getCuratorIds().remove(curatorId)) {
            return policy;
        }
        return save(policy, PolicyParameter.CURATOR_REVOKED, curatorId, null, access);
    }

    @Transactional(readOnly = true)
    public List<PolicyChange> history() {
        return policyChangeRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public List<PolicyChange> history(PolicyParameter parameter) {
        return policyChangeRepository.findByParameterOrderByIdAsc(parameter);
    }

    private LendingPolicy save(LendingPolicy policy, PolicyParameter parameter,
                               Object oldValue, Object newValue, AccessPolicy access) {
        policy.setUpdatedAt(clock.instant());
        LendingPolicy saved = policyRepository.save(policy);

        policyChangeRepository.save(new PolicyChange(
            parameter,
            Objects.toString(oldValue, null),
            Objects.toString(newValue, null),
            access.getCallerId(),
            clock.instant()
        ));

        log.info("Policy {} changed from {} to {} by {}", parameter, oldValue, newValue, access.getCallerId());
        return saved;
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.getSeconds() <= 0) {
            throw new InvalidValueException(LendingErrorCode.ZERO_DURATION,
                name + " must be at least one second: " + duration);
        }
    }

    private static void requireAccount(String accountId, String name) {
        if (accountId == null || accountId.isBlank()) {
            throw new InvalidValueException(LendingErrorCode.INVALID_ACCOUNT, name + " account cannot be blank");
        }
    }
}
