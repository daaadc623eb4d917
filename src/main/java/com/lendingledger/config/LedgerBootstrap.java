package com.lendingledger.config;

import com.lendingledger.common.Currency;
import com.lendingledger.common.Money;
import com.lendingledger.escrow.ForfeitedPool;
import com.lendingledger.escrow.ForfeitedPoolRepository;
import com.lendingledger.funds.Treasury;
import com.lendingledger.funds.TreasuryRepository;
import com.lendingledger.policy.LendingPolicy;
import com.lendingledger.policy.PolicyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

/**
 * Creates the policy, treasury and forfeited pool rows on first start.
 *
 * Existing rows are left alone, so configuration only seeds an empty database;
 * later changes go through the audited policy setters.
 */
@Component
@Slf4j
public class LedgerBootstrap implements ApplicationRunner {

    private final PolicyRepository policyRepository;
    private final TreasuryRepository treasuryRepository;
    private final ForfeitedPoolRepository poolRepository;
    private final Clock clock;

    @Value("${lending-ledger.policy.loan-duration-days:14}")
    private long loanDurationDays;

    @Value("${lending-ledger.policy.deposit-amount:10.00}")
    private BigDecimal depositAmount;

    @Value("${lending-ledger.policy.currency:USD}")
    private Currency currency;

    @Value("${lending-ledger.policy.grace-period-hours:0}")
    private long gracePeriodHours;

    @Value("${lending-ledger.policy.extension-duration-days:7}")
    private long extensionDurationDays;

    @Value("${lending-ledger.policy.max-extensions:2}")
    private int maxExtensions;

    @Value("${lending-ledger.policy.custodian:}")
    private String custodianId;

    @Value("${lending-ledger.policy.steward:}")
    private String stewardId;

    public LedgerBootstrap(PolicyRepository policyRepository, TreasuryRepository treasuryRepository,
                           ForfeitedPoolRepository poolRepository, Clock clock) {
        this.policyRepository = policyRepository;
        this.treasuryRepository = treasuryRepository;
        this.poolRepository = poolRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!policyRepository.existsById(LendingPolicy.SINGLETON_ID)) {
            LendingPolicy policy = new LendingPolicy(
                Duration.ofDays(loanDurationDays),
                Money.of(depositAmount, currency),
                Duration.ofHours(gracePeriodHours),
                Duration.ofDays(extensionDurationDays),
                maxExtensions,
                blankToNull(custodianId),
                blankToNull(stewardId)
            );
            policy.setUpdatedAt(clock.instant());
            policyRepository.save(policy);
            log.info("Initialized lending policy: loan {} days, deposit {}, grace {} hours, "
                    + "extension {} days x{}, custodian {}, steward {}",
                loanDurationDays, policy.getDepositAmount(), gracePeriodHours,
                extensionDurationDays, maxExtensions, policy.getCustodianId(), policy.getStewardId());
        }

        if (!treasuryRepository.existsById(Treasury.SINGLETON_ID)) {
            treasuryRepository.save(new Treasury(currency, clock.instant()));
            log.info("Initialized treasury in {}", currency);
        }

        if (!poolRepository.existsById(ForfeitedPool.SINGLETON_ID)) {
            poolRepository.save(new ForfeitedPool(currency, clock.instant()));
            log.info("Initialized forfeited pool in {}", currency);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
