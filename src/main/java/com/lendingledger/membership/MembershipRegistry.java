package com.lendingledger.membership;

import com.lendingledger.common.exception.InvalidValueException;
import com.lendingledger.common.exception.LendingErrorCode;
import com.lendingledger.policy.AccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Membership oracle backed by the local membership table.
 *
 * Stewards and curators grant and revoke borrowing rights; revoking does not
 * touch loans already open.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipRegistry implements MembershipOracle {

    private final MembershipRepository membershipRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public boolean isMember(String accountId) {
        return accountId != null && membershipRepository.findByAccountIdAndActiveTrue(accountId).isPresent();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MembershipTier> tierOf(String accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return membershipRepository.findByAccountIdAndActiveTrue(accountId)
            .map(Membership::getTier);
    }

    @Transactional
    public Membership grant(AccessPolicy access, String accountId, MembershipTier tier) {
        access.requireStewardOrCurator("grant memberships");
        if (accountId == null || accountId.isBlank()) {
            throw new InvalidValueException(LendingErrorCode.INVALID_ACCOUNT, "Member account cannot be blank");
        }
        MembershipTier effectiveTier = tier != null ? tier : MembershipTier.STANDARD;

        Membership membership = membershipRepository.findById(accountId)
            .map(existing -> {
                existing.grant(effectiveTier, access.getCallerId(), clock.instant());
                return existing;
            })
            .orElseGet(() -> new Membership(accountId, effectiveTier, access.getCallerId(), clock.instant()));

        log.info("Granted {} membership to {} by {}", effectiveTier, accountId, access.getCallerId());
        return membershipRepository.save(membership);
    }

    @Transactional
    public void revoke(AccessPolicy access, String accountId) {
        access.requireStewardOrCurator("revoke memberships");

        membershipRepository.findByAccountIdAndActiveTrue(accountId).ifPresent(membership -> {
            membership.revoke(clock.instant());
            membershipRepository.save(membership);
            log.info("Revoked membership of {} by {}", accountId, access.getCallerId());
        });
    }

    @Transactional(readOnly = true)
    public List<Membership> activeMembers() {
        return membershipRepository.findByActiveTrueOrderByAccountIdAsc();
    }
}
