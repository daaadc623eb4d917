package com.lendingledger.membership;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for memberships.
 */
@Repository
public interface MembershipRepository extends JpaRepository<Membership, String> {

    Optional<Membership> findByAccountIdAndActiveTrue(String accountId);

    List<Membership> findByActiveTrueOrderByAccountIdAsc();
}
