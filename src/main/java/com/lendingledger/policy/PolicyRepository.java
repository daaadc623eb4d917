package com.lendingledger.policy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the lending policy row.
 */
@Repository
public interface PolicyRepository extends JpaRepository<LendingPolicy, Long> {
}
