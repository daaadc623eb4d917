package com.lendingledger.policy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for policy audit records.
 */
@Repository
public interface PolicyChangeRepository extends JpaRepository<PolicyChange, Long> {

    List<PolicyChange> findAllByOrderByIdAsc();

    List<PolicyChange> findByParameterOrderByIdAsc(PolicyParameter parameter);
}
