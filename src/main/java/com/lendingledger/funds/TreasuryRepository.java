package com.lendingledger.funds;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the treasury row.
 */
@Repository
public interface TreasuryRepository extends JpaRepository<Treasury, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from Treasury t where t.id = :id")
    Optional<Treasury> findForUpdate(@Param("id") Long id);
}
