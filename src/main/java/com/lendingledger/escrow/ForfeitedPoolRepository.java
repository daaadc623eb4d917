package com.lendingledger.escrow;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the forfeited pool row.
 */
@Repository
public interface ForfeitedPoolRepository extends JpaRepository<ForfeitedPool, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from ForfeitedPool p where p.id = :id")
    Optional<ForfeitedPool> findForUpdate(@Param("id") Long id);
}
