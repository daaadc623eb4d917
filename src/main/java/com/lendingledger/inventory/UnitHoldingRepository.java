package com.lendingledger.inventory;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for unit holdings.
 */
@Repository
public interface UnitHoldingRepository extends JpaRepository<UnitHolding, Long> {

    /**
     * Quantity as a scalar, so the holding is not pulled into the persistence
     * context before it is locked.
     */
    @Query("select h.quantity from UnitHolding h where h.holderId = :holderId and h.itemId = :itemId")
    Optional<Long> findQuantity(@Param("holderId") String holderId, @Param("itemId") Long itemId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select h from UnitHolding h where h.holderId = :holderId and h.itemId = :itemId")
    Optional<UnitHolding> findForUpdate(@Param("holderId") String holderId, @Param("itemId") Long itemId);
}
