package com.flagship.credit_ledger.deposit;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DepositClaimRepository extends JpaRepository<DepositClaimEntity, UUID> {

    Optional<DepositClaimEntity> findByTxHash(String txHash);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM DepositClaimEntity c WHERE c.txHash = :txHash")
    Optional<DepositClaimEntity> findByTxHashForUpdate(@Param("txHash") String txHash);

    @Query("""
        SELECT c FROM DepositClaimEntity c
        WHERE c.status = :status
        ORDER BY c.updatedAt ASC
        """)
    List<DepositClaimEntity> findByStatus(@Param("status") DepositClaimStatus status, Pageable pageable);

    List<DepositClaimEntity> findByAccountIdOrderByCreatedAtDesc(UUID accountId, Pageable pageable);

    @Query("""
        SELECT COUNT(c) FROM DepositClaimEntity c
        WHERE c.status = :status AND c.reviewRequired = true
        """)
    long countAwaitingReview(@Param("status") DepositClaimStatus status);
}
