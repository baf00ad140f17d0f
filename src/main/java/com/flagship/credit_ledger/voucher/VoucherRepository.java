package com.flagship.credit_ledger.voucher;

import com.flagship.credit_ledger.ledger.LedgerEventKind;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VoucherRepository extends JpaRepository<VoucherEntity, UUID> {

    Optional<VoucherEntity> findByCode(String code);

    boolean existsByCode(String code);

    /**
     * Per-code serialization point for redemption.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VoucherEntity v WHERE v.code = :code")
    Optional<VoucherEntity> findByCodeForUpdate(@Param("code") String code);

    long countByStatus(VoucherStatus status);

    @Query("""
        SELECT COUNT(v) FROM VoucherEntity v
        WHERE v.status = :status AND v.expiresAt IS NOT NULL AND v.expiresAt <= :now
        """)
    long countExpired(@Param("status") VoucherStatus status, @Param("now") Instant now);

    @Query("""
        SELECT v.asset, SUM(v.amount) FROM VoucherEntity v
        WHERE v.status = :status AND (v.expiresAt IS NULL OR v.expiresAt > :now)
        GROUP BY v.asset
        """)
    List<Object[]> sumOutstandingByAsset(@Param("status") VoucherStatus status, @Param("now") Instant now);

    /**
     * Redeemed vouchers whose ledger credit never landed.
     */
    @Query("""
        SELECT v FROM VoucherEntity v
        WHERE v.status = :status
          AND NOT EXISTS (
              SELECT e.id FROM LedgerEventEntity e
              WHERE e.kind = :kind AND e.externalReference = v.code)
        ORDER BY v.redeemedAt ASC
        """)
    List<VoucherEntity> findRedeemedWithoutCredit(@Param("status") VoucherStatus status,
                                                  @Param("kind") LedgerEventKind kind,
                                                  Pageable pageable);
}
