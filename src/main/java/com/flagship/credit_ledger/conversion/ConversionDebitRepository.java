package com.flagship.credit_ledger.conversion;

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
public interface ConversionDebitRepository extends JpaRepository<ConversionDebitEntity, UUID> {

    Optional<ConversionDebitEntity> findByIdempotencyKey(String idempotencyKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM ConversionDebitEntity d WHERE d.requestId = :requestId")
    Optional<ConversionDebitEntity> findByIdForUpdate(@Param("requestId") UUID requestId);

    @Query("""
        SELECT d FROM ConversionDebitEntity d
        WHERE d.status = :status AND d.createdAt < :before
        ORDER BY d.createdAt ASC
        """)
    List<ConversionDebitEntity> findByStatusCreatedBefore(@Param("status") ConversionDebitStatus status,
                                                          @Param("before") Instant before,
                                                          Pageable pageable);
}
