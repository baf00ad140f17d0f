package com.flagship.credit_ledger.pricing;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface PackageOrderRepository extends JpaRepository<PackageOrderEntity, UUID> {

    List<PackageOrderEntity> findByAccountIdAndStatusOrderByCreatedAtDesc(UUID accountId, PackageOrderStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT o FROM PackageOrderEntity o
        WHERE o.accountId = :accountId AND o.status = :status
        ORDER BY o.createdAt DESC
        """)
    List<PackageOrderEntity> findByAccountIdAndStatusForUpdate(@Param("accountId") UUID accountId,
                                                               @Param("status") PackageOrderStatus status);

    @Query("""
        SELECT o FROM PackageOrderEntity o
        WHERE o.status = :status AND o.expiresAt <= :now
        ORDER BY o.expiresAt ASC
        """)
    List<PackageOrderEntity> findExpiring(@Param("status") PackageOrderStatus status,
                                          @Param("now") Instant now,
                                          Pageable pageable);
}
