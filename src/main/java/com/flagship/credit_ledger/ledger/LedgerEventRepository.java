package com.flagship.credit_ledger.ledger;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerEventRepository extends JpaRepository<LedgerEventEntity, UUID> {

    Optional<LedgerEventEntity> findByKindAndExternalReference(LedgerEventKind kind, String externalReference);

    boolean existsByKindAndExternalReference(LedgerEventKind kind, String externalReference);

    List<LedgerEventEntity> findByExternalReferenceOrderBySequenceNumberAsc(String externalReference);

    @Query("""
        SELECT e FROM LedgerEventEntity e
        WHERE e.accountId = :accountId
        ORDER BY e.sequenceNumber DESC
        """)
    List<LedgerEventEntity> findRecent(@Param("accountId") UUID accountId, Pageable pageable);

    @Query("""
        SELECT COALESCE(SUM(e.amount), 0) FROM LedgerEventEntity e
        WHERE e.accountId = :accountId AND e.asset = :asset
        """)
    BigDecimal sumAmounts(@Param("accountId") UUID accountId, @Param("asset") Asset asset);
}
