package com.flagship.credit_ledger.pricing;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PackagePurchaseRepository extends JpaRepository<PackagePurchaseEntity, UUID> {

    List<PackagePurchaseEntity> findByAccountIdOrderByCreatedAtDesc(UUID accountId);
}
