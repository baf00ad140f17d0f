package com.flagship.credit_ledger.pricing;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PackagePriceRepository extends JpaRepository<PackagePriceEntity, String> {

    List<PackagePriceEntity> findAllByOrderBySortOrderAsc();

    @Query("SELECT COALESCE(MAX(p.catalogVersion), 0) FROM PackagePriceEntity p")
    long findCurrentVersion();
}
