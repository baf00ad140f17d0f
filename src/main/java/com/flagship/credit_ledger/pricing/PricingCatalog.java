package com.flagship.credit_ledger.pricing;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Package price catalog.
 *
 * Readers always see one whole version: the catalog is held as an immutable
 * {@link CatalogSnapshot} behind an atomic reference, and a replacement swaps
 * every row in one transaction before publishing the new snapshot. Other
 * instances pick up replacements on the periodic refresh.
 */
@Service
@Slf4j
public class PricingCatalog {

    private final PackagePriceRepository priceRepository;
    private final TransactionTemplate transactionTemplate;
    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>();

    public PricingCatalog(PackagePriceRepository priceRepository, PlatformTransactionManager transactionManager) {
        this.priceRepository = priceRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @PostConstruct
    void load() {
        refresh();
    }

    @Scheduled(fixedDelayString = "${pricing.refresh-interval-ms:60000}",
               initialDelayString = "${pricing.refresh-interval-ms:60000}")
    public void refresh() {
        CatalogSnapshot loaded = transactionTemplate.execute(status -> readSnapshot());
        CatalogSnapshot previous = current.getAndSet(loaded);
        if (previous == null || previous.getVersion() != loaded.getVersion()) {
            log.info("Pricing catalog loaded: version={}, packages={}", loaded.getVersion(), loaded.getPackages().size());
        }
    }

    public CatalogSnapshot snapshot() {
        return current.get();
    }

    /**
     * @throws UnknownPackageException if the package is not in the current catalog
     */
    public PackagePrice price(String packageId) {
        return snapshot().price(packageId);
    }

    /**
     * Replaces the whole catalog and publishes it as the next version.
     */
    public CatalogSnapshot replace(List<PackagePrice> prices) {
        if (prices == null || prices.isEmpty()) {
            throw new IllegalArgumentException("Catalog must contain at least one package");
        }
        CatalogSnapshot validated = CatalogSnapshot.of(0, prices);

        CatalogSnapshot replaced = transactionTemplate.execute(status -> {
            long nextVersion = priceRepository.findCurrentVersion() + 1;
            priceRepository.deleteAllInBatch();
            priceRepository.flush();
            priceRepository.saveAll(validated.list().stream()
                .map(price -> PackagePriceEntity.fromDomain(price, nextVersion))
                .toList());
            priceRepository.flush();
            return CatalogSnapshot.of(nextVersion, validated.list());
        });

        current.set(replaced);
        log.info("Pricing catalog replaced: version={}, packages={}", replaced.getVersion(), replaced.getPackages().size());
        return replaced;
    }

    private CatalogSnapshot readSnapshot() {
        List<PackagePriceEntity> rows = priceRepository.findAllByOrderBySortOrderAsc();
        long version = rows.stream().mapToLong(PackagePriceEntity::getCatalogVersion).max().orElse(0L);
        return CatalogSnapshot.of(version, rows.stream().map(PackagePriceEntity::toDomain).toList());
    }
}
