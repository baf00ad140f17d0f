package com.flagship.credit_ledger.pricing;

import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.ledger.LedgerEventKind;
import com.flagship.credit_ledger.ledger.LedgerService;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Exchanges funds for credits at a catalog price.
 *
 * The funds debit, the credits credit and the purchase record share one
 * transaction and one reference, the purchase id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PackagePurchaseService {

    private final PackagePurchaseRepository purchaseRepository;
    private final LedgerService ledgerService;
    private final LedgerMetrics metrics;

    /**
     * Buys a package at the price found in the given snapshot.
     *
     * @throws UnknownPackageException if the snapshot has no such package
     * @throws com.flagship.credit_ledger.ledger.InsufficientFundsException if funds are short; nothing changes
     */
    @Transactional
    public PackagePurchase purchase(UUID accountId, String packageId, CatalogSnapshot snapshot) {
        PackagePrice price = snapshot.price(packageId);
        return purchase(UUID.randomUUID(), accountId, price.getPackageId(), price.getUnitCount(),
            price.getCost(), snapshot.getVersion());
    }

    /**
     * Buys a package at an already quoted price. Repeating a purchase id returns the original purchase.
     */
    @Transactional
    public PackagePurchase purchase(UUID purchaseId, UUID accountId, String packageId, BigDecimal unitCount,
                                    BigDecimal cost, long catalogVersion) {
        Optional<PackagePurchaseEntity> existing = purchaseRepository.findById(purchaseId);
        if (existing.isPresent()) {
            return existing.get().toDomain();
        }

        String reference = purchaseId.toString();
        ledgerService.debit(accountId, Asset.FUNDS, cost, LedgerEventKind.DEBIT, reference,
                "package " + packageId);
        ledgerService.credit(accountId, Asset.CREDITS, unitCount, LedgerEventKind.PACKAGE_CREDIT, reference,
                "package " + packageId);

        PackagePurchaseEntity saved = purchaseRepository.save(PackagePurchaseEntity.record(
            purchaseId, accountId, packageId, unitCount, cost, catalogVersion));

        metrics.recordPackagePurchase(packageId, "success");
        log.info("Package purchased: purchaseId={}, accountId={}, packageId={}, cost={}, units={}, catalogVersion={}",
                purchaseId, accountId, packageId, cost, unitCount, catalogVersion);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<PackagePurchase> findByAccount(UUID accountId) {
        return purchaseRepository.findByAccountIdOrderByCreatedAtDesc(accountId)
            .stream()
            .map(PackagePurchaseEntity::toDomain)
            .toList();
    }
}
