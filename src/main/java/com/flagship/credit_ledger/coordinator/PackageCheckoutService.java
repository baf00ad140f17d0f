package com.flagship.credit_ledger.coordinator;

import com.flagship.credit_ledger.ledger.Account;
import com.flagship.credit_ledger.ledger.AccountService;
import com.flagship.credit_ledger.ledger.InsufficientFundsException;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.flagship.credit_ledger.pricing.CatalogSnapshot;
import com.flagship.credit_ledger.pricing.PackageOrder;
import com.flagship.credit_ledger.pricing.PackageOrderService;
import com.flagship.credit_ledger.pricing.PackagePurchase;
import com.flagship.credit_ledger.pricing.PackagePurchaseService;
import com.flagship.credit_ledger.pricing.PricingCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Package purchases for a user key. Each decision is priced from one catalog
 * snapshot taken at the start of the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PackageCheckoutService {

    private final AccountService accountService;
    private final PricingCatalog catalog;
    private final PackagePurchaseService purchaseService;
    private final PackageOrderService orderService;
    private final LedgerMetrics metrics;

    public PackagePurchase purchase(String userKey, String packageId) {
        Account account = accountService.getOrCreate(userKey);
        CatalogSnapshot snapshot = catalog.snapshot();
        try {
            return purchaseService.purchase(account.getId(), packageId, snapshot);
        } catch (InsufficientFundsException e) {
            metrics.recordPackagePurchase(packageId, "insufficient_funds");
            throw e;
        }
    }

    /**
     * Opens an order that a later deposit completes.
     */
    public PackageOrder openOrder(String userKey, String packageId) {
        Account account = accountService.getOrCreate(userKey);
        return orderService.open(account.getId(), packageId, catalog.snapshot());
    }
}
