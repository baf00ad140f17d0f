package com.flagship.credit_ledger.pricing;

import com.flagship.credit_ledger.coordinator.PackageCheckoutService;
import com.flagship.credit_ledger.ledger.AccountService;
import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.ledger.InsufficientFundsException;
import com.flagship.credit_ledger.ledger.LedgerEventKind;
import com.flagship.credit_ledger.ledger.LedgerService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Catalog versions, purchases against a snapshot and package orders.
 */
@SpringBootTest
class PricingCatalogTest {

    @Autowired
    private PricingCatalog catalog;

    @Autowired
    private PackageCheckoutService checkoutService;

    @Autowired
    private PackagePurchaseService purchaseService;

    @Autowired
    private PackageOrderService orderService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerService ledgerService;

    private List<PackagePrice> original;
    private String userKey;

    @BeforeEach
    void setUp() {
        catalog.refresh();
        original = catalog.snapshot().list();
        userKey = "buyer-" + UUID.randomUUID();
    }

    @AfterEach
    void restoreCatalog() {
        if (!catalog.snapshot().list().equals(original)) {
            catalog.replace(original);
        }
    }

    private UUID fund(String amount) {
        UUID accountId = accountService.getOrCreate(userKey).getId();
        ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal(amount), LedgerEventKind.ADMIN_ADJUSTMENT,
                "fund-" + accountId);
        return accountId;
    }

    @Nested
    @DisplayName("1. Catalog")
    class Catalog {

        @Test
        @DisplayName("1.1 Seeded catalog is listed in display order")
        void seededCatalog() {
            List<String> ids = catalog.snapshot().list().stream().map(PackagePrice::getPackageId).toList();

            assertTrue(ids.containsAll(List.of("small", "medium", "large", "premium", "advanced", "professional", "bulk")));
            PackagePrice large = catalog.price("large");
            assertEquals(0, large.getUnitCount().compareTo(new BigDecimal("100")));
            assertEquals(0, large.getCost().compareTo(new BigDecimal("7.00")));
        }

        @Test
        @DisplayName("1.2 Replacing the catalog publishes a new version wholesale")
        void replaceBumpsVersion() {
            long before = catalog.snapshot().getVersion();

            CatalogSnapshot replaced = catalog.replace(List.of(
                    PackagePrice.of("starter", "Starter", new BigDecimal("10"), new BigDecimal("1.00"), 1),
                    PackagePrice.of("large", "Large", new BigDecimal("120"), new BigDecimal("7.00"), 2)));

            assertEquals(before + 1, replaced.getVersion());
            assertEquals(2, catalog.snapshot().getPackages().size());
            assertThrows(UnknownPackageException.class, () -> catalog.price("small"));

            catalog.refresh();
            assertEquals(replaced.getVersion(), catalog.snapshot().getVersion(), "Reload sees the stored version");
            assertEquals(0, catalog.price("large").getUnitCount().compareTo(new BigDecimal("120")));
        }

        @Test
        @DisplayName("1.3 Invalid catalogs are refused and the current one stays live")
        void invalidCatalogRefused() {
            long before = catalog.snapshot().getVersion();

            assertThrows(IllegalArgumentException.class, () -> catalog.replace(List.of()));
            assertThrows(IllegalArgumentException.class, () -> catalog.replace(List.of(
                    PackagePrice.of("dup", "A", BigDecimal.ONE, BigDecimal.ONE, 1),
                    PackagePrice.of("dup", "B", BigDecimal.TEN, BigDecimal.TEN, 2))));
            assertThrows(IllegalArgumentException.class, () ->
                    PackagePrice.of("free", "Free", BigDecimal.TEN, BigDecimal.ZERO, 1));

            assertEquals(before, catalog.snapshot().getVersion());
        }
    }

    @Nested
    @DisplayName("2. Purchases")
    class Purchases {

        @Test
        @DisplayName("2.1 Purchase debits the cost and credits the units")
        void purchaseMovesFundsToCredits() {
            UUID accountId = fund("10.00");

            PackagePurchase purchase = checkoutService.purchase(userKey, "medium");

            assertEquals(catalog.snapshot().getVersion(), purchase.getCatalogVersion());
            assertEquals(0, ledgerService.balance(accountId, Asset.FUNDS).compareTo(new BigDecimal("6.00")));
            assertEquals(0, ledgerService.balance(accountId, Asset.CREDITS).compareTo(new BigDecimal("50")));
            assertEquals(2, ledgerService.eventsForReference(purchase.getId().toString()).size());
        }

        @Test
        @DisplayName("2.2 Repeating a purchase id does not charge twice")
        void purchaseIsIdempotent() {
            UUID accountId = fund("10.00");
            UUID purchaseId = UUID.randomUUID();

            purchaseService.purchase(purchaseId, accountId, "small", new BigDecimal("30"), new BigDecimal("3.00"), 1);
            purchaseService.purchase(purchaseId, accountId, "small", new BigDecimal("30"), new BigDecimal("3.00"), 1);

            assertEquals(0, ledgerService.balance(accountId, Asset.FUNDS).compareTo(new BigDecimal("7.00")));
            assertEquals(1, purchaseService.findByAccount(accountId).size());
        }

        @Test
        @DisplayName("2.3 Insufficient funds and unknown packages change nothing")
        void failedPurchasesChangeNothing() {
            UUID accountId = fund("2.00");

            assertThrows(InsufficientFundsException.class, () -> checkoutService.purchase(userKey, "large"));
            assertThrows(UnknownPackageException.class, () -> checkoutService.purchase(userKey, "nonexistent"));

            assertEquals(0, ledgerService.balance(accountId, Asset.FUNDS).compareTo(new BigDecimal("2.00")));
            assertEquals(0, ledgerService.balance(accountId, Asset.CREDITS).signum());
            assertTrue(purchaseService.findByAccount(accountId).isEmpty());
        }
    }

    @Nested
    @DisplayName("3. Package orders")
    class Orders {

        @Test
        @DisplayName("3.1 Order quotes the shortfall and a new order supersedes the old one")
        void orderQuotesShortfall() {
            UUID accountId = fund("3.00");

            PackageOrder first = checkoutService.openOrder(userKey, "large");
            assertEquals(0, first.getRequiredPayment().compareTo(new BigDecimal("4.00")));

            PackageOrder second = checkoutService.openOrder(userKey, "premium");
            assertEquals(second.getId(), orderService.findOpen(accountId).orElseThrow().getId());
            assertEquals(0, orderService.requiredPaymentFor(accountId).orElseThrow().compareTo(new BigDecimal("27.00")));
        }

        @Test
        @DisplayName("3.2 Order is completed once funds cover the quoted cost")
        void orderCompletesWhenFunded() {
            UUID accountId = accountService.getOrCreate(userKey).getId();
            PackageOrder order = checkoutService.openOrder(userKey, "small");

            assertTrue(orderService.completeIfFunded(accountId).isEmpty(), "No funds yet");

            ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("3.00"), LedgerEventKind.DEPOSIT_CREDIT,
                    "order-deposit-" + accountId);
            PackagePurchase purchase = orderService.completeIfFunded(accountId).orElseThrow();

            assertEquals(order.getId(), purchase.getId());
            assertEquals(0, ledgerService.balance(accountId, Asset.CREDITS).compareTo(new BigDecimal("30")));
            assertTrue(orderService.findOpen(accountId).isEmpty());
            assertTrue(orderService.completeIfFunded(accountId).isEmpty());
        }
    }
}
