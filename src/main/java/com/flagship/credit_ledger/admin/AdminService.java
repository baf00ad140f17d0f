package com.flagship.credit_ledger.admin;

import com.flagship.credit_ledger.ledger.Account;
import com.flagship.credit_ledger.ledger.AccountService;
import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.ledger.LedgerEvent;
import com.flagship.credit_ledger.ledger.LedgerEventKind;
import com.flagship.credit_ledger.ledger.LedgerService;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.flagship.credit_ledger.pricing.CatalogSnapshot;
import com.flagship.credit_ledger.pricing.PackagePrice;
import com.flagship.credit_ledger.pricing.PricingCatalog;
import com.flagship.credit_ledger.voucher.Voucher;
import com.flagship.credit_ledger.voucher.VoucherRegistry;
import com.flagship.credit_ledger.voucher.VoucherStats;
import com.flagship.credit_ledger.voucher.VoucherValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Administrative operations. Each one writes an audit row in the same
 * transaction as its effect.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminService {

    static final String CREATE_VOUCHERS = "CREATE_VOUCHERS";
    static final String ADJUST_BALANCE = "ADJUST_BALANCE";
    static final String SUSPEND_ACCOUNT = "SUSPEND_ACCOUNT";
    static final String REACTIVATE_ACCOUNT = "REACTIVATE_ACCOUNT";
    static final String REPLACE_CATALOG = "REPLACE_CATALOG";

    private final AdminAuditLogRepository auditRepository;
    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final VoucherRegistry voucherRegistry;
    private final PricingCatalog pricingCatalog;
    private final LedgerMetrics metrics;

    /**
     * @param expiresInDays days until expiry, or null for vouchers that never expire
     */
    @Transactional
    public List<Voucher> createVouchers(int count, Asset asset, BigDecimal amount, String prefix,
                                        Integer expiresInDays, String adminKey) {
        Instant expiresAt = null;
        if (expiresInDays != null) {
            if (expiresInDays <= 0) {
                throw new IllegalArgumentException("Expiry must be at least one day");
            }
            expiresAt = Instant.now().plus(Duration.ofDays(expiresInDays));
        }

        List<Voucher> vouchers = voucherRegistry.createBatch(count, VoucherValue.of(asset, amount), prefix,
            expiresAt, requireAdmin(adminKey));
        audit(adminKey, CREATE_VOUCHERS, asset.name(),
            String.format("count=%d, amount=%s, prefix=%s, expiresAt=%s", count, amount, prefix, expiresAt));
        metrics.recordVouchersCreated(vouchers.size());
        return vouchers;
    }

    /**
     * Credits or debits a balance directly, bypassing verification.
     *
     * @param signedAmount positive to credit, negative to debit
     */
    @Transactional
    public LedgerEvent adjustBalance(String userKey, Asset asset, BigDecimal signedAmount, String reason, String adminKey) {
        requireAdmin(adminKey);
        if (signedAmount == null || signedAmount.signum() == 0) {
            throw new IllegalArgumentException("Adjustment amount must be non-zero");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Adjustment reason is required");
        }

        Account account = accountService.require(userKey);
        String reference = "adj-" + UUID.randomUUID();
        LedgerEvent event = signedAmount.signum() > 0
            ? ledgerService.credit(account.getId(), asset, signedAmount, LedgerEventKind.ADMIN_ADJUSTMENT, reference, reason)
            : ledgerService.debit(account.getId(), asset, signedAmount.negate(), LedgerEventKind.ADMIN_ADJUSTMENT, reference, reason);

        audit(adminKey, ADJUST_BALANCE, userKey,
            String.format("asset=%s, amount=%s, reference=%s, reason=%s", asset, signedAmount, reference, reason));
        return event;
    }

    @Transactional
    public Account suspend(String userKey, String adminKey) {
        requireAdmin(adminKey);
        Account account = accountService.suspend(accountService.require(userKey).getId());
        audit(adminKey, SUSPEND_ACCOUNT, userKey, null);
        return account;
    }

    @Transactional
    public Account reactivate(String userKey, String adminKey) {
        requireAdmin(adminKey);
        Account account = accountService.reactivate(accountService.require(userKey).getId());
        audit(adminKey, REACTIVATE_ACCOUNT, userKey, null);
        return account;
    }

    /**
     * Replaces the whole catalog. The audit row is written after the new version is live.
     */
    public CatalogSnapshot replaceCatalog(List<PackagePrice> prices, String adminKey) {
        requireAdmin(adminKey);
        CatalogSnapshot snapshot = pricingCatalog.replace(prices);
        auditRepository.save(AdminAuditLogEntity.record(adminKey, REPLACE_CATALOG, "version " + snapshot.getVersion(),
            "packages=" + snapshot.getPackages().keySet()));
        log.info("Admin action: admin={}, action={}, version={}", adminKey, REPLACE_CATALOG, snapshot.getVersion());
        return snapshot;
    }

    public VoucherStats voucherStats() {
        return voucherRegistry.stats();
    }

    private void audit(String adminKey, String action, String target, String details) {
        auditRepository.save(AdminAuditLogEntity.record(adminKey, action, target, details));
        log.info("Admin action: admin={}, action={}, target={}, details={}", adminKey, action, target, details);
    }

    private static String requireAdmin(String adminKey) {
        if (adminKey == null || adminKey.isBlank()) {
            throw new IllegalArgumentException("Admin key is required");
        }
        return adminKey.trim();
    }
}
