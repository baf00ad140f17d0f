package com.flagship.credit_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for ledger, deposit, voucher and conversion operations.
 *
 * Meters are looked up through registry.counter()/timer() with tags; tag values
 * are sanitized to keep cardinality bounded.
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ==================== Ledger ====================

    public void recordPosting(String asset, String kind, String outcome) {
        registry.counter("ledger.postings",
                "asset", sanitizeTag(asset),
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordDuplicatePosting(String kind) {
        registry.counter("ledger.postings.duplicate", "kind", sanitizeTag(kind)).increment();
    }

    public void recordCreditRetry(String operation) {
        registry.counter("ledger.credit.retries", "operation", sanitizeTag(operation)).increment();
    }

    // ==================== Deposits ====================

    public void recordVerdict(String verdict) {
        registry.counter("deposit.verdicts", "verdict", sanitizeTag(verdict)).increment();
    }

    public void recordChainLookupFailure(String reason) {
        registry.counter("deposit.chain_lookup.failures", "reason", sanitizeTag(reason)).increment();
    }

    public void recordClaimResolved(String status) {
        registry.counter("deposit.claims.resolved", "status", sanitizeTag(status)).increment();
    }

    // ==================== Vouchers ====================

    public void recordVoucherRedemption(String outcome) {
        registry.counter("voucher.redemptions", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordVouchersCreated(int count) {
        registry.counter("voucher.created").increment(count);
    }

    // ==================== Conversions ====================

    public void recordConversion(String outcome) {
        registry.counter("conversion.requests", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordReservationsReleased(String reason, int count) {
        registry.counter("conversion.reservations.released", "reason", sanitizeTag(reason)).increment(count);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // ==================== Packages ====================

    public void recordPackagePurchase(String packageId, String outcome) {
        registry.counter("package.purchases",
                "package", sanitizeTag(packageId),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    // ==================== Latency ====================

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
