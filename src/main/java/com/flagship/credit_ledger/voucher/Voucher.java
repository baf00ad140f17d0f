package com.flagship.credit_ledger.voucher;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Single-use code redeemable for a fixed value.
 * Moves from UNUSED to USED exactly once and is kept for audit afterwards.
 */
@Value
public class Voucher {
    UUID id;
    String code;
    VoucherValue value;
    VoucherStatus status;
    UUID redeemedBy;
    Instant redeemedAt;
    Instant expiresAt;
    String createdBy;
    Instant createdAt;

    public static Voucher issue(String code, VoucherValue value, Instant expiresAt, String createdBy) {
        return new Voucher(UUID.randomUUID(), code, value, VoucherStatus.UNUSED, null, null,
            expiresAt, createdBy, Instant.now());
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isUsed() {
        return status == VoucherStatus.USED;
    }

    /**
     * @throws VoucherAlreadyUsedException if already redeemed
     * @throws VoucherExpiredException if past its expiry
     */
    public Voucher redeem(UUID accountId, Instant now) {
        if (isUsed()) {
            throw new VoucherAlreadyUsedException(code);
        }
        if (isExpired(now)) {
            throw new VoucherExpiredException(code);
        }
        return new Voucher(id, code, value, VoucherStatus.USED, accountId, now, expiresAt, createdBy, createdAt);
    }
}
