package com.flagship.credit_ledger.voucher;

import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.ledger.LedgerService;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class VoucherValue {
    Asset asset;
    BigDecimal amount;

    public static VoucherValue of(Asset asset, BigDecimal amount) {
        if (asset == null) {
            throw new IllegalArgumentException("Voucher asset is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Voucher amount must be positive");
        }
        if (amount.stripTrailingZeros().scale() > LedgerService.AMOUNT_SCALE) {
            throw new IllegalArgumentException("Voucher amount has more than " + LedgerService.AMOUNT_SCALE + " decimal places");
        }
        return new VoucherValue(asset, amount);
    }
}
