package com.flagship.credit_ledger.voucher;

public class VoucherExpiredException extends RuntimeException {

    public VoucherExpiredException(String code) {
        super("Voucher expired: " + code);
    }
}
