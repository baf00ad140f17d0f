package com.flagship.credit_ledger.voucher;

public class VoucherNotFoundException extends RuntimeException {

    public VoucherNotFoundException(String code) {
        super("Voucher not found: " + code);
    }
}
