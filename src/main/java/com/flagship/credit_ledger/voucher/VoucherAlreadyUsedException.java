package com.flagship.credit_ledger.voucher;

public class VoucherAlreadyUsedException extends RuntimeException {

    public VoucherAlreadyUsedException(String code) {
        super("Voucher already used: " + code);
    }
}
