package com.flagship.credit_ledger.voucher;

public enum VoucherStatus {
    UNUSED,
    USED
}
