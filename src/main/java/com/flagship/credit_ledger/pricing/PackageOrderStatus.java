package com.flagship.credit_ledger.pricing;

public enum PackageOrderStatus {
    OPEN,
    COMPLETED,
    EXPIRED,
    CANCELLED
}
