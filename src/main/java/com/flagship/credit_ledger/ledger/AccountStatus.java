package com.flagship.credit_ledger.ledger;

public enum AccountStatus {
    ACTIVE,
    SUSPENDED
}
