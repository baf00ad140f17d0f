package com.flagship.credit_ledger.ledger;

import lombok.Getter;

import java.util.UUID;

@Getter
public class AccountSuspendedException extends RuntimeException {

    private final UUID accountId;

    public AccountSuspendedException(UUID accountId) {
        super("Account " + accountId + " is suspended");
        this.accountId = accountId;
    }
}
