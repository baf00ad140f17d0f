package com.flagship.credit_ledger.ledger;

public class AccountNotFoundException extends RuntimeException {

    public AccountNotFoundException(String identity) {
        super("Account not found: " + identity);
    }
}
