package com.flagship.credit_ledger.ledger;

/**
 * Kind of balance-affecting operation recorded in the ledger.
 *
 * Together with the external reference, the kind identifies an operation:
 * the ledger never records two events with the same (kind, reference).
 */
public enum LedgerEventKind {
    DEPOSIT_CREDIT,
    DEBIT,
    REFUND,
    VOUCHER_CREDIT,
    PACKAGE_CREDIT,
    ADMIN_ADJUSTMENT;

    public boolean isCredit() {
        return this != DEBIT;
    }
}
