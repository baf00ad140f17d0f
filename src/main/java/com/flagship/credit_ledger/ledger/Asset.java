package com.flagship.credit_ledger.ledger;

/**
 * The two balances every account carries.
 *
 * FUNDS is money received from deposits and spent on packages.
 * CREDITS is a unit count spent by conversions.
 */
public enum Asset {
    FUNDS,
    CREDITS
}
