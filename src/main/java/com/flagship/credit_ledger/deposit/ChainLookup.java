package com.flagship.credit_ledger.deposit;

/**
 * Read access to the chain for a single transaction hash.
 */
public interface ChainLookup {

    /**
     * @return the transfer, or {@link ChainTransfer#notFound()} when the chain has no matching transfer
     * @throws ChainLookupException on network failure, timeout or a malformed response
     */
    ChainTransfer lookup(String txHash);
}
