package com.flagship.credit_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events published about an account.
 *
 * Events are written to the outbox in the same transaction as the change they
 * describe and keyed by account id, so consumers see them in order per account.
 */
public interface AccountEvent {

    /**
     * Unique identifier for this event instance, for consumer deduplication.
     */
    UUID getEventId();

    UUID getAccountId();

    Instant getOccurredAt();

    String getEventType();
}
