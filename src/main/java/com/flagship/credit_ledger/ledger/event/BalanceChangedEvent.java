package com.flagship.credit_ledger.ledger.event;

import com.flagship.credit_ledger.ledger.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published for every ledger event. The messaging front-end uses it to notify users.
 */
@Value
public class BalanceChangedEvent implements AccountEvent {
    UUID eventId;
    UUID accountId;
    UUID ledgerEventId;
    String asset;
    String kind;
    BigDecimal amount;
    BigDecimal resultingBalance;
    String externalReference;
    long sequenceNumber;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BalanceChangedEvent from(LedgerEvent event) {
        return new BalanceChangedEvent(
            UUID.randomUUID(),
            event.getAccountId(),
            event.getId(),
            event.getAsset().name(),
            event.getKind().name(),
            event.getAmount(),
            event.getResultingBalance(),
            event.getExternalReference(),
            event.getSequenceNumber(),
            Instant.now()
        );
    }
}
