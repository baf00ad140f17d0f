package com.flagship.credit_ledger.ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AccountStatusChangedEvent implements AccountEvent {
    UUID eventId;
    UUID accountId;
    String userKey;
    String status;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AccountStatusChangedEvent of(UUID accountId, String userKey, String status) {
        return new AccountStatusChangedEvent(UUID.randomUUID(), accountId, userKey, status, Instant.now());
    }
}
