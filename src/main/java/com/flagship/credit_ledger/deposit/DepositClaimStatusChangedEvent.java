package com.flagship.credit_ledger.deposit;

import com.flagship.credit_ledger.ledger.event.AccountEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a claim is verified, rejected or credited, so the user can be told.
 */
@Value
public class DepositClaimStatusChangedEvent implements AccountEvent {
    UUID eventId;
    UUID accountId;
    UUID claimId;
    String txHash;
    String status;
    BigDecimal verifiedAmount;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DepositClaimStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DepositClaimStatusChangedEvent from(DepositClaim claim) {
        return new DepositClaimStatusChangedEvent(
            UUID.randomUUID(),
            claim.getAccountId(),
            claim.getId(),
            claim.getTxHash(),
            claim.getStatus().name(),
            claim.getVerifiedAmount(),
            claim.getLastError(),
            Instant.now()
        );
    }
}
