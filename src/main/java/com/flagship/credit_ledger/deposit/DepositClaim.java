package com.flagship.credit_ledger.deposit;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A user's assertion that an on-chain transfer funds their account.
 *
 * Identity is the transaction hash. Transitions are explicit and return a new
 * instance; invalid transitions throw IllegalStateException.
 */
@Value
public class DepositClaim {
    UUID id;
    String txHash;
    UUID accountId;
    BigDecimal claimedAmount;
    BigDecimal expectedAmount;
    BigDecimal verifiedAmount;
    DepositClaimStatus status;
    int verificationAttempts;
    String lastError;
    boolean reviewRequired;
    Instant createdAt;
    Instant updatedAt;
    Instant creditedAt;

    public static DepositClaim create(String txHash, UUID accountId, BigDecimal claimedAmount, BigDecimal expectedAmount) {
        Instant now = Instant.now();
        return new DepositClaim(UUID.randomUUID(), txHash, accountId, claimedAmount, expectedAmount, null,
            DepositClaimStatus.PENDING, 0, null, false, now, now, null);
    }

    /**
     * PENDING -> VERIFIED with the amount that will be credited.
     */
    public DepositClaim markVerified(BigDecimal amount, int attempts) {
        requireStatus(DepositClaimStatus.PENDING, "verify");
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Verified amount must be positive");
        }
        return new DepositClaim(id, txHash, accountId, claimedAmount, expectedAmount, amount,
            DepositClaimStatus.VERIFIED, verificationAttempts + attempts, null, false,
            createdAt, Instant.now(), null);
    }

    public DepositClaim markCredited() {
        requireStatus(DepositClaimStatus.VERIFIED, "credit");
        Instant now = Instant.now();
        return new DepositClaim(id, txHash, accountId, claimedAmount, expectedAmount, verifiedAmount,
            DepositClaimStatus.CREDITED, verificationAttempts, null, false, createdAt, now, now);
    }

    public DepositClaim reject(String reason, int attempts) {
        requireStatus(DepositClaimStatus.PENDING, "reject");
        return new DepositClaim(id, txHash, accountId, claimedAmount, expectedAmount, null,
            DepositClaimStatus.REJECTED, verificationAttempts + attempts, reason, false,
            createdAt, Instant.now(), null);
    }

    /**
     * Stays PENDING; records the attempt and whether a human has to look at it.
     */
    public DepositClaim recordInconclusive(String error, int attempts, boolean needsReview) {
        requireStatus(DepositClaimStatus.PENDING, "record an attempt on");
        return new DepositClaim(id, txHash, accountId, claimedAmount, expectedAmount, null,
            DepositClaimStatus.PENDING, verificationAttempts + attempts, error, needsReview,
            createdAt, Instant.now(), null);
    }

    public boolean isTerminal() {
        return status == DepositClaimStatus.CREDITED || status == DepositClaimStatus.REJECTED;
    }

    public boolean canTransitionTo(DepositClaimStatus target) {
        if (status == target) {
            return true;
        }
        return switch (status) {
            case PENDING -> target == DepositClaimStatus.VERIFIED || target == DepositClaimStatus.REJECTED;
            case VERIFIED -> target == DepositClaimStatus.CREDITED;
            case CREDITED, REJECTED -> false;
        };
    }

    private void requireStatus(DepositClaimStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(String.format(
                "Cannot %s deposit claim %s in %s status. Only %s claims allow it.", action, txHash, status, expected));
        }
    }
}
