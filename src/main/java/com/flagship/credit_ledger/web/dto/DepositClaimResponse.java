package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.deposit.DepositClaim;
import com.flagship.credit_ledger.deposit.DepositClaimStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class DepositClaimResponse {

    @JsonProperty("tx_hash")
    String txHash;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("status")
    DepositClaimStatus status;

    @JsonProperty("claimed_amount")
    BigDecimal claimedAmount;

    @JsonProperty("expected_amount")
    BigDecimal expectedAmount;

    @JsonProperty("verified_amount")
    BigDecimal verifiedAmount;

    @JsonProperty("verification_attempts")
    int verificationAttempts;

    @JsonProperty("last_error")
    String lastError;

    @JsonProperty("review_required")
    boolean reviewRequired;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("credited_at")
    Instant creditedAt;

    public static DepositClaimResponse from(DepositClaim claim) {
        return DepositClaimResponse.builder()
            .txHash(claim.getTxHash())
            .accountId(claim.getAccountId())
            .status(claim.getStatus())
            .claimedAmount(claim.getClaimedAmount())
            .expectedAmount(claim.getExpectedAmount())
            .verifiedAmount(claim.getVerifiedAmount())
            .verificationAttempts(claim.getVerificationAttempts())
            .lastError(claim.getLastError())
            .reviewRequired(claim.isReviewRequired())
            .createdAt(claim.getCreatedAt())
            .creditedAt(claim.getCreditedAt())
            .build();
    }
}
