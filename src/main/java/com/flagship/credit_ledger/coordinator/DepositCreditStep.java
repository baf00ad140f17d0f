package com.flagship.credit_ledger.coordinator;

import com.flagship.credit_ledger.deposit.DepositClaim;
import com.flagship.credit_ledger.deposit.DepositClaimService;
import com.flagship.credit_ledger.deposit.DepositClaimStatus;
import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.ledger.LedgerEventKind;
import com.flagship.credit_ledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * The VERIFIED -> CREDITED bridge as one transaction: lock the claim, credit
 * the verified amount under the transaction hash, mark the claim credited.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class DepositCreditStep {

    private final DepositClaimService claimService;
    private final LedgerService ledgerService;

    @Transactional
    public DepositClaim creditVerifiedClaim(String txHash) {
        DepositClaim claim = claimService.lockForCredit(txHash);

        if (claim.getStatus() == DepositClaimStatus.CREDITED) {
            log.info("Deposit already credited: txHash={}", txHash);
            return claim;
        }
        if (claim.getStatus() != DepositClaimStatus.VERIFIED) {
            throw new IllegalStateException(String.format(
                "Cannot credit deposit claim %s in %s status", txHash, claim.getStatus()));
        }

        ledgerService.credit(claim.getAccountId(), Asset.FUNDS, claim.getVerifiedAmount(),
                LedgerEventKind.DEPOSIT_CREDIT, txHash, "deposit");
        return claimService.markCredited(txHash);
    }
}
