package com.flagship.credit_ledger.web;

import com.flagship.credit_ledger.coordinator.DepositSettlementService;
import com.flagship.credit_ledger.deposit.DepositClaim;
import com.flagship.credit_ledger.deposit.DepositClaimService;
import com.flagship.credit_ledger.deposit.DepositClaimStatus;
import com.flagship.credit_ledger.web.dto.DepositClaimRequest;
import com.flagship.credit_ledger.web.dto.DepositClaimResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * Deposit claims. A claim still PENDING after processing is answered with
 * 202; the client resubmits or waits for the sweep.
 */
@RestController
@RequestMapping("/api/deposits")
@RequiredArgsConstructor
@Slf4j
public class DepositController {

    private final DepositSettlementService settlementService;
    private final DepositClaimService claimService;

    @PostMapping
    public ResponseEntity<DepositClaimResponse> submitClaim(@Valid @RequestBody DepositClaimRequest request) {
        log.info("Received deposit claim: txHash={}, amount={}", request.getTxHash(), request.getAmount());

        DepositClaim claim = settlementService.submitClaim(request.getUserKey(), request.getTxHash(), request.getAmount());

        HttpStatus status = claim.getStatus() == DepositClaimStatus.PENDING ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(DepositClaimResponse.from(claim));
    }

    @GetMapping("/{txHash}")
    public ResponseEntity<DepositClaimResponse> getClaim(@PathVariable("txHash") String txHash) {
        return claimService.findByTxHash(txHash.trim().toLowerCase(Locale.ROOT))
            .map(claim -> ResponseEntity.ok(DepositClaimResponse.from(claim)))
            .orElse(ResponseEntity.notFound().build());
    }
}
