package com.flagship.credit_ledger.coordinator;

import com.flagship.credit_ledger.deposit.DepositClaim;
import com.flagship.credit_ledger.deposit.DepositClaimService;
import com.flagship.credit_ledger.deposit.DepositClaimStatus;
import com.flagship.credit_ledger.deposit.VerificationCancelledException;
import com.flagship.credit_ledger.pricing.PackageOrderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic repair of work left half-done by crashes or hung external calls:
 * stale conversion reservations, used vouchers without a credit, verified or
 * pending deposit claims, and expired package orders.
 */
@Component
@ConditionalOnProperty(name = "reconciliation.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ReconciliationScheduler {

    private final ConversionCoordinator conversionCoordinator;
    private final VoucherRedemptionService voucherRedemptionService;
    private final DepositSettlementService depositSettlementService;
    private final DepositClaimService claimService;
    private final PackageOrderService orderService;
    private final int batchSize;

    public ReconciliationScheduler(ConversionCoordinator conversionCoordinator,
                                   VoucherRedemptionService voucherRedemptionService,
                                   DepositSettlementService depositSettlementService,
                                   DepositClaimService claimService,
                                   PackageOrderService orderService,
                                   @Value("${reconciliation.batch-size:100}") int batchSize) {
        this.conversionCoordinator = conversionCoordinator;
        this.voucherRedemptionService = voucherRedemptionService;
        this.depositSettlementService = depositSettlementService;
        this.claimService = claimService;
        this.orderService = orderService;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${reconciliation.interval-ms:60000}")
    public void reconcile() {
        try {
            int released = conversionCoordinator.releaseStaleReservations(batchSize);
            int vouchers = voucherRedemptionService.creditRedeemedWithoutCredit(batchSize);
            int orders = orderService.expireStale(batchSize);
            if (released + vouchers + orders > 0) {
                log.info("Reconciliation pass: reservationsReleased={}, vouchersCredited={}, ordersExpired={}",
                        released, vouchers, orders);
            }
        } catch (RuntimeException e) {
            log.error("Reconciliation pass failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Credits VERIFIED claims first, then re-verifies PENDING ones.
     */
    @Scheduled(fixedDelayString = "${deposit.sweep.interval-ms:60000}")
    public void sweepDeposits() {
        int processed = 0;
        for (DepositClaimStatus status : new DepositClaimStatus[] {DepositClaimStatus.VERIFIED, DepositClaimStatus.PENDING}) {
            for (DepositClaim claim : claimService.findByStatus(status, batchSize)) {
                if (Thread.currentThread().isInterrupted()) {
                    return;
                }
                try {
                    depositSettlementService.process(claim.getTxHash());
                    processed++;
                } catch (VerificationCancelledException e) {
                    log.info("Deposit sweep cancelled");
                    return;
                } catch (RuntimeException e) {
                    log.error("Deposit sweep failed for claim: txHash={}, error={}", claim.getTxHash(), e.getMessage());
                }
            }
        }
        if (processed > 0) {
            log.info("Deposit sweep processed {} claims", processed);
        }
    }
}
