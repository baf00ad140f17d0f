package com.flagship.credit_ledger.coordinator;

import com.flagship.credit_ledger.deposit.DepositClaim;
import com.flagship.credit_ledger.deposit.DepositClaimService;
import com.flagship.credit_ledger.deposit.DepositClaimStatus;
import com.flagship.credit_ledger.deposit.VerificationCancelledException;
import com.flagship.credit_ledger.pricing.PackageOrderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReconciliationSchedulerTest {

    private ConversionCoordinator conversionCoordinator;
    private VoucherRedemptionService voucherRedemptionService;
    private DepositSettlementService depositSettlementService;
    private DepositClaimService claimService;
    private PackageOrderService orderService;
    private ReconciliationScheduler scheduler;

    @BeforeEach
    void setUp() {
        conversionCoordinator = mock(ConversionCoordinator.class);
        voucherRedemptionService = mock(VoucherRedemptionService.class);
        depositSettlementService = mock(DepositSettlementService.class);
        claimService = mock(DepositClaimService.class);
        orderService = mock(PackageOrderService.class);
        scheduler = new ReconciliationScheduler(conversionCoordinator, voucherRedemptionService,
                depositSettlementService, claimService, orderService, 25);
    }

    private static DepositClaim claim(String txHash) {
        return DepositClaim.create(txHash, UUID.randomUUID(), BigDecimal.TEN, BigDecimal.TEN);
    }

    @Test
    @DisplayName("Reconciliation pass runs every repair with the batch size")
    void reconcileRunsAllRepairs() {
        scheduler.reconcile();

        verify(conversionCoordinator).releaseStaleReservations(25);
        verify(voucherRedemptionService).creditRedeemedWithoutCredit(25);
        verify(orderService).expireStale(25);
    }

    @Test
    @DisplayName("A failing repair does not escape the scheduler thread")
    void reconcileSurvivesFailure() {
        when(conversionCoordinator.releaseStaleReservations(25)).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> scheduler.reconcile());
    }

    @Test
    @DisplayName("Sweep credits verified claims before re-verifying pending ones and skips failures")
    void sweepOrderAndFailures() {
        when(claimService.findByStatus(DepositClaimStatus.VERIFIED, 25)).thenReturn(List.of(claim("v1")));
        when(claimService.findByStatus(DepositClaimStatus.PENDING, 25)).thenReturn(List.of(claim("p1"), claim("p2")));
        when(depositSettlementService.process("p1")).thenThrow(new IllegalStateException("conflict"));

        scheduler.sweepDeposits();

        InOrder order = inOrder(depositSettlementService);
        order.verify(depositSettlementService).process("v1");
        order.verify(depositSettlementService).process("p1");
        order.verify(depositSettlementService).process("p2");
    }

    @Test
    @DisplayName("Cancelled verification stops the sweep")
    void sweepStopsOnCancellation() {
        when(claimService.findByStatus(DepositClaimStatus.VERIFIED, 25)).thenReturn(List.of());
        when(claimService.findByStatus(DepositClaimStatus.PENDING, 25)).thenReturn(List.of(claim("p1"), claim("p2")));
        when(depositSettlementService.process("p1")).thenThrow(new VerificationCancelledException("p1"));

        scheduler.sweepDeposits();

        verify(depositSettlementService, never()).process("p2");
    }
}
