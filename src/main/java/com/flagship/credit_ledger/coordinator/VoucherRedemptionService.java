package com.flagship.credit_ledger.coordinator;

import com.flagship.credit_ledger.ledger.Account;
import com.flagship.credit_ledger.ledger.AccountService;
import com.flagship.credit_ledger.ledger.LedgerEvent;
import com.flagship.credit_ledger.ledger.LedgerEventKind;
import com.flagship.credit_ledger.ledger.LedgerService;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.flagship.credit_ledger.voucher.Voucher;
import com.flagship.credit_ledger.voucher.VoucherAlreadyUsedException;
import com.flagship.credit_ledger.voucher.VoucherExpiredException;
import com.flagship.credit_ledger.voucher.VoucherNotFoundException;
import com.flagship.credit_ledger.voucher.VoucherRegistry;
import com.flagship.credit_ledger.voucher.VoucherValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Voucher redemption: flip the voucher to used, then credit its value with
 * the voucher code as reference.
 *
 * The two steps are separate transactions. Once the voucher is used, the
 * credit is retried on storage failure and, failing that, re-applied by the
 * reconciliation sweep; the ledger deduplicates by code.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoucherRedemptionService {

    private final AccountService accountService;
    private final VoucherRegistry voucherRegistry;
    private final LedgerService ledgerService;
    private final StorageRetryExecutor retryExecutor;
    private final LedgerMetrics metrics;

    /**
     * @throws VoucherNotFoundException if the code does not exist
     * @throws VoucherAlreadyUsedException if the code was already redeemed
     * @throws VoucherExpiredException if the voucher has expired
     */
    public LedgerEvent redeem(String userKey, String code) {
        // Suspended accounts may redeem: credits are never refused.
        Account account = accountService.getOrCreate(userKey);

        VoucherValue value;
        try {
            value = voucherRegistry.redeem(code, account.getId());
        } catch (VoucherNotFoundException e) {
            metrics.recordVoucherRedemption("not_found");
            throw e;
        } catch (VoucherAlreadyUsedException e) {
            metrics.recordVoucherRedemption("already_used");
            throw e;
        } catch (VoucherExpiredException e) {
            metrics.recordVoucherRedemption("expired");
            throw e;
        } catch (ConcurrencyFailureException e) {
            // Lock timeout or serialization failure against a concurrent redemption.
            Voucher current = voucherRegistry.find(code).orElseThrow(() -> e);
            if (!current.isUsed()) {
                throw e;
            }
            metrics.recordVoucherRedemption("already_used");
            throw new VoucherAlreadyUsedException(current.getCode());
        }

        String reference = code.trim().toUpperCase(Locale.ROOT);
        LedgerEvent event = retryExecutor.execute("voucher_credit", reference,
            () -> ledgerService.credit(account.getId(), value.getAsset(), value.getAmount(),
                LedgerEventKind.VOUCHER_CREDIT, reference, "voucher"));

        metrics.recordVoucherRedemption("success");
        log.info("Voucher credited: code={}, accountId={}, asset={}, amount={}",
                reference, account.getId(), value.getAsset(), value.getAmount());
        return event;
    }

    /**
     * Re-applies the credit for used vouchers that have none.
     *
     * @return number of vouchers credited
     */
    public int creditRedeemedWithoutCredit(int limit) {
        List<Voucher> missing = voucherRegistry.findRedeemedWithoutCredit(limit);
        int credited = 0;
        for (Voucher voucher : missing) {
            try {
                ledgerService.credit(voucher.getRedeemedBy(), voucher.getValue().getAsset(),
                        voucher.getValue().getAmount(), LedgerEventKind.VOUCHER_CREDIT, voucher.getCode(), "voucher");
                credited++;
                log.warn("Voucher credit recovered by reconciliation: code={}, accountId={}",
                        voucher.getCode(), voucher.getRedeemedBy());
            } catch (RuntimeException e) {
                log.error("Voucher credit reconciliation failed: code={}, accountId={}, error={}",
                        voucher.getCode(), voucher.getRedeemedBy(), e.getMessage());
            }
        }
        return credited;
    }
}
