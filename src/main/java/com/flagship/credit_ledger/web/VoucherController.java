package com.flagship.credit_ledger.web;

import com.flagship.credit_ledger.coordinator.VoucherRedemptionService;
import com.flagship.credit_ledger.ledger.LedgerEvent;
import com.flagship.credit_ledger.voucher.VoucherNotFoundException;
import com.flagship.credit_ledger.voucher.VoucherRegistry;
import com.flagship.credit_ledger.web.dto.LedgerEventResponse;
import com.flagship.credit_ledger.web.dto.RedeemVoucherRequest;
import com.flagship.credit_ledger.web.dto.VoucherResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/vouchers")
@RequiredArgsConstructor
@Slf4j
public class VoucherController {

    private final VoucherRedemptionService redemptionService;
    private final VoucherRegistry voucherRegistry;

    @PostMapping("/redeem")
    public ResponseEntity<LedgerEventResponse> redeem(@Valid @RequestBody RedeemVoucherRequest request) {
        log.info("Received voucher redemption: code={}", request.getCode());
        LedgerEvent event = redemptionService.redeem(request.getUserKey(), request.getCode());
        return ResponseEntity.ok(LedgerEventResponse.from(event));
    }

    @GetMapping("/{code}")
    public ResponseEntity<VoucherResponse> getVoucher(@PathVariable("code") String code) {
        return voucherRegistry.find(code)
            .map(voucher -> ResponseEntity.ok(VoucherResponse.from(voucher)))
            .orElseThrow(() -> new VoucherNotFoundException(code));
    }
}
