package com.flagship.credit_ledger.web;

import com.flagship.credit_ledger.admin.AdminService;
import com.flagship.credit_ledger.ledger.LedgerEvent;
import com.flagship.credit_ledger.pricing.CatalogSnapshot;
import com.flagship.credit_ledger.voucher.Voucher;
import com.flagship.credit_ledger.web.dto.AccountResponse;
import com.flagship.credit_ledger.web.dto.AdjustBalanceRequest;
import com.flagship.credit_ledger.web.dto.CreateVouchersRequest;
import com.flagship.credit_ledger.web.dto.LedgerEventResponse;
import com.flagship.credit_ledger.web.dto.PackageResponse;
import com.flagship.credit_ledger.web.dto.ReplaceCatalogRequest;
import com.flagship.credit_ledger.web.dto.VoucherResponse;
import com.flagship.credit_ledger.web.dto.VoucherStatsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Administrative endpoints. The X-Admin-Key header names the operator in the
 * audit log; authenticating it is left to the gateway in front of this service.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private static final String ADMIN_KEY_HEADER = "X-Admin-Key";

    private final AdminService adminService;

    @PostMapping("/vouchers")
    public ResponseEntity<List<VoucherResponse>> createVouchers(@Valid @RequestBody CreateVouchersRequest request,
                                                                @RequestHeader(ADMIN_KEY_HEADER) String adminKey) {
        List<Voucher> vouchers = adminService.createVouchers(request.getCount(), request.getAsset(), request.getAmount(),
            request.getPrefix(), request.getExpiresInDays(), adminKey);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(vouchers.stream().map(VoucherResponse::from).toList());
    }

    @PostMapping("/adjustments")
    public ResponseEntity<LedgerEventResponse> adjustBalance(@Valid @RequestBody AdjustBalanceRequest request,
                                                             @RequestHeader(ADMIN_KEY_HEADER) String adminKey) {
        LedgerEvent event = adminService.adjustBalance(request.getUserKey(), request.getAsset(), request.getAmount(),
            request.getReason(), adminKey);
        return ResponseEntity.ok(LedgerEventResponse.from(event));
    }

    @PostMapping("/accounts/{userKey}/suspend")
    public ResponseEntity<AccountResponse> suspend(@PathVariable("userKey") String userKey,
                                                   @RequestHeader(ADMIN_KEY_HEADER) String adminKey) {
        return ResponseEntity.ok(AccountResponse.from(adminService.suspend(userKey, adminKey)));
    }

    @PostMapping("/accounts/{userKey}/reactivate")
    public ResponseEntity<AccountResponse> reactivate(@PathVariable("userKey") String userKey,
                                                      @RequestHeader(ADMIN_KEY_HEADER) String adminKey) {
        return ResponseEntity.ok(AccountResponse.from(adminService.reactivate(userKey, adminKey)));
    }

    @PutMapping("/packages")
    public ResponseEntity<PackageResponse.Catalog> replaceCatalog(@Valid @RequestBody ReplaceCatalogRequest request,
                                                                  @RequestHeader(ADMIN_KEY_HEADER) String adminKey) {
        CatalogSnapshot snapshot = adminService.replaceCatalog(request.toPrices(), adminKey);
        return ResponseEntity.ok(PackageResponse.Catalog.from(snapshot));
    }

    @GetMapping("/vouchers/stats")
    public ResponseEntity<VoucherStatsResponse> voucherStats() {
        return ResponseEntity.ok(VoucherStatsResponse.from(adminService.voucherStats()));
    }
}
