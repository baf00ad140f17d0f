package com.flagship.credit_ledger.web;

import com.flagship.credit_ledger.coordinator.PackageCheckoutService;
import com.flagship.credit_ledger.pricing.PackageOrder;
import com.flagship.credit_ledger.pricing.PackagePurchase;
import com.flagship.credit_ledger.pricing.PricingCatalog;
import com.flagship.credit_ledger.web.dto.PackageOrderResponse;
import com.flagship.credit_ledger.web.dto.PackageResponse;
import com.flagship.credit_ledger.web.dto.PurchaseResponse;
import com.flagship.credit_ledger.web.dto.UserKeyRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/packages")
@Slf4j
public class PackageController {

    private final PricingCatalog catalog;
    private final PackageCheckoutService checkoutService;
    private final String depositAddress;

    public PackageController(PricingCatalog catalog,
                             PackageCheckoutService checkoutService,
                             @Value("${deposit.wallet-address}") String depositAddress) {
        this.catalog = catalog;
        this.checkoutService = checkoutService;
        this.depositAddress = depositAddress;
    }

    @GetMapping
    public ResponseEntity<PackageResponse.Catalog> listPackages() {
        return ResponseEntity.ok(PackageResponse.Catalog.from(catalog.snapshot()));
    }

    @PostMapping("/{packageId}/purchase")
    public ResponseEntity<PurchaseResponse> purchase(@PathVariable("packageId") String packageId,
                                                     @Valid @RequestBody UserKeyRequest request) {
        log.info("Received package purchase: packageId={}", packageId);
        PackagePurchase purchase = checkoutService.purchase(request.getUserKey(), packageId);
        return ResponseEntity.status(HttpStatus.CREATED).body(PurchaseResponse.from(purchase));
    }

    @PostMapping("/{packageId}/orders")
    public ResponseEntity<PackageOrderResponse> openOrder(@PathVariable("packageId") String packageId,
                                                          @Valid @RequestBody UserKeyRequest request) {
        log.info("Received package order: packageId={}", packageId);
        PackageOrder order = checkoutService.openOrder(request.getUserKey(), packageId);
        return ResponseEntity.status(HttpStatus.CREATED).body(PackageOrderResponse.from(order, depositAddress));
    }
}
