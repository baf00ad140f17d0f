package com.flagship.credit_ledger.web;

import com.flagship.credit_ledger.conversion.ConversionDebit;
import com.flagship.credit_ledger.coordinator.ConversionCoordinator;
import com.flagship.credit_ledger.web.dto.ConversionRequest;
import com.flagship.credit_ledger.web.dto.ConversionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Conversion requests. Requires an Idempotency-Key header; repeating a key
 * returns the stored outcome without charging again. The response status
 * field tells FINALIZED (confirmation id present) from RELEASED (failure
 * reason present, credits returned).
 */
@RestController
@RequestMapping("/api/conversions")
@RequiredArgsConstructor
@Slf4j
public class ConversionController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final ConversionCoordinator coordinator;

    @PostMapping
    public ResponseEntity<ConversionResponse> convert(@Valid @RequestBody ConversionRequest request,
                                                      @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {
        log.info("Received conversion request: idempotencyKey={}", idempotencyKey);
        ConversionDebit debit = coordinator.convert(request.getUserKey(), request.getInstallationId(), idempotencyKey);
        return ResponseEntity.ok(ConversionResponse.from(debit));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<ConversionResponse> getConversion(@PathVariable("requestId") UUID requestId) {
        return coordinator.find(requestId)
            .map(debit -> ResponseEntity.ok(ConversionResponse.from(debit)))
            .orElse(ResponseEntity.notFound().build());
    }
}
