package com.flagship.credit_ledger.web;

import com.flagship.credit_ledger.conversion.InvalidInstallationIdException;
import com.flagship.credit_ledger.conversion.ProviderUnavailableException;
import com.flagship.credit_ledger.conversion.IdempotencyKeyConflictException;
import com.flagship.credit_ledger.conversion.ReservationExpiredException;
import com.flagship.credit_ledger.deposit.ChainLookupException;
import com.flagship.credit_ledger.deposit.DepositClaimConflictException;
import com.flagship.credit_ledger.deposit.VerificationCancelledException;
import com.flagship.credit_ledger.ledger.AccountNotFoundException;
import com.flagship.credit_ledger.ledger.AccountSuspendedException;
import com.flagship.credit_ledger.ledger.InsufficientFundsException;
import com.flagship.credit_ledger.pricing.UnknownPackageException;
import com.flagship.credit_ledger.voucher.VoucherAlreadyUsedException;
import com.flagship.credit_ledger.voucher.VoucherExpiredException;
import com.flagship.credit_ledger.voucher.VoucherNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain failures to HTTP statuses with a uniform error body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body could not be read", null);
    }

    @ExceptionHandler({IllegalArgumentException.class, InvalidInstallationIdException.class})
    public ResponseEntity<ErrorResponse> handleInvalidInput(RuntimeException e) {
        log.warn("Invalid request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(InsufficientFundsException e) {
        log.info("Insufficient funds: {}", e.getMessage());
        return respond(HttpStatus.PAYMENT_REQUIRED, "Insufficient Funds", e.getMessage(), Map.of(
            "asset", e.getAsset().name(),
            "available", e.getAvailable().toPlainString(),
            "requested", e.getRequested().toPlainString()));
    }

    @ExceptionHandler({AccountNotFoundException.class, VoucherNotFoundException.class, UnknownPackageException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
        log.info("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler({VoucherAlreadyUsedException.class, VoucherExpiredException.class,
        AccountSuspendedException.class, DepositClaimConflictException.class, ReservationExpiredException.class,
        IdempotencyKeyConflictException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException e) {
        log.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", e.getMessage(), null);
    }

    @ExceptionHandler({ProviderUnavailableException.class, ChainLookupException.class,
        VerificationCancelledException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(RuntimeException e) {
        log.warn("Upstream unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
