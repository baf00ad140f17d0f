package com.flagship.credit_ledger.conversion;

import java.util.UUID;

/**
 * Finalize arrived after the reservation was already released.
 */
public class ReservationExpiredException extends RuntimeException {

    public ReservationExpiredException(UUID requestId) {
        super("Reservation " + requestId + " was already released");
    }
}
