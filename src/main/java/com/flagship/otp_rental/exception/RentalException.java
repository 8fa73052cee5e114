package com.flagship.otp_rental.exception;

/**
 * Base class for the domain errors raised by rentals, the balance ledger,
 * the provider gateway and the auto-refund sweep.
 */
public class RentalException extends RuntimeException {

    public RentalException(String message) {
        super(message);
    }

    public RentalException(String message, Throwable cause) {
        super(message, cause);
    }
}
