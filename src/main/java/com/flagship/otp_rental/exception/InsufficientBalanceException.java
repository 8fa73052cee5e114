package com.flagship.otp_rental.exception;

import java.math.BigDecimal;

/**
 * Thrown when a debit would take a user's balance below zero.
 */
public class InsufficientBalanceException extends RentalException {

    private final Long userId;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientBalanceException(Long userId, BigDecimal required, BigDecimal available) {
        super(String.format("Insufficient balance for user %d: required %s, available %s",
                userId, required.toPlainString(), available.toPlainString()));
        this.userId = userId;
        this.required = required;
        this.available = available;
    }

    public Long getUserId() {
        return userId;
    }

    public BigDecimal getRequired() {
        return required;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
