package com.flagship.otp_rental.rental;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a rental session.
 *
 * State machine:
 * WAITING → COMPLETED (OTP delivered)
 * WAITING → EXPIRED   (TTL elapsed, refunded)
 * WAITING → FAILED    (provider cancelled, refunded)
 */
public enum RentalStatus {
    /**
     * Number reserved and paid for, OTP not yet received.
     */
    WAITING,

    /**
     * OTP delivered. Terminal; the debit stands.
     */
    COMPLETED,

    /**
     * TTL elapsed without an OTP. Terminal; the debit is refunded.
     */
    EXPIRED,

    /**
     * Upstream cancelled the reservation. Terminal; the debit is refunded.
     */
    FAILED;

    /** Terminal states whose debit is returned to the user. */
    public static final Set<RentalStatus> REFUNDABLE = EnumSet.of(EXPIRED, FAILED);

    public boolean isTerminal() {
        return this != WAITING;
    }

    public boolean isRefundable() {
        return REFUNDABLE.contains(this);
    }

    public boolean canTransitionTo(RentalStatus target) {
        return switch (this) {
            case WAITING -> target != WAITING;
            case COMPLETED, EXPIRED, FAILED -> false;
        };
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
