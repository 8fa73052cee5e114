package com.flagship.otp_rental.exception;

import java.time.Duration;

/**
 * Thrown when a user starts rentals faster than the configured limits allow.
 */
public class RateLimitedException extends RentalException {

    private final Duration retryAfter;

    public RateLimitedException(Long userId, Duration retryAfter, String rule) {
        super(String.format("Too many rental starts for user %d (%s), retry in %ds",
                userId, rule, retryAfterSeconds(retryAfter)));
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * Whole seconds for the Retry-After header, never less than one.
     */
    public long getRetryAfterSeconds() {
        return retryAfterSeconds(retryAfter);
    }

    private static long retryAfterSeconds(Duration retryAfter) {
        long millis = Math.max(0, retryAfter.toMillis());
        return Math.max(1, (millis + 999) / 1000);
    }
}
