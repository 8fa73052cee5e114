package com.flagship.otp_rental.provider;

import com.flagship.otp_rental.exception.RentalException;

import java.util.concurrent.TimeoutException;

/**
 * Thrown when the upstream number provider fails.
 * Surfaces to clients as 502 once retries are exhausted.
 */
public class ProviderException extends RentalException {

    private final ProviderErrorCode code;
    private final boolean retryable;

    public ProviderException(ProviderErrorCode code, String message) {
        this(code, message, true, null);
    }

    public ProviderException(ProviderErrorCode code, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }

    public ProviderErrorCode getCode() {
        return code;
    }

    /**
     * False when retrying cannot help, e.g. the circuit breaker is open.
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * True when the call timed out on our side, so the upstream may still have carried it out.
     */
    public boolean isOutcomeUnknown() {
        return getCause() instanceof TimeoutException;
    }
}
