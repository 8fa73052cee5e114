package com.flagship.otp_rental.provider;

public enum ProviderErrorCode {
    /** Upstream has no free number for the requested service and carrier. */
    NO_NUMBERS_AVAILABLE,
    /** Upstream is throttling our account. */
    RATE_LIMITED,
    /** Upstream did not answer in time, or the circuit is open. */
    UPSTREAM_TIMEOUT
}
