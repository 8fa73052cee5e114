package com.flagship.otp_rental.config;

/**
 * Request headers understood by the REST layer.
 */
public final class ApiHeaders {

    /**
     * Caller identity, resolved from the bearer token by the gateway in front of this service.
     */
    public static final String USER_ID = "X-User-Id";

    public static final String RETRY_AFTER = "Retry-After";

    private ApiHeaders() {
    }
}
