package com.flagship.otp_rental.rental;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.otp_rental.exception.UnsupportedServiceException;

/**
 * Rental products offered to users. Each maps to one upstream provider
 * account with its own price and TTL.
 */
public enum ServiceType {
    PHONE_RENTAL_V1("phone-rental-v1"),
    PHONE_RENTAL_V2("phone-rental-v2"),
    PHONE_RENTAL_V3("phone-rental-v3"),
    TIKTOK_RENTAL("tiktok-rental");

    private final String code;

    ServiceType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Accepts the wire code and, for convenience, the constant name.
     */
    @JsonCreator
    public static ServiceType fromCode(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (ServiceType type : values()) {
                if (type.code.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                    return type;
                }
            }
        }
        throw new UnsupportedServiceException(value);
    }
}
