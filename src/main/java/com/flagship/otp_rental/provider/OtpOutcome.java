package com.flagship.otp_rental.provider;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of asking the provider whether an OTP arrived.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OtpOutcome {

    public enum Type {
        DELIVERED,
        NOT_YET_DELIVERED,
        CANCELLED
    }

    private static final OtpOutcome NOT_YET_DELIVERED = new OtpOutcome(Type.NOT_YET_DELIVERED, null);
    private static final OtpOutcome CANCELLED = new OtpOutcome(Type.CANCELLED, null);

    Type type;
    /** Only set for {@link Type#DELIVERED}. */
    String code;

    public static OtpOutcome delivered(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Delivered OTP code must not be blank");
        }
        return new OtpOutcome(Type.DELIVERED, code);
    }

    public static OtpOutcome notYetDelivered() {
        return NOT_YET_DELIVERED;
    }

    public static OtpOutcome cancelled() {
        return CANCELLED;
    }
}
