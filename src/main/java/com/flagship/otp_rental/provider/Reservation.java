package com.flagship.otp_rental.provider;

import lombok.Value;

/**
 * A number held for us by the upstream provider.
 */
@Value
public class Reservation {
    String phoneNumber;
    /** Opaque upstream id used to poll for the OTP and to release the number. */
    String providerHandle;
}
