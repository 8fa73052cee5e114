package com.flagship.otp_rental.provider;

import com.flagship.otp_rental.rental.ServiceType;

/**
 * Port to the upstream SMS number provider.
 *
 * Implementations perform blocking network calls. Callers must never invoke
 * them while holding a database transaction.
 */
public interface RentalProviderGateway {

    /**
     * Reserves a number for the given service and carrier.
     *
     * @throws ProviderException with NO_NUMBERS_AVAILABLE, RATE_LIMITED or UPSTREAM_TIMEOUT
     */
    Reservation reserve(ServiceType serviceType, String carrier);

    /**
     * Asks whether the OTP arrived. Safe to call repeatedly.
     *
     * @throws ProviderException if the provider cannot be reached
     */
    OtpOutcome pollOtp(String providerHandle);

    /**
     * Returns the number to the provider. Best effort.
     */
    void release(String providerHandle);
}
