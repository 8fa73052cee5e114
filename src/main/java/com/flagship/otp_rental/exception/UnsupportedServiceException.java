package com.flagship.otp_rental.exception;

import com.flagship.otp_rental.rental.ServiceType;

/**
 * Unknown service code, or a known service type that is switched off in configuration.
 */
public class UnsupportedServiceException extends RentalException {

    public UnsupportedServiceException(String code) {
        super("Unsupported service type: " + code);
    }

    public UnsupportedServiceException(ServiceType serviceType) {
        super("Service type is not available: " + serviceType.getCode());
    }
}
