package com.flagship.otp_rental.exception;

import java.util.UUID;

public class SessionNotFoundException extends RentalException {

    public SessionNotFoundException(UUID sessionId) {
        super("Rental session not found: " + sessionId);
    }
}
