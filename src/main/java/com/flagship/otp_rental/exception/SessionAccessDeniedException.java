package com.flagship.otp_rental.exception;

import java.util.UUID;

/**
 * The caller asked about a session owned by another user.
 */
public class SessionAccessDeniedException extends RentalException {

    public SessionAccessDeniedException(UUID sessionId, Long userId) {
        super(String.format("User %d does not own rental session %s", userId, sessionId));
    }
}
