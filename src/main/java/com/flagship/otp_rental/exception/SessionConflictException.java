package com.flagship.otp_rental.exception;

import com.flagship.otp_rental.rental.RentalStatus;

import java.util.UUID;

/**
 * A guarded update found the session in a different state than expected:
 * another path (poll, sweep, cancellation) resolved it first.
 *
 * Callers on the poll and sweep paths treat this as "lost the race" and reload.
 */
public class SessionConflictException extends RentalException {

    private final UUID sessionId;
    private final RentalStatus actualStatus;

    public SessionConflictException(UUID sessionId, RentalStatus expected, RentalStatus actualStatus) {
        super(String.format("Session %s is %s, expected %s", sessionId, actualStatus, expected));
        this.sessionId = sessionId;
        this.actualStatus = actualStatus;
    }

    public SessionConflictException(UUID sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
        this.actualStatus = null;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public RentalStatus getActualStatus() {
        return actualStatus;
    }
}
