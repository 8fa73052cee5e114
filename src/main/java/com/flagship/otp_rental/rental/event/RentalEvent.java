package com.flagship.otp_rental.rental.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Lifecycle event of a rental session, serialized to JSON into the outbox.
 */
public interface RentalEvent {

    UUID getEventId();

    UUID getSessionId();

    Long getUserId();

    Instant getOccurredAt();

    String getEventType();
}
