package com.flagship.otp_rental.rental.event;

import com.flagship.otp_rental.rental.RentalSession;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when the OTP arrives. The code itself is not part of the event.
 */
@Value
public class RentalCompletedEvent implements RentalEvent {

    public static final String EVENT_TYPE = "RentalCompleted";

    UUID eventId;
    UUID sessionId;
    Long userId;
    String serviceType;
    BigDecimal cost;
    Instant occurredAt;

    public static RentalCompletedEvent from(RentalSession session) {
        return new RentalCompletedEvent(
            UUID.randomUUID(),
            session.getId(),
            session.getUserId(),
            session.getServiceType().getCode(),
            session.getCost(),
            session.getResolvedAt()
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
