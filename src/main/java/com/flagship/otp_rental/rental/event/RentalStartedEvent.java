package com.flagship.otp_rental.rental.event;

import com.flagship.otp_rental.rental.RentalSession;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted in the transaction that debits the user and opens the session.
 */
@Value
public class RentalStartedEvent implements RentalEvent {

    public static final String EVENT_TYPE = "RentalStarted";

    UUID eventId;
    UUID sessionId;
    Long userId;
    String serviceType;
    String carrier;
    String phoneNumber;
    BigDecimal cost;
    Instant expiresAt;
    Instant occurredAt;

    public static RentalStartedEvent from(RentalSession session) {
        return new RentalStartedEvent(
            UUID.randomUUID(),
            session.getId(),
            session.getUserId(),
            session.getServiceType().getCode(),
            session.getCarrier(),
            session.getPhoneNumber(),
            session.getCost(),
            session.getExpiresAt(),
            session.getCreatedAt()
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
