package com.flagship.otp_rental.rental.event;

import com.flagship.otp_rental.rental.RentalSession;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted in the transaction that expires or fails a session and returns its cost.
 */
@Value
public class RentalRefundedEvent implements RentalEvent {

    public static final String EVENT_TYPE = "RentalRefunded";

    UUID eventId;
    UUID sessionId;
    Long userId;
    String serviceType;
    String status;
    BigDecimal amount;
    BigDecimal balanceAfter;
    Instant occurredAt;

    public static RentalRefundedEvent from(RentalSession session, BigDecimal balanceAfter, Instant occurredAt) {
        return new RentalRefundedEvent(
            UUID.randomUUID(),
            session.getId(),
            session.getUserId(),
            session.getServiceType().getCode(),
            session.getStatus().toJson(),
            session.getCost(),
            balanceAfter,
            occurredAt
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
