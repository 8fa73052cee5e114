package com.flagship.otp_rental.rental;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Domain model of one rental attempt.
 *
 * Immutable snapshot: status changes go through {@link RentalSessionStore#transition},
 * never through this object, so that two concurrent resolvers cannot both win.
 */
@Value
public class RentalSession {
    UUID id;
    Long userId;
    ServiceType serviceType;
    String carrier;
    String phoneNumber;
    String providerHandle;
    RentalStatus status;
    String otpCode;
    BigDecimal cost;
    boolean refunded;
    Instant createdAt;
    Instant expiresAt;
    Instant resolvedAt;
    Instant refundedAt;

    /**
     * A freshly paid-for session waiting for its OTP.
     */
    public static RentalSession open(UUID id, Long userId, ServiceType serviceType, String carrier,
                                     String phoneNumber, String providerHandle, BigDecimal cost,
                                     Instant createdAt, Instant expiresAt) {
        if (cost == null || cost.signum() <= 0) {
            throw new IllegalArgumentException("Rental cost must be positive");
        }
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("Rental must expire after it is created");
        }
        return new RentalSession(id, userId, serviceType, carrier, phoneNumber, providerHandle,
                RentalStatus.WAITING, null, cost, false, createdAt, expiresAt, null, null);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isOwnedBy(Long candidateUserId) {
        return userId.equals(candidateUserId);
    }

    /**
     * True once the TTL has elapsed, whether or not anything resolved the session yet.
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
