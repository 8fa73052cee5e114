package com.flagship.otp_rental.rental;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for {@code rental_sessions}.
 *
 * - No setters: status, OTP and refund flag only change through the guarded
 *   bulk updates in {@link RentalSessionRepository}
 * - Immutable columns are {@code updatable = false}
 * - {@link #fromDomain} is the only way to build one
 */
@Entity
@Table(
    name = "rental_sessions",
    indexes = {
        @Index(name = "idx_rental_sessions_user_status", columnList = "user_id, status, created_at"),
        @Index(name = "idx_rental_sessions_status_expires", columnList = "status, expires_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RentalSessionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "service_type", nullable = false, updatable = false, length = 32)
    private ServiceType serviceType;

    @Column(nullable = false, updatable = false, length = 64)
    private String carrier;

    @Column(name = "phone_number", nullable = false, updatable = false, length = 32)
    private String phoneNumber;

    @Column(name = "provider_handle", nullable = false, updatable = false, length = 128)
    private String providerHandle;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RentalStatus status;

    @Column(name = "otp_code", length = 32)
    private String otpCode;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal cost;

    @Column(nullable = false)
    private boolean refunded;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(nullable = false)
    private long version;

    @PrePersist
    void onCreate() {
        this.updatedAt = this.createdAt;
    }

    static RentalSessionEntity fromDomain(RentalSession session) {
        return new RentalSessionEntity(
            session.getId(),
            session.getUserId(),
            session.getServiceType(),
            session.getCarrier(),
            session.getPhoneNumber(),
            session.getProviderHandle(),
            session.getStatus(),
            session.getOtpCode(),
            session.getCost(),
            session.isRefunded(),
            session.getCreatedAt(),
            session.getExpiresAt(),
            session.getResolvedAt(),
            session.getRefundedAt(),
            null, // updatedAt - set by @PrePersist
            0L
        );
    }

    public RentalSession toDomain() {
        return new RentalSession(
            id,
            userId,
            serviceType,
            carrier,
            phoneNumber,
            providerHandle,
            status,
            otpCode,
            cost,
            refunded,
            createdAt,
            expiresAt,
            resolvedAt,
            refundedAt
        );
    }
}
