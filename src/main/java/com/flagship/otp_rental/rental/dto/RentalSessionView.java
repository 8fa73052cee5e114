package com.flagship.otp_rental.rental.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.otp_rental.rental.RentalSession;
import com.flagship.otp_rental.rental.RentalStatus;
import com.flagship.otp_rental.rental.ServiceType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * What a client sees of a rental session. The provider handle stays internal.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RentalSessionView {
    UUID sessionId;
    ServiceType serviceType;
    String carrier;
    String phoneNumber;
    RentalStatus status;
    String otpCode;
    BigDecimal cost;
    boolean refunded;
    Instant createdAt;
    Instant expiresAt;
    Instant resolvedAt;

    public static RentalSessionView from(RentalSession session) {
        return RentalSessionView.builder()
                .sessionId(session.getId())
                .serviceType(session.getServiceType())
                .carrier(session.getCarrier())
                .phoneNumber(session.getPhoneNumber())
                .status(session.getStatus())
                .otpCode(session.getOtpCode())
                .cost(session.getCost())
                .refunded(session.isRefunded())
                .createdAt(session.getCreatedAt())
                .expiresAt(session.getExpiresAt())
                .resolvedAt(session.getResolvedAt())
                .build();
    }
}
