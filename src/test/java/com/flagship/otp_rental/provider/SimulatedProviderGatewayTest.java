package com.flagship.otp_rental.provider;

import com.flagship.otp_rental.rental.ServiceType;
import com.flagship.otp_rental.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedProviderGatewayTest {

    private MutableClock clock;
    private SimulatedProviderGateway gateway;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        gateway = new SimulatedProviderGateway(clock);
        ReflectionTestUtils.setField(gateway, "autoDeliverAfterMs", -1L);
    }

    @Test
    @DisplayName("Reserved number follows the carrier prefix and waits for its OTP")
    void reserveAndWait() {
        Reservation reservation = gateway.reserve(ServiceType.PHONE_RENTAL_V1, "viettel");

        assertTrue(reservation.getPhoneNumber().startsWith("03"));
        assertEquals(10, reservation.getPhoneNumber().length());
        assertEquals(OtpOutcome.Type.NOT_YET_DELIVERED, gateway.pollOtp(reservation.getProviderHandle()).getType());
    }

    @Test
    @DisplayName("Delivered code is returned by the next poll")
    void deliveredCode() {
        Reservation reservation = gateway.reserve(ServiceType.TIKTOK_RENTAL, "MOBIFONE");
        gateway.deliverOtp(reservation.getProviderHandle(), "909090");

        OtpOutcome outcome = gateway.pollOtp(reservation.getProviderHandle());

        assertEquals(OtpOutcome.Type.DELIVERED, outcome.getType());
        assertEquals("909090", outcome.getCode());
    }

    @Test
    @DisplayName("Released and unknown handles read as cancelled")
    void releasedIsCancelled() {
        Reservation reservation = gateway.reserve(ServiceType.TIKTOK_RENTAL, "random");
        gateway.release(reservation.getProviderHandle());

        assertTrue(gateway.isReleased(reservation.getProviderHandle()));
        assertEquals(OtpOutcome.Type.CANCELLED, gateway.pollOtp(reservation.getProviderHandle()).getType());
        assertEquals(OtpOutcome.Type.CANCELLED, gateway.pollOtp("SIM-unknown").getType());
    }

    @Test
    @DisplayName("Numbers past the retention period are forgotten, released or not")
    void staleRentalsEvicted() {
        Reservation abandoned = gateway.reserve(ServiceType.PHONE_RENTAL_V1, "VIETTEL");
        clock.advance(Duration.ofMinutes(20));
        Reservation released = gateway.reserve(ServiceType.PHONE_RENTAL_V1, "VIETTEL");
        gateway.release(released.getProviderHandle());

        clock.advance(Duration.ofMinutes(15));
        gateway.evictStaleRentals();

        assertEquals(1, gateway.trackedRentalCount());
        assertEquals(OtpOutcome.Type.CANCELLED, gateway.pollOtp(abandoned.getProviderHandle()).getType());
        assertTrue(gateway.isReleased(released.getProviderHandle()));

        clock.advance(Duration.ofMinutes(30));
        gateway.evictStaleRentals();

        assertEquals(0, gateway.trackedRentalCount());
    }

    @Test
    @DisplayName("Auto delivery produces a six digit code once the delay has passed")
    void autoDelivery() {
        ReflectionTestUtils.setField(gateway, "autoDeliverAfterMs", 20_000L);
        Reservation reservation = gateway.reserve(ServiceType.PHONE_RENTAL_V2, "VINAPHONE");

        assertEquals(OtpOutcome.Type.NOT_YET_DELIVERED, gateway.pollOtp(reservation.getProviderHandle()).getType());
        clock.advance(Duration.ofSeconds(20));
        OtpOutcome outcome = gateway.pollOtp(reservation.getProviderHandle());

        assertEquals(OtpOutcome.Type.DELIVERED, outcome.getType());
        assertTrue(outcome.getCode().matches("\\d{6}"));
    }

    @Test
    @DisplayName("Outage mode fails every call with a retryable timeout")
    void outage() {
        gateway.setSimulateOutage(true);

        ProviderException e = assertThrows(ProviderException.class, () ->
                gateway.reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL"));

        assertEquals(ProviderErrorCode.UPSTREAM_TIMEOUT, e.getCode());
        assertTrue(e.isRetryable());
    }

    @Test
    @DisplayName("Scripted empty pool is not retryable")
    void scriptedNoNumbers() {
        gateway.failNextReserve(ProviderErrorCode.NO_NUMBERS_AVAILABLE);

        ProviderException e = assertThrows(ProviderException.class, () ->
                gateway.reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL"));

        assertEquals(ProviderErrorCode.NO_NUMBERS_AVAILABLE, e.getCode());
        assertFalse(e.isRetryable());
        assertNotNull(gateway.reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL"));
    }
}
