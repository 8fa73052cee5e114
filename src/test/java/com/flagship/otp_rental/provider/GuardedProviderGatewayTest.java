package com.flagship.otp_rental.provider;

import com.flagship.otp_rental.config.RentalProperties;
import com.flagship.otp_rental.config.ResilienceConfig;
import com.flagship.otp_rental.observability.RentalMetrics;
import com.flagship.otp_rental.rental.ServiceType;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Retry, circuit breaker and timeout around the upstream provider, with a mocked upstream.
 */
class GuardedProviderGatewayTest {

    private RentalProviderGateway upstream;
    private GuardedProviderGateway gateway;

    @BeforeEach
    void setUp() {
        RentalProperties properties = new RentalProperties();
        RentalProperties.Provider provider = properties.getProvider();
        provider.setMaxAttempts(3);
        provider.setRetryBackoff(Duration.ofMillis(1));
        provider.setCallTimeout(Duration.ofMillis(200));
        provider.setSlidingWindowSize(4);
        provider.setMinimumNumberOfCalls(4);
        provider.setOpenStateWait(Duration.ofMinutes(1));

        ResilienceConfig config = new ResilienceConfig();
        upstream = mock(RentalProviderGateway.class);
        gateway = new GuardedProviderGateway(upstream,
                config.circuitBreakerRegistry(properties),
                config.retryRegistry(properties),
                config.timeLimiterRegistry(properties),
                new RentalMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        gateway.shutdown();
    }

    @Test
    @DisplayName("Transient failure is retried and the second attempt wins")
    void retriesTransientFailure() {
        Reservation reservation = new Reservation("0312345678", "SIM-1");
        when(upstream.reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL"))
                .thenThrow(new ProviderException(ProviderErrorCode.UPSTREAM_TIMEOUT, "blip"))
                .thenReturn(reservation);

        assertEquals(reservation, gateway.reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL"));
        verify(upstream, times(2)).reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL");
    }

    @Test
    @DisplayName("Non-retryable failure surfaces after one attempt")
    void nonRetryableNotRetried() {
        when(upstream.reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL"))
                .thenThrow(new ProviderException(ProviderErrorCode.NO_NUMBERS_AVAILABLE, "empty", false, null));

        ProviderException e = assertThrows(ProviderException.class, () ->
                gateway.reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL"));

        assertEquals(ProviderErrorCode.NO_NUMBERS_AVAILABLE, e.getCode());
        verify(upstream, times(1)).reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL");
    }

    @Test
    @DisplayName("Slow upstream call times out as UPSTREAM_TIMEOUT")
    void slowCallTimesOut() {
        when(upstream.pollOtp("SIM-1")).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return OtpOutcome.notYetDelivered();
        });

        ProviderException e = assertThrows(ProviderException.class, () -> gateway.pollOtp("SIM-1"));

        assertEquals(ProviderErrorCode.UPSTREAM_TIMEOUT, e.getCode());
    }

    @Test
    @DisplayName("Timed-out reserve is not retried, since the number may already be taken upstream")
    void timedOutReserveNotRetried() {
        when(upstream.reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL")).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return new Reservation("0312345678", "SIM-slow");
        });

        ProviderException e = assertThrows(ProviderException.class, () ->
                gateway.reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL"));

        assertEquals(ProviderErrorCode.UPSTREAM_TIMEOUT, e.getCode());
        assertTrue(e.isOutcomeUnknown());
        verify(upstream, times(1)).reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL");
    }

    @Test
    @DisplayName("Timed-out poll is retried")
    void timedOutPollRetried() {
        when(upstream.pollOtp("SIM-1"))
                .thenAnswer(invocation -> {
                    Thread.sleep(2_000);
                    return OtpOutcome.notYetDelivered();
                })
                .thenReturn(OtpOutcome.delivered("424242"));

        assertEquals("424242", gateway.pollOtp("SIM-1").getCode());
        verify(upstream, times(2)).pollOtp("SIM-1");
    }

    @Test
    @DisplayName("Repeated failures open the circuit, after which calls fail fast")
    void circuitOpensAfterFailures() {
        when(upstream.pollOtp("SIM-1"))
                .thenThrow(new ProviderException(ProviderErrorCode.UPSTREAM_TIMEOUT, "down"));

        // Two guarded calls, three attempts each, fill the sliding window
        assertThrows(ProviderException.class, () -> gateway.pollOtp("SIM-1"));
        assertThrows(ProviderException.class, () -> gateway.pollOtp("SIM-1"));
        assertEquals(CircuitBreaker.State.OPEN, gateway.getCircuitState());

        clearInvocations(upstream);
        ProviderException e = assertThrows(ProviderException.class, () -> gateway.pollOtp("SIM-1"));

        assertFalse(e.isRetryable());
        verifyNoInteractions(upstream);
    }

    @Test
    @DisplayName("Empty number pool does not count against the circuit")
    void noNumbersDoesNotOpenCircuit() {
        when(upstream.reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL"))
                .thenThrow(new ProviderException(ProviderErrorCode.NO_NUMBERS_AVAILABLE, "empty", false, null));

        for (int i = 0; i < 6; i++) {
            assertThrows(ProviderException.class, () -> gateway.reserve(ServiceType.TIKTOK_RENTAL, "VIETTEL"));
        }

        assertEquals(CircuitBreaker.State.CLOSED, gateway.getCircuitState());
    }
}
