package com.flagship.otp_rental.provider;

import com.flagship.otp_rental.rental.ServiceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Queue;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-process stand-in for the upstream SMS number provider.
 * <p>
 * Simulates:
 * - number reservation per carrier
 * - OTP delivery, either scripted or after a configurable delay
 * - network latency, random failures and full outages
 * <p>
 * Real provider integrations implement {@link RentalProviderGateway} the same
 * way and replace this bean under the {@code upstreamProviderGateway} name.
 */
@Component("upstreamProviderGateway")
@Slf4j
public class SimulatedProviderGateway implements RentalProviderGateway {

    private final Map<String, SimulatedRental> rentals = new ConcurrentHashMap<>();
    private final Queue<ProviderErrorCode> scriptedReserveFailures = new ConcurrentLinkedQueue<>();
    private final Random random = new Random();
    private final Clock clock;

    @Value("${provider.simulated.failure-rate:0.0}")
    private double failureRate;

    @Value("${provider.simulated.latency-ms:50}")
    private long latencyMs;

    /** Negative disables automatic delivery; OTPs then only arrive via {@link #deliverOtp}. */
    @Value("${provider.simulated.auto-deliver-after-ms:-1}")
    private long autoDeliverAfterMs;

    /** How long the upstream remembers a number after it was released, or reserved if never released. */
    @Value("${provider.simulated.retention-ms:1800000}")
    private long retentionMs = 1_800_000;

    private volatile boolean simulateOutage = false;

    public SimulatedProviderGateway(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Reservation reserve(ServiceType serviceType, String carrier) {
        simulateLatency();
        failIfUnavailable("reserve");

        ProviderErrorCode scripted = scriptedReserveFailures.poll();
        if (scripted != null) {
            throw new ProviderException(scripted, "Scripted reserve failure: " + scripted,
                    scripted != ProviderErrorCode.NO_NUMBERS_AVAILABLE, null);
        }

        String handle = "SIM-" + UUID.randomUUID();
        String phoneNumber = generatePhoneNumber(carrier);
        rentals.put(handle, new SimulatedRental(phoneNumber, serviceType, clock.instant()));

        log.debug("Reserved number {} for {} on carrier {} (handle={})",
                phoneNumber, serviceType.getCode(), carrier, handle);
        return new Reservation(phoneNumber, handle);
    }

    @Override
    public OtpOutcome pollOtp(String providerHandle) {
        simulateLatency();
        failIfUnavailable("pollOtp");

        SimulatedRental rental = rentals.get(providerHandle);
        if (rental == null || rental.released) {
            // Upstream forgets released or unknown numbers
            return OtpOutcome.cancelled();
        }

        if (rental.outcome == null && autoDeliverAfterMs >= 0
                && Duration.between(rental.reservedAt, clock.instant()).toMillis() >= autoDeliverAfterMs) {
            rental.outcome = OtpOutcome.delivered(String.format("%06d", random.nextInt(1_000_000)));
        }

        return rental.outcome != null ? rental.outcome : OtpOutcome.notYetDelivered();
    }

    @Override
    public void release(String providerHandle) {
        simulateLatency();
        failIfUnavailable("release");

        SimulatedRental rental = rentals.get(providerHandle);
        if (rental != null) {
            rental.releasedAt = clock.instant();
            rental.released = true;
            log.debug("Released number {} for {} (handle={})",
                    rental.phoneNumber, rental.serviceType.getCode(), providerHandle);
        }
    }

    /**
     * Forgets numbers older than the retention period; later polls for them
     * read as cancelled, like an upstream that recycled the number.
     */
    @Scheduled(fixedDelayString = "${provider.simulated.eviction-interval-ms:60000}")
    public void evictStaleRentals() {
        Instant cutoff = clock.instant().minusMillis(retentionMs);
        int before = rentals.size();
        rentals.values().removeIf(rental -> rental.lastActivity().isBefore(cutoff));
        int evicted = before - rentals.size();
        if (evicted > 0) {
            log.debug("Evicted {} stale simulated rentals", evicted);
        }
    }

    int trackedRentalCount() {
        return rentals.size();
    }

    // ==================== Test control methods ====================

    /**
     * Makes the next poll for this handle return the given code.
     */
    public void deliverOtp(String providerHandle, String code) {
        requireRental(providerHandle).outcome = OtpOutcome.delivered(code);
    }

    /**
     * Makes the next poll for this handle report a cancellation.
     */
    public void cancel(String providerHandle) {
        requireRental(providerHandle).outcome = OtpOutcome.cancelled();
    }

    /**
     * Queues a failure for an upcoming reserve call.
     */
    public void failNextReserve(ProviderErrorCode code) {
        scriptedReserveFailures.add(code);
    }

    public void setSimulateOutage(boolean simulateOutage) {
        this.simulateOutage = simulateOutage;
        log.info("Simulated provider outage mode: {}", simulateOutage);
    }

    public void setLatencyMs(long latencyMs) {
        this.latencyMs = latencyMs;
    }

    public void setFailureRate(double failureRate) {
        this.failureRate = failureRate;
    }

    public boolean isReleased(String providerHandle) {
        SimulatedRental rental = rentals.get(providerHandle);
        return rental != null && rental.released;
    }

    public void reset() {
        rentals.clear();
        scriptedReserveFailures.clear();
        simulateOutage = false;
    }

    private SimulatedRental requireRental(String providerHandle) {
        SimulatedRental rental = rentals.get(providerHandle);
        if (rental == null) {
            throw new IllegalArgumentException("Unknown provider handle: " + providerHandle);
        }
        return rental;
    }

    private void failIfUnavailable(String operation) {
        if (simulateOutage) {
            throw new ProviderException(ProviderErrorCode.UPSTREAM_TIMEOUT,
                    "Provider is unavailable (" + operation + ")");
        }
        if (failureRate > 0 && random.nextDouble() < failureRate) {
            throw new ProviderException(ProviderErrorCode.UPSTREAM_TIMEOUT,
                    "Simulated network failure during " + operation);
        }
    }

    private void simulateLatency() {
        if (latencyMs <= 0) {
            return;
        }
        try {
            Thread.sleep(latencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderErrorCode.UPSTREAM_TIMEOUT,
                    "Interrupted while waiting for provider", true, e);
        }
    }

    private String generatePhoneNumber(String carrier) {
        String prefix = switch (carrier == null ? "" : carrier.toUpperCase(Locale.ROOT)) {
            case "VIETTEL" -> "03";
            case "VINAPHONE" -> "08";
            case "MOBIFONE" -> "07";
            default -> "09";
        };
        return prefix + String.format("%08d", random.nextInt(100_000_000));
    }

    private static final class SimulatedRental {
        private final String phoneNumber;
        private final ServiceType serviceType;
        private final Instant reservedAt;
        private volatile OtpOutcome outcome;
        private volatile boolean released;
        private volatile Instant releasedAt;

        private SimulatedRental(String phoneNumber, ServiceType serviceType, Instant reservedAt) {
            this.phoneNumber = phoneNumber;
            this.serviceType = serviceType;
            this.reservedAt = reservedAt;
        }

        private Instant lastActivity() {
            Instant released = releasedAt;
            return released != null ? released : reservedAt;
        }
    }
}
