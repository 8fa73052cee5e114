package com.flagship.otp_rental.config;

import com.flagship.otp_rental.exception.UnsupportedServiceException;
import com.flagship.otp_rental.rental.ServiceType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of the {@code rental.*} configuration tree.
 *
 * <pre>
 * rental:
 *   services:
 *     phone-rental-v1: { price: 2100, ttl: PT6M }
 *   auto-refund:
 *     interval-ms: 120000
 *     batch-size: 500
 *   rate-limit:
 *     min-spacing: PT3S
 *     window: PT6M
 *     max-starts-per-window: 30
 *   provider:
 *     call-timeout: PT10S
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "rental")
public class RentalProperties {

    private Map<ServiceType, ServiceSettings> services = new LinkedHashMap<>();

    private AutoRefund autoRefund = new AutoRefund();

    private RateLimit rateLimit = new RateLimit();

    private Provider provider = new Provider();

    /**
     * Resolves the price and TTL for a service type.
     *
     * @throws UnsupportedServiceException if the type is not configured or is switched off
     */
    public ServiceSettings settingsFor(ServiceType serviceType) {
        ServiceSettings settings = services.get(serviceType);
        if (settings == null || !settings.isEnabled()) {
            throw new UnsupportedServiceException(serviceType);
        }
        return settings;
    }

    @Data
    public static class ServiceSettings {
        /** Amount debited when a rental starts, in VND. */
        private BigDecimal price;
        /** How long the number stays reserved before the session expires. */
        private Duration ttl = Duration.ofMinutes(6);
        private boolean enabled = true;
    }

    @Data
    public static class AutoRefund {
        private boolean enabled = true;
        private long intervalMs = 120_000;
        private int batchSize = 500;
        /** Upper bound on waiting for an in-flight sweep at shutdown. */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        /** Terminal sessions left unrefunded longer than this are reported by the audit. */
        private Duration auditGracePeriod = Duration.ofMinutes(10);
        /** How long a session that failed to settle is left out of later sweeps. */
        private Duration failureBackoff = Duration.ofMinutes(10);
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private Duration minSpacing = Duration.ofSeconds(3);
        private Duration window = Duration.ofMinutes(6);
        private int maxStartsPerWindow = 30;
        private long evictionIntervalMs = 60_000;
    }

    @Data
    public static class Provider {
        private Duration callTimeout = Duration.ofSeconds(10);
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        private float failureRateThreshold = 50f;
        private int slidingWindowSize = 10;
        private int minimumNumberOfCalls = 5;
        private Duration openStateWait = Duration.ofSeconds(30);
    }
}
