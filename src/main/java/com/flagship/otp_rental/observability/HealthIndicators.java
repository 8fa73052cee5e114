package com.flagship.otp_rental.observability;

import com.flagship.otp_rental.outbox.OutboxEventRepository;
import com.flagship.otp_rental.provider.GuardedProviderGateway;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Actuator health indicators specific to the rental service.
 */
public class HealthIndicators {

    /**
     * Outbox backlog: WARNING past a thousand pending events, DOWN past ten thousand.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1_000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10_000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis backs only the start-rental rate limiter, which falls back to
     * per-instance limits, so an unreachable Redis is DEGRADED rather than DOWN.
     */
    @Component("rateLimiterRedisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Rate limiting falls back to per-instance limits";

        private final Optional<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(Optional<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            if (redisTemplate.isEmpty()) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis is not configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            RedisConnectionFactory connectionFactory = redisTemplate.get().getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String response = connection.ping();
                return "PONG".equals(response)
                        ? Health.up().withDetail("response", response).build()
                        : Health.status("DEGRADED").withDetail("response", String.valueOf(response)).build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    /**
     * Reports the provider circuit breaker. An open circuit means new rentals fail fast.
     */
    @Component("providerHealth")
    public static class ProviderHealthIndicator implements HealthIndicator {

        private final GuardedProviderGateway providerGateway;

        public ProviderHealthIndicator(GuardedProviderGateway providerGateway) {
            this.providerGateway = providerGateway;
        }

        @Override
        public Health health() {
            CircuitBreaker.State state = providerGateway.getCircuitState();
            Health.Builder builder = switch (state) {
                case CLOSED, DISABLED, METRICS_ONLY -> Health.up();
                case HALF_OPEN -> Health.status("DEGRADED");
                default -> Health.down();
            };
            return builder.withDetail("circuitState", state.name()).build();
        }
    }
}
