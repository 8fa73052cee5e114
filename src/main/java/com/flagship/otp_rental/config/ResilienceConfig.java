package com.flagship.otp_rental.config;

import com.flagship.otp_rental.provider.ProviderErrorCode;
import com.flagship.otp_rental.provider.ProviderException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j registries guarding calls to the upstream number provider.
 * <p>
 * Every provider call is bounded by the time limiter, retried with
 * exponential backoff, and short-circuited while the provider keeps failing.
 * <p>
 * Circuit states:
 * - CLOSED: calls pass through
 * - OPEN: provider is failing, calls fail fast without touching the network
 * - HALF_OPEN: a few trial calls decide whether to close again
 */
@Configuration
public class ResilienceConfig {

    /**
     * Retry configuration for reserving numbers. A reserve that timed out may
     * still have taken a number upstream, and retrying would take a second one.
     */
    public static final String RESERVE_RETRY_CONFIG = "reserve";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(RentalProperties properties) {
        RentalProperties.Provider provider = properties.getProvider();

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(provider.getSlidingWindowSize())
                .minimumNumberOfCalls(provider.getMinimumNumberOfCalls())
                .failureRateThreshold(provider.getFailureRateThreshold())
                .waitDurationInOpenState(provider.getOpenStateWait())
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                // An empty number pool is a normal answer, not a sign the provider is down
                .recordException(e -> !(e instanceof ProviderException pe)
                        || pe.getCode() != ProviderErrorCode.NO_NUMBERS_AVAILABLE)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public RetryRegistry retryRegistry(RentalProperties properties) {
        RentalProperties.Provider provider = properties.getProvider();

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(provider.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        provider.getRetryBackoff(), provider.getBackoffMultiplier()))
                .retryOnException(e -> e instanceof ProviderException pe && pe.isRetryable())
                .build();

        RetryConfig reserveConfig = RetryConfig.from(config)
                .retryOnException(e -> e instanceof ProviderException pe
                        && pe.isRetryable() && !pe.isOutcomeUnknown())
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.addConfiguration(RESERVE_RETRY_CONFIG, reserveConfig);
        return registry;
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(RentalProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(properties.getProvider().getCallTimeout())
                .cancelRunningFuture(true)
                .build();

        return TimeLimiterRegistry.of(config);
    }
}
