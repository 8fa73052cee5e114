package com.flagship.otp_rental.provider;

import com.flagship.otp_rental.config.ResilienceConfig;
import com.flagship.otp_rental.observability.RentalMetrics;
import com.flagship.otp_rental.rental.ServiceType;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Provider gateway that wraps the upstream implementation with Resilience4j.
 * <p>
 * Decoration order, outermost first:
 * Retry → CircuitBreaker → TimeLimiter → upstream call
 * <p>
 * So each attempt is individually bounded by the timeout, every attempt is
 * counted by the circuit breaker, and the caller only sees an error once
 * retries are exhausted or the circuit refuses the call.
 */
@Component
@Primary
@Slf4j
public class GuardedProviderGateway implements RentalProviderGateway {

    static final String INSTANCE_NAME = "rentalProvider";
    static final String RESERVE_INSTANCE_NAME = "rentalProviderReserve";

    private final RentalProviderGateway upstream;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final Retry reserveRetry;
    private final TimeLimiter timeLimiter;
    private final RentalMetrics metrics;
    private final ExecutorService executor;

    public GuardedProviderGateway(@Qualifier("upstreamProviderGateway") RentalProviderGateway upstream,
                                  CircuitBreakerRegistry circuitBreakerRegistry,
                                  RetryRegistry retryRegistry,
                                  TimeLimiterRegistry timeLimiterRegistry,
                                  RentalMetrics metrics) {
        this.upstream = upstream;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(INSTANCE_NAME);
        this.retry = retryRegistry.retry(INSTANCE_NAME);
        this.reserveRetry = retryRegistry.retry(RESERVE_INSTANCE_NAME, ResilienceConfig.RESERVE_RETRY_CONFIG);
        this.timeLimiter = timeLimiterRegistry.timeLimiter(INSTANCE_NAME);
        this.metrics = metrics;
        this.executor = Executors.newCachedThreadPool(providerThreadFactory());

        this.circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Provider circuit breaker transition: {}", event.getStateTransition()));
        this.retry.getEventPublisher().onRetry(event ->
                log.info("Retrying provider call (attempt {}): {}",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        this.reserveRetry.getEventPublisher().onRetry(event ->
                log.info("Retrying provider reserve (attempt {}): {}",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    @Override
    public Reservation reserve(ServiceType serviceType, String carrier) {
        // Not retried after a timeout: the number may already be ours upstream
        return call("reserve", reserveRetry, () -> upstream.reserve(serviceType, carrier));
    }

    @Override
    public OtpOutcome pollOtp(String providerHandle) {
        return call("poll", retry, () -> upstream.pollOtp(providerHandle));
    }

    @Override
    public void release(String providerHandle) {
        call("release", retry, () -> {
            upstream.release(providerHandle);
            return null;
        });
    }

    public CircuitBreaker.State getCircuitState() {
        return circuitBreaker.getState();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private <T> T call(String operation, Retry attemptRetry, Supplier<T> upstreamCall) {
        long startTime = System.nanoTime();
        Supplier<T> limited = () -> callWithTimeout(operation, upstreamCall);
        Supplier<T> guarded = Retry.decorateSupplier(attemptRetry,
                CircuitBreaker.decorateSupplier(circuitBreaker, limited));

        try {
            T result = guarded.get();
            metrics.recordProviderCall(operation, "success", elapsedSince(startTime));
            return result;
        } catch (CallNotPermittedException e) {
            metrics.recordProviderCall(operation, "circuit_open", elapsedSince(startTime));
            throw new ProviderException(ProviderErrorCode.UPSTREAM_TIMEOUT,
                    "Provider circuit is open, " + operation + " not attempted", false, e);
        } catch (ProviderException e) {
            metrics.recordProviderCall(operation, e.getCode().name().toLowerCase(), elapsedSince(startTime));
            throw e;
        }
    }

    private <T> T callWithTimeout(String operation, Supplier<T> upstreamCall) {
        try {
            return timeLimiter.executeFutureSupplier(() -> executor.submit(upstreamCall::get));
        } catch (TimeoutException e) {
            throw new ProviderException(ProviderErrorCode.UPSTREAM_TIMEOUT,
                    "Provider " + operation + " timed out after " + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(),
                    true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderErrorCode.UPSTREAM_TIMEOUT,
                    "Interrupted during provider " + operation, false, e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderException(ProviderErrorCode.UPSTREAM_TIMEOUT,
                    "Provider " + operation + " failed: " + e.getMessage(), true, e);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ThreadFactory providerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "provider-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
