package com.flagship.otp_rental.observability;

import com.flagship.otp_rental.refund.SweepResult;
import com.flagship.otp_rental.rental.RentalStatus;
import com.flagship.otp_rental.rental.ServiceType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Micrometer meters for rentals, refunds and provider calls.
 *
 * Metrics exposed:
 * - rental.started{service_type, outcome}
 * - rental.resolved{service_type, status}
 * - rental.otp.polls{outcome}
 * - rental.rate_limited{rule}
 * - refund.issued{service_type, trigger} and refund.amount
 * - refund.sweep.duration, refund.sweep.runs{trigger}, refund.sweep.errors
 * - provider.call.duration{operation, outcome}
 */
@Component
public class RentalMetrics {

    private final MeterRegistry registry;

    private final Timer sweepTimer;
    private final Counter sweepErrors;
    private final Counter sweepsSkipped;
    private final DistributionSummary refundAmount;

    public RentalMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.sweepTimer = Timer.builder("refund.sweep.duration")
                .description("Time taken by one auto-refund sweep")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.sweepErrors = Counter.builder("refund.sweep.errors")
                .description("Sessions a sweep could not settle")
                .register(registry);

        this.sweepsSkipped = Counter.builder("refund.sweep.skipped")
                .description("Scheduled sweeps skipped because another sweep was running")
                .register(registry);

        this.refundAmount = DistributionSummary.builder("refund.amount")
                .description("Amount returned per refunded rental")
                .baseUnit("vnd")
                .register(registry);
    }

    public void recordRentalStarted(ServiceType serviceType, String outcome) {
        registry.counter("rental.started",
                "service_type", serviceType.getCode(),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordRentalResolved(ServiceType serviceType, RentalStatus status) {
        registry.counter("rental.resolved",
                "service_type", serviceType.getCode(),
                "status", status.toJson()
        ).increment();
    }

    public void recordOtpPoll(String outcome) {
        registry.counter("rental.otp.polls", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordRateLimited(String rule) {
        registry.counter("rental.rate_limited", "rule", sanitizeTag(rule)).increment();
    }

    public void recordRefund(ServiceType serviceType, String trigger, BigDecimal amount) {
        registry.counter("refund.issued",
                "service_type", serviceType.getCode(),
                "trigger", sanitizeTag(trigger)
        ).increment();
        refundAmount.record(amount.doubleValue());
    }

    public void recordSweep(SweepResult result) {
        registry.counter("refund.sweep.runs", "trigger", result.getTrigger().name().toLowerCase()).increment();
        sweepTimer.record(Duration.ofMillis(result.getDurationMs()));
        sweepErrors.increment(result.getErrorCount());
    }

    public void recordSweepSkipped() {
        sweepsSkipped.increment();
    }

    public void recordProviderCall(String operation, String outcome, Duration duration) {
        registry.timer("provider.call.duration",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).record(duration);
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("rental.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values short and free of characters that blow up cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
