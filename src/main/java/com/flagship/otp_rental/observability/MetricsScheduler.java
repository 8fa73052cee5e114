package com.flagship.otp_rental.observability;

import com.flagship.otp_rental.rental.RentalSessionRepository;
import com.flagship.otp_rental.rental.RentalStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Refreshes gauges that need a database query: the outbox backlog and the
 * number of rentals still waiting for their OTP.
 */
@Component
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final RentalSessionRepository sessionRepository;
    private final AtomicLong waitingSessions = new AtomicLong();

    public MetricsScheduler(OutboxMetrics outboxMetrics,
                            RentalSessionRepository sessionRepository,
                            MeterRegistry meterRegistry) {
        this.outboxMetrics = outboxMetrics;
        this.sessionRepository = sessionRepository;

        Gauge.builder("rental.sessions.waiting", waitingSessions, AtomicLong::get)
                .description("Rental sessions still waiting for an OTP")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            waitingSessions.set(sessionRepository.countByStatus(RentalStatus.WAITING));
        } catch (Exception e) {
            log.warn("Failed to refresh waiting session gauge: {}", e.getMessage());
        }
    }

    long getWaitingSessions() {
        return waitingSessions.get();
    }
}
