package com.flagship.otp_rental.refund;

import com.flagship.otp_rental.config.RentalProperties;
import com.flagship.otp_rental.exception.SessionConflictException;
import com.flagship.otp_rental.exception.SweepInProgressException;
import com.flagship.otp_rental.observability.CorrelationContext;
import com.flagship.otp_rental.observability.RentalMetrics;
import com.flagship.otp_rental.provider.RentalProviderGateway;
import com.flagship.otp_rental.rental.RentalSession;
import com.flagship.otp_rental.rental.RentalSessionStore;
import com.flagship.otp_rental.rental.RentalSettlementService;
import com.flagship.otp_rental.rental.RentalStatus;
import com.flagship.otp_rental.rental.RepairOutcome;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Expires and refunds WAITING sessions whose TTL elapsed without an OTP.
 *
 * Runs concurrently with interactive polls on the same sessions; the guarded
 * transition in {@link RentalSettlementService#expireAndRefund} decides who wins,
 * and a lost race is counted as skipped, not as an error.
 *
 * At most one sweep runs per instance: a scheduled run that finds another in
 * progress is skipped, a manual one is rejected.
 *
 * A session that fails is deferred for {@code failure-backoff} and left out of
 * later batches until then, so a few broken sessions cannot fill every batch.
 */
@Service
@Slf4j
public class AutoRefundService {

    static final String TRIGGER_TAG = "sweep";

    private final RentalSessionStore store;
    private final RentalSettlementService settlementService;
    private final RentalProviderGateway providerGateway;
    private final RentalProperties properties;
    private final RentalMetrics metrics;
    private final Clock clock;

    private final ReentrantLock sweepLock = new ReentrantLock();
    private final AtomicLong totalChecks = new AtomicLong();
    private final Map<UUID, Instant> deferredUntil = new ConcurrentHashMap<>();
    private volatile Instant lastCheck;
    private volatile Instant lastCompletedAt;
    private volatile SweepResult lastResult;
    private volatile boolean stopped = false;

    public AutoRefundService(RentalSessionStore store,
                             RentalSettlementService settlementService,
                             RentalProviderGateway providerGateway,
                             RentalProperties properties,
                             RentalMetrics metrics,
                             Clock clock) {
        this.store = store;
        this.settlementService = settlementService;
        this.providerGateway = providerGateway;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Sweep entry point for the scheduler.
     *
     * @return empty if the service is stopped or another sweep holds the lock
     */
    public Optional<SweepResult> runScheduledSweep() {
        if (stopped) {
            return Optional.empty();
        }
        if (!sweepLock.tryLock()) {
            log.warn("Auto-refund sweep already in progress, skipping scheduled run");
            metrics.recordSweepSkipped();
            return Optional.empty();
        }
        try {
            return Optional.of(sweep(SweepTrigger.SCHEDULED));
        } finally {
            sweepLock.unlock();
        }
    }

    /**
     * Sweep entry point for operators.
     *
     * @throws SweepInProgressException if a sweep is already running
     * @throws IllegalStateException if the service is shutting down
     */
    public SweepResult runManualSweep() {
        if (stopped) {
            throw new IllegalStateException("Auto-refund service is shutting down");
        }
        if (!sweepLock.tryLock()) {
            throw new SweepInProgressException();
        }
        try {
            return sweep(SweepTrigger.MANUAL);
        } finally {
            sweepLock.unlock();
        }
    }

    /**
     * Refuses further sweeps and waits up to {@code timeout} for one in flight.
     */
    public void stop(Duration timeout) {
        stopped = true;
        try {
            if (sweepLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                sweepLock.unlock();
                log.info("Auto-refund service stopped");
            } else {
                log.warn("Auto-refund sweep still running after {}, stopping anyway", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the auto-refund sweep to finish");
        }
    }

    public AutoRefundStatus getStatus() {
        RentalProperties.AutoRefund config = properties.getAutoRefund();
        Duration interval = Duration.ofMillis(config.getIntervalMs());
        boolean running = config.isEnabled() && !stopped;

        return AutoRefundStatus.builder()
                .running(running)
                .sweepInProgress(sweepLock.isLocked())
                .lastCheck(lastCheck)
                .nextCheck(running && lastCompletedAt != null ? lastCompletedAt.plus(interval) : null)
                .interval(interval.getSeconds())
                .totalChecks(totalChecks.get())
                .lastResult(lastResult)
                .build();
    }

    private SweepResult sweep(SweepTrigger trigger) {
        CorrelationContext.setCorrelationId(null);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        int batchSize = properties.getAutoRefund().getBatchSize();
        Instant startedAt = clock.instant();
        SweepResult result = SweepResult.started(trigger, startedAt);

        try {
            deferredUntil.values().removeIf(until -> !until.isAfter(startedAt));
            int overfetch = deferredUntil.size();

            List<RentalSession> expired = withoutDeferred(
                    store.findExpiredWaiting(startedAt, batchSize + overfetch), batchSize, result);
            log.info("Auto-refund sweep started ({}): {} expired waiting sessions, {} deferred",
                    trigger, expired.size(), overfetch);
            for (RentalSession session : expired) {
                expireAndRefund(session, result);
            }

            List<RentalSession> unrefunded = withoutDeferred(
                    store.findUnrefundedTerminal(batchSize + overfetch), batchSize, result);
            for (RentalSession session : unrefunded) {
                repair(session, result);
            }

            result.setCompletedAt(clock.instant());
            totalChecks.incrementAndGet();
            lastCheck = startedAt;
            lastCompletedAt = result.getCompletedAt();
            lastResult = result;
            metrics.recordSweep(result);

            log.info("Auto-refund sweep finished in {}ms: refunded={} {}, amount={}, skipped={}, repaired={}, deferred={}, errors={}",
                    result.getDurationMs(), result.getRefundedCount(), result.getRefundedByServiceType(),
                    result.getRefundedAmount(), result.getSkippedCount(), result.getRepairedCount(),
                    result.getDeferredCount(), result.getErrorCount());
            return result;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clear();
        }
    }

    private void expireAndRefund(RentalSession session, SweepResult result) {
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, session.getId().toString());
        try {
            settlementService.expireAndRefund(session.getId(), RentalStatus.EXPIRED);
            result.recordRefund(session.getServiceType(), session.getCost());
            metrics.recordRentalResolved(session.getServiceType(), RentalStatus.EXPIRED);
            metrics.recordRefund(session.getServiceType(), TRIGGER_TAG, session.getCost());
            deferredUntil.remove(session.getId());
            releaseQuietly(session);
        } catch (SessionConflictException | ConcurrencyFailureException e) {
            log.debug("Session resolved by another path, skipping: {}", e.getMessage());
            deferredUntil.remove(session.getId());
            result.incrementSkipped();
        } catch (Exception e) {
            log.error("Failed to expire and refund session: {}", e.getMessage(), e);
            recordFailure(session, e, result);
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
        }
    }

    private void repair(RentalSession session, SweepResult result) {
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, session.getId().toString());
        try {
            RepairOutcome outcome = settlementService.repairRefund(session.getId());
            deferredUntil.remove(session.getId());
            if (outcome.isRepaired()) {
                result.incrementRepaired();
            } else {
                result.incrementSkipped();
            }
            if (outcome == RepairOutcome.CREDITED) {
                metrics.recordRefund(session.getServiceType(), "repair", session.getCost());
            }
        } catch (SessionConflictException | ConcurrencyFailureException e) {
            log.debug("Refund repaired concurrently, skipping: {}", e.getMessage());
            deferredUntil.remove(session.getId());
            result.incrementSkipped();
        } catch (Exception e) {
            log.error("Failed to repair refund: {}", e.getMessage(), e);
            recordFailure(session, e, result);
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
        }
    }

    private List<RentalSession> withoutDeferred(List<RentalSession> candidates, int limit, SweepResult result) {
        List<RentalSession> selected = new ArrayList<>(Math.min(limit, candidates.size()));
        for (RentalSession session : candidates) {
            if (deferredUntil.containsKey(session.getId())) {
                result.incrementDeferred();
            } else if (selected.size() < limit) {
                selected.add(session);
            }
        }
        return selected;
    }

    private void recordFailure(RentalSession session, Exception e, SweepResult result) {
        Instant now = clock.instant();
        deferredUntil.put(session.getId(), now.plus(properties.getAutoRefund().getFailureBackoff()));
        result.addError(session.getId(), e.getMessage(), now);
    }

    private void releaseQuietly(RentalSession session) {
        try {
            providerGateway.release(session.getProviderHandle());
        } catch (RuntimeException e) {
            log.warn("Failed to release number {} after expiry: {}", session.getPhoneNumber(), e.getMessage());
        }
    }
}
