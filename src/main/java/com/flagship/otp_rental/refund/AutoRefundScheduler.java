package com.flagship.otp_rental.refund;

import com.flagship.otp_rental.config.RentalProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the auto-refund sweep on a fixed delay (two minutes by default).
 * <p>
 * fixedDelay measures from the end of one run, so a slow sweep pushes the next
 * one back instead of stacking up behind it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AutoRefundScheduler {

    private final AutoRefundService autoRefundService;
    private final RentalProperties properties;

    @Scheduled(fixedDelayString = "${rental.auto-refund.interval-ms:120000}",
               initialDelayString = "${rental.auto-refund.initial-delay-ms:10000}")
    public void runScheduledSweep() {
        if (!properties.getAutoRefund().isEnabled()) {
            log.debug("Auto-refund is disabled, skipping sweep");
            return;
        }

        try {
            autoRefundService.runScheduledSweep().ifPresent(result -> {
                if (result.getErrorCount() > 0) {
                    log.warn("Auto-refund sweep left {} sessions unresolved: {}",
                            result.getErrorCount(), result.getErrors());
                }
            });
        } catch (Exception e) {
            log.error("Scheduled auto-refund sweep failed", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        autoRefundService.stop(properties.getAutoRefund().getShutdownTimeout());
    }
}
