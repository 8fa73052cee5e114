package com.flagship.otp_rental.refund;

import com.flagship.otp_rental.rental.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Statistics of one auto-refund sweep. Filled in by the sweeping thread, then
 * published as the scheduler's last result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SweepResult {

    private SweepTrigger trigger;
    private Instant startedAt;
    private Instant completedAt;

    /** Sessions expired and refunded in this run, keyed by service code. */
    @Builder.Default
    private Map<String, Integer> refundedByServiceType = new LinkedHashMap<>();

    @Builder.Default
    private int refundedCount = 0;

    @Builder.Default
    private BigDecimal refundedAmount = BigDecimal.ZERO;

    /** Sessions another path resolved between the query and the transition. */
    @Builder.Default
    private int skippedCount = 0;

    /** Terminal sessions whose missing refund was completed by the repair pass. */
    @Builder.Default
    private int repairedCount = 0;

    /** Sessions left out of this run because they failed recently. */
    @Builder.Default
    private int deferredCount = 0;

    @Builder.Default
    private List<SweepError> errors = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SweepError {
        private UUID sessionId;
        private String errorMessage;
        private Instant occurredAt;
    }

    public static SweepResult started(SweepTrigger trigger, Instant startedAt) {
        return SweepResult.builder().trigger(trigger).startedAt(startedAt).build();
    }

    public void recordRefund(ServiceType serviceType, BigDecimal amount) {
        refundedByServiceType.merge(serviceType.getCode(), 1, Integer::sum);
        refundedCount++;
        refundedAmount = refundedAmount.add(amount);
    }

    public void incrementSkipped() {
        skippedCount++;
    }

    public void incrementRepaired() {
        repairedCount++;
    }

    public void incrementDeferred() {
        deferredCount++;
    }

    public void addError(UUID sessionId, String errorMessage, Instant occurredAt) {
        errors.add(SweepError.builder()
                .sessionId(sessionId)
                .errorMessage(errorMessage)
                .occurredAt(occurredAt)
                .build());
    }

    public int getErrorCount() {
        return errors.size();
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
