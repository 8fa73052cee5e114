package com.flagship.otp_rental.refund;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Result of checking the refund and balance invariants across sessions and the ledger.
 * Every list is empty on a healthy system.
 */
@Value
@Builder
public class RefundAuditReport {

    Instant checkedAt;

    /** Sessions flagged refunded without exactly one refund entry. */
    List<UUID> refundedWithoutSingleEntry;

    /** Completed sessions that nevertheless received a refund. */
    List<UUID> completedWithRefund;

    /** Expired or failed sessions still unrefunded past the grace period. */
    List<UUID> stuckUnrefunded;

    /** Waiting sessions past their TTL by more than the grace period, i.e. the sweep is behind. */
    List<UUID> overdueWaiting;

    List<BalanceMismatch> balanceMismatches;

    public boolean isHealthy() {
        return refundedWithoutSingleEntry.isEmpty()
                && completedWithRefund.isEmpty()
                && stuckUnrefunded.isEmpty()
                && overdueWaiting.isEmpty()
                && balanceMismatches.isEmpty();
    }

    @Value
    public static class BalanceMismatch {
        Long userId;
        BigDecimal storedBalance;
        BigDecimal sumOfEntries;
    }
}
