package com.flagship.otp_rental.refund;

import com.flagship.otp_rental.config.RentalProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Read-only consistency check over rental sessions and the balance ledger.
 *
 * Looks for duplicate or missing refunds, refunds on completed sessions,
 * refunds stuck behind a failing sweep, and balances that drifted from their entries.
 */
@Service
@Slf4j
public class RefundAuditService {

    private final JdbcTemplate jdbcTemplate;
    private final RentalProperties properties;
    private final Clock clock;

    public RefundAuditService(JdbcTemplate jdbcTemplate, RentalProperties properties, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public RefundAuditReport audit() {
        Instant now = clock.instant();
        OffsetDateTime graceCutoff = OffsetDateTime.ofInstant(
                now.minus(properties.getAutoRefund().getAuditGracePeriod()), ZoneOffset.UTC);

        List<UUID> refundedWithoutSingleEntry = sessionIds(
            "SELECT s.id FROM rental_sessions s " +
            "WHERE s.refunded = TRUE AND (SELECT COUNT(*) FROM balance_ledger_entries e " +
            "  WHERE e.related_session_id = s.id AND e.reason = 'RENTAL_REFUND') <> 1");

        List<UUID> completedWithRefund = sessionIds(
            "SELECT s.id FROM rental_sessions s " +
            "WHERE s.status = 'COMPLETED' AND EXISTS (SELECT 1 FROM balance_ledger_entries e " +
            "  WHERE e.related_session_id = s.id AND e.reason = 'RENTAL_REFUND')");

        List<UUID> stuckUnrefunded = sessionIds(
            "SELECT s.id FROM rental_sessions s " +
            "WHERE s.status IN ('EXPIRED', 'FAILED') AND s.refunded = FALSE AND s.resolved_at < ?",
            graceCutoff);

        List<UUID> overdueWaiting = sessionIds(
            "SELECT s.id FROM rental_sessions s WHERE s.status = 'WAITING' AND s.expires_at < ?",
            graceCutoff);

        List<RefundAuditReport.BalanceMismatch> balanceMismatches = jdbcTemplate.query(
            "SELECT b.user_id, b.balance, COALESCE(SUM(e.amount), 0) AS entry_sum " +
            "FROM user_balances b LEFT JOIN balance_ledger_entries e ON e.user_id = b.user_id " +
            "GROUP BY b.user_id, b.balance " +
            "HAVING b.balance <> COALESCE(SUM(e.amount), 0)",
            (rs, rowNum) -> new RefundAuditReport.BalanceMismatch(
                rs.getLong("user_id"),
                rs.getBigDecimal("balance"),
                rs.getBigDecimal("entry_sum")
            ));

        RefundAuditReport report = RefundAuditReport.builder()
                .checkedAt(now)
                .refundedWithoutSingleEntry(refundedWithoutSingleEntry)
                .completedWithRefund(completedWithRefund)
                .stuckUnrefunded(stuckUnrefunded)
                .overdueWaiting(overdueWaiting)
                .balanceMismatches(balanceMismatches)
                .build();

        if (report.isHealthy()) {
            log.info("Refund audit passed");
        } else {
            log.error("Refund audit found problems: refundedWithoutSingleEntry={}, completedWithRefund={}, " +
                            "stuckUnrefunded={}, overdueWaiting={}, balanceMismatches={}",
                    refundedWithoutSingleEntry.size(), completedWithRefund.size(),
                    stuckUnrefunded.size(), overdueWaiting.size(), balanceMismatches.size());
        }
        return report;
    }

    private List<UUID> sessionIds(String sql, Object... args) {
        return jdbcTemplate.query(sql, (rs, rowNum) -> UUID.fromString(rs.getString("id")), args);
    }
}
