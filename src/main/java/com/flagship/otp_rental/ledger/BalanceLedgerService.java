package com.flagship.otp_rental.ledger;

import com.flagship.otp_rental.exception.InsufficientBalanceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-user spendable balance backed by an append-only ledger.
 *
 * Invariants enforced here and by the schema:
 * 1. A debit never takes a balance below zero (conditional UPDATE + CHECK constraint)
 * 2. Every balance change appends exactly one ledger entry in the same transaction
 * 3. Entries are never updated or deleted
 * 4. At most one entry per (session, reason), so a session is debited once and refunded once
 *
 * Concurrent debits for the same user are serialized by the row lock the
 * conditional UPDATE takes on {@code user_balances}. Different users never block each other.
 *
 * Plain JDBC on purpose: the correctness lives in the SQL, not in entity state.
 */
@Service
@Slf4j
public class BalanceLedgerService {

    private static final String ENTRY_COLUMNS =
            "id, user_id, amount, reason, related_session_id, description, balance_after, created_at, sequence_number";

    private final JdbcTemplate jdbcTemplate;

    public BalanceLedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Takes {@code amount} from the user's balance if, and only if, enough is available.
     *
     * @return the balance after the debit
     * @throws InsufficientBalanceException if the balance is lower than the amount; nothing is written
     */
    @Transactional
    public BigDecimal debit(Long userId, BigDecimal amount, LedgerReason reason,
                            UUID relatedSessionId, String description) {
        requirePositive(amount);

        int updated = jdbcTemplate.update(
            "UPDATE user_balances SET balance = balance - ?, version = version + 1, updated_at = CURRENT_TIMESTAMP " +
            "WHERE user_id = ? AND balance >= ?",
            amount,
            userId,
            amount
        );

        if (updated == 0) {
            BigDecimal available = getBalance(userId);
            log.info("Debit rejected: userId={}, amount={}, available={}, reason={}",
                    userId, amount, available, reason);
            throw new InsufficientBalanceException(userId, amount, available);
        }

        BigDecimal balanceAfter = lockedBalance(userId);
        appendEntry(userId, amount.negate(), reason, relatedSessionId, description, balanceAfter);

        log.debug("Debited user {}: amount={}, reason={}, balanceAfter={}", userId, amount, reason, balanceAfter);
        return balanceAfter;
    }

    /**
     * Adds {@code amount} to the user's balance, opening the balance row on first use.
     *
     * @return the balance after the credit
     */
    @Transactional
    public BigDecimal credit(Long userId, BigDecimal amount, LedgerReason reason,
                             UUID relatedSessionId, String description) {
        requirePositive(amount);

        openBalance(userId);
        jdbcTemplate.update(
            "UPDATE user_balances SET balance = balance + ?, version = version + 1, updated_at = CURRENT_TIMESTAMP " +
            "WHERE user_id = ?",
            amount,
            userId
        );

        BigDecimal balanceAfter = lockedBalance(userId);
        appendEntry(userId, amount, reason, relatedSessionId, description, balanceAfter);

        log.debug("Credited user {}: amount={}, reason={}, balanceAfter={}", userId, amount, reason, balanceAfter);
        return balanceAfter;
    }

    /**
     * Operator entry point: positive amounts credit, negative amounts debit.
     *
     * @throws IllegalArgumentException for a zero amount or a rental reason
     */
    @Transactional
    public BigDecimal adjust(Long userId, BigDecimal signedAmount, LedgerReason reason, String note) {
        if (reason == null || !reason.isManual()) {
            throw new IllegalArgumentException("Manual adjustments must use one of " + LedgerReason.MANUAL);
        }
        if (signedAmount == null || signedAmount.signum() == 0) {
            throw new IllegalArgumentException("Adjustment amount must be non-zero");
        }

        BigDecimal balanceAfter = signedAmount.signum() > 0
                ? credit(userId, signedAmount, reason, null, note)
                : debit(userId, signedAmount.negate(), reason, null, note);

        log.info("Balance adjusted: userId={}, amount={}, reason={}, balanceAfter={}",
                userId, signedAmount, reason, balanceAfter);
        return balanceAfter;
    }

    /**
     * Current balance; zero for a user who never had one.
     */
    public BigDecimal getBalance(Long userId) {
        List<BigDecimal> balances = jdbcTemplate.queryForList(
            "SELECT balance FROM user_balances WHERE user_id = ?",
            BigDecimal.class,
            userId
        );
        return balances.isEmpty() ? BigDecimal.ZERO : balances.get(0);
    }

    /**
     * Sum of all ledger entries for the user. Equals {@link #getBalance} when the ledger is consistent.
     */
    public BigDecimal sumOfEntries(Long userId) {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM balance_ledger_entries WHERE user_id = ?",
            BigDecimal.class,
            userId
        );
        return sum != null ? sum : BigDecimal.ZERO;
    }

    /**
     * Entries for a user, newest first.
     */
    public List<LedgerEntry> findEntries(Long userId, int page, int size) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM balance_ledger_entries " +
            "WHERE user_id = ? ORDER BY sequence_number DESC LIMIT ? OFFSET ?",
            ledgerEntryRowMapper(),
            userId,
            size,
            (long) page * size
        );
    }

    public long countEntries(Long userId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM balance_ledger_entries WHERE user_id = ?",
            Long.class,
            userId
        );
        return count != null ? count : 0L;
    }

    /**
     * The entry a session produced for the given reason, if any.
     */
    public Optional<LedgerEntry> findEntry(UUID relatedSessionId, LedgerReason reason) {
        List<LedgerEntry> entries = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM balance_ledger_entries " +
            "WHERE related_session_id = ? AND reason = ?",
            ledgerEntryRowMapper(),
            relatedSessionId,
            reason.name()
        );
        return entries.stream().findFirst();
    }

    /**
     * All entries tied to a session, in the order they were written.
     */
    public List<LedgerEntry> findEntriesForSession(UUID relatedSessionId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM balance_ledger_entries " +
            "WHERE related_session_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            relatedSessionId
        );
    }

    private void openBalance(Long userId) {
        jdbcTemplate.update(
            "INSERT INTO user_balances (user_id, balance, version, updated_at) " +
            "VALUES (?, 0, 0, CURRENT_TIMESTAMP) ON CONFLICT DO NOTHING",
            userId
        );
    }

    // Read inside the transaction that holds the row lock from the preceding UPDATE
    private BigDecimal lockedBalance(Long userId) {
        return jdbcTemplate.queryForObject(
            "SELECT balance FROM user_balances WHERE user_id = ?",
            BigDecimal.class,
            userId
        );
    }

    private void appendEntry(Long userId, BigDecimal amount, LedgerReason reason,
                             UUID relatedSessionId, String description, BigDecimal balanceAfter) {
        jdbcTemplate.update(
            "INSERT INTO balance_ledger_entries " +
            "(id, user_id, amount, reason, related_session_id, description, balance_after, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            UUID.randomUUID(),
            userId,
            amount,
            reason.name(),
            relatedSessionId,
            description,
            balanceAfter
        );
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive, got " + amount);
        }
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> {
            String relatedSessionId = rs.getString("related_session_id");
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new LedgerEntry(
                UUID.fromString(rs.getString("id")),
                rs.getLong("user_id"),
                rs.getBigDecimal("amount"),
                LedgerReason.valueOf(rs.getString("reason")),
                relatedSessionId != null ? UUID.fromString(relatedSessionId) : null,
                rs.getString("description"),
                rs.getBigDecimal("balance_after"),
                createdAt != null ? createdAt.toInstant() : null,
                rs.getLong("sequence_number")
            );
        };
    }
}
