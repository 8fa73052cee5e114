package com.flagship.otp_rental.rental;

import com.flagship.otp_rental.exception.SessionNotFoundException;
import com.flagship.otp_rental.ledger.BalanceLedgerService;
import com.flagship.otp_rental.ledger.LedgerReason;
import com.flagship.otp_rental.outbox.OutboxService;
import com.flagship.otp_rental.provider.Reservation;
import com.flagship.otp_rental.rental.event.RentalCompletedEvent;
import com.flagship.otp_rental.rental.event.RentalRefundedEvent;
import com.flagship.otp_rental.rental.event.RentalStartedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * The only code that changes a session's status or moves money for a session.
 *
 * Each method is one database transaction that applies the status change, the
 * matching ledger entry and the outbox event together:
 * - openSession: debit, insert WAITING session, RentalStarted
 * - complete: WAITING → COMPLETED, RentalCompleted (the debit stands)
 * - expireAndRefund: WAITING → EXPIRED/FAILED, refund credit, refunded flag, RentalRefunded
 * - repairRefund: finish a refund for an EXPIRED/FAILED session whose flag never flipped
 *
 * None of these call the provider. Provider calls happen before or after, outside the transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RentalSettlementService {

    private final RentalSessionStore store;
    private final BalanceLedgerService ledgerService;
    private final OutboxService outboxService;
    private final Clock clock;

    /**
     * Debits the user and records the new session. The debit comes first, so a
     * session never exists without having been paid for.
     *
     * @throws com.flagship.otp_rental.exception.InsufficientBalanceException if the balance dropped since the pre-check
     */
    @Transactional
    public RentalSession openSession(Long userId, ServiceType serviceType, String carrier,
                                     Reservation reservation, BigDecimal price, Duration ttl) {
        UUID sessionId = UUID.randomUUID();
        Instant now = clock.instant();

        ledgerService.debit(userId, price, LedgerReason.RENTAL_DEBIT, sessionId,
                String.format("Rental %s (%s, %s)", serviceType.getCode(), carrier, reservation.getPhoneNumber()));

        RentalSession session = RentalSession.open(sessionId, userId, serviceType, carrier,
                reservation.getPhoneNumber(), reservation.getProviderHandle(), price, now, now.plus(ttl));
        store.create(session);

        outboxService.saveEvent(RentalStartedEvent.from(session));

        log.info("Rental opened: sessionId={}, userId={}, serviceType={}, cost={}, expiresAt={}",
                sessionId, userId, serviceType.getCode(), price, session.getExpiresAt());
        return session;
    }

    /**
     * Records the OTP. No money moves.
     *
     * @throws com.flagship.otp_rental.exception.SessionConflictException if the session is no longer WAITING
     */
    @Transactional
    public RentalSession complete(UUID sessionId, String otpCode) {
        store.transition(sessionId, RentalStatus.WAITING, RentalStatus.COMPLETED, otpCode);
        RentalSession completed = load(sessionId);

        outboxService.saveEvent(RentalCompletedEvent.from(completed));

        log.info("Rental completed: sessionId={}, userId={}", sessionId, completed.getUserId());
        return completed;
    }

    /**
     * Resolves a WAITING session as EXPIRED or FAILED and returns its cost to the user.
     * Losing the guarded transition throws before any money moves.
     *
     * @throws com.flagship.otp_rental.exception.SessionConflictException if the session is no longer WAITING
     */
    @Transactional
    public RentalSession expireAndRefund(UUID sessionId, RentalStatus terminalStatus) {
        if (!terminalStatus.isRefundable()) {
            throw new IllegalArgumentException("Refund requires EXPIRED or FAILED, got " + terminalStatus);
        }

        store.transition(sessionId, RentalStatus.WAITING, terminalStatus, null);
        RentalSession resolved = load(sessionId);

        BigDecimal balanceAfter = refund(resolved);
        store.markRefunded(sessionId);

        RentalSession refunded = load(sessionId);
        outboxService.saveEvent(RentalRefundedEvent.from(refunded, balanceAfter, refunded.getRefundedAt()));

        log.info("Rental {} and refunded: sessionId={}, userId={}, amount={}, balanceAfter={}",
                terminalStatus.toJson(), sessionId, resolved.getUserId(), resolved.getCost(), balanceAfter);
        return refunded;
    }

    /**
     * Completes the refund of an EXPIRED or FAILED session left with {@code refunded = false}.
     * Credits only if the ledger has no refund entry for the session yet.
     *
     * @return what was repaired, if anything
     */
    @Transactional
    public RepairOutcome repairRefund(UUID sessionId) {
        RentalSession session = load(sessionId);
        if (!session.getStatus().isRefundable() || session.isRefunded()) {
            return RepairOutcome.NOTHING_TO_REPAIR;
        }

        RepairOutcome outcome;
        BigDecimal balanceAfter;
        if (ledgerService.findEntry(sessionId, LedgerReason.RENTAL_REFUND).isEmpty()) {
            balanceAfter = refund(session);
            outcome = RepairOutcome.CREDITED;
        } else {
            balanceAfter = ledgerService.getBalance(session.getUserId());
            outcome = RepairOutcome.FLAG_SET;
        }
        store.markRefunded(sessionId);

        if (outcome == RepairOutcome.CREDITED) {
            RentalSession refunded = load(sessionId);
            outboxService.saveEvent(RentalRefundedEvent.from(refunded, balanceAfter, refunded.getRefundedAt()));
        }

        log.warn("Repaired refund: sessionId={}, status={}, outcome={}", sessionId, session.getStatus(), outcome);
        return outcome;
    }

    private BigDecimal refund(RentalSession session) {
        return ledgerService.credit(session.getUserId(), session.getCost(), LedgerReason.RENTAL_REFUND,
                session.getId(), String.format("Refund for %s rental (%s)",
                        session.getServiceType().getCode(), session.getStatus().toJson()));
    }

    private RentalSession load(UUID sessionId) {
        return store.findById(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
