package com.flagship.otp_rental.rental;

import com.flagship.otp_rental.config.RentalProperties;
import com.flagship.otp_rental.exception.InsufficientBalanceException;
import com.flagship.otp_rental.exception.SessionAccessDeniedException;
import com.flagship.otp_rental.exception.SessionConflictException;
import com.flagship.otp_rental.exception.SessionNotFoundException;
import com.flagship.otp_rental.ledger.BalanceLedgerService;
import com.flagship.otp_rental.observability.CorrelationContext;
import com.flagship.otp_rental.observability.RentalMetrics;
import com.flagship.otp_rental.provider.OtpOutcome;
import com.flagship.otp_rental.provider.ProviderException;
import com.flagship.otp_rental.provider.RentalProviderGateway;
import com.flagship.otp_rental.provider.Reservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Interactive rental operations: start a rental and poll it for the OTP.
 *
 * Provider calls happen here, outside any database transaction. Every state
 * change and money movement is delegated to {@link RentalSettlementService}.
 *
 * Exactly one of {completion, self-expiry, sweep expiry, cancellation} wins per
 * session. A caller that loses the guarded transition reloads the session and
 * returns whatever the winner wrote.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RentalService {

    private final RentalSessionStore store;
    private final RentalSettlementService settlementService;
    private final RentalProviderGateway providerGateway;
    private final BalanceLedgerService ledgerService;
    private final StartRentalRateLimiter rateLimiter;
    private final RentalProperties properties;
    private final RentalMetrics metrics;
    private final Clock clock;

    /**
     * Reserves a number and charges the user for it.
     *
     * Order: rate limit, price lookup, balance pre-check, reserve, then debit and
     * session insert in one transaction. If that transaction fails the reservation
     * is released and nothing stays debited.
     *
     * @throws com.flagship.otp_rental.exception.RateLimitedException if the user starts too often
     * @throws com.flagship.otp_rental.exception.UnsupportedServiceException if the service is not offered
     * @throws InsufficientBalanceException if the balance does not cover the price
     * @throws ProviderException if no number could be reserved
     */
    public RentalSession startRental(Long userId, ServiceType serviceType, String carrier) {
        long startTime = System.currentTimeMillis();

        rateLimiter.acquire(userId);
        RentalProperties.ServiceSettings settings = properties.settingsFor(serviceType);
        BigDecimal price = settings.getPrice();

        BigDecimal balance = ledgerService.getBalance(userId);
        if (balance.compareTo(price) < 0) {
            metrics.recordRentalStarted(serviceType, "insufficient_balance");
            throw new InsufficientBalanceException(userId, price, balance);
        }

        Reservation reservation;
        try {
            reservation = providerGateway.reserve(serviceType, carrier);
        } catch (ProviderException e) {
            metrics.recordRentalStarted(serviceType, "provider_error");
            log.warn("Reservation failed: userId={}, serviceType={}, carrier={}, code={}, error={}",
                    userId, serviceType.getCode(), carrier, e.getCode(), e.getMessage());
            throw e;
        }

        RentalSession session;
        try {
            session = settlementService.openSession(userId, serviceType, carrier, reservation, price, settings.getTtl());
        } catch (RuntimeException e) {
            metrics.recordRentalStarted(serviceType,
                    e instanceof InsufficientBalanceException ? "insufficient_balance" : "error");
            log.warn("Opening session failed after reservation, releasing {}: {}",
                    reservation.getPhoneNumber(), e.getMessage());
            releaseQuietly(reservation.getProviderHandle());
            throw e;
        }

        metrics.recordRentalStarted(serviceType, "success");
        metrics.recordLatency("start", System.currentTimeMillis() - startTime);
        return session;
    }

    /**
     * Returns the session, resolving it first if it is still WAITING and either
     * its TTL has elapsed or the provider has an outcome for it.
     *
     * @throws SessionNotFoundException if there is no such session
     * @throws SessionAccessDeniedException if the session belongs to another user
     */
    public RentalSession pollOtp(UUID sessionId, Long userId) {
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, sessionId.toString());
        try {
            RentalSession session = store.findById(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            if (!session.isOwnedBy(userId)) {
                throw new SessionAccessDeniedException(sessionId, userId);
            }

            if (session.isTerminal()) {
                metrics.recordOtpPoll("terminal");
                return session;
            }

            if (session.isExpiredAt(clock.instant())) {
                metrics.recordOtpPoll("self_expired");
                return resolveWithRefund(session, RentalStatus.EXPIRED);
            }

            OtpOutcome outcome;
            try {
                outcome = providerGateway.pollOtp(session.getProviderHandle());
            } catch (ProviderException e) {
                // The sweep expires the session if the provider never recovers
                metrics.recordOtpPoll("provider_error");
                log.warn("OTP poll failed, session stays waiting: code={}, error={}", e.getCode(), e.getMessage());
                return session;
            }

            return switch (outcome.getType()) {
                case DELIVERED -> {
                    metrics.recordOtpPoll("delivered");
                    yield complete(session, outcome.getCode());
                }
                case NOT_YET_DELIVERED -> {
                    metrics.recordOtpPoll("waiting");
                    yield session;
                }
                case CANCELLED -> {
                    metrics.recordOtpPoll("cancelled");
                    yield resolveWithRefund(session, RentalStatus.FAILED);
                }
            };
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
        }
    }

    public List<RentalSession> listActive(Long userId, ServiceType serviceType) {
        return store.listActiveForUser(userId, serviceType);
    }

    public Page<RentalSession> history(Long userId, ServiceType serviceType, int page, int size) {
        return store.findHistory(userId, serviceType, page, size);
    }

    private RentalSession complete(RentalSession session, String otpCode) {
        try {
            RentalSession completed = settlementService.complete(session.getId(), otpCode);
            metrics.recordRentalResolved(session.getServiceType(), RentalStatus.COMPLETED);
            releaseQuietly(session.getProviderHandle());
            return completed;
        } catch (SessionConflictException | ConcurrencyFailureException e) {
            RentalSession current = reload(session.getId());
            if (current.getStatus().isRefundable()) {
                // Expired or cancelled first; the user keeps the refund and the late OTP is dropped
                log.warn("OTP arrived after the session was {}, ignoring it", current.getStatus());
            } else {
                log.debug("Session already resolved by a concurrent poll: {}", current.getStatus());
            }
            return current;
        }
    }

    private RentalSession resolveWithRefund(RentalSession session, RentalStatus terminalStatus) {
        try {
            RentalSession resolved = settlementService.expireAndRefund(session.getId(), terminalStatus);
            metrics.recordRentalResolved(session.getServiceType(), terminalStatus);
            metrics.recordRefund(session.getServiceType(), "interactive", session.getCost());
            releaseQuietly(session.getProviderHandle());
            return resolved;
        } catch (SessionConflictException | ConcurrencyFailureException e) {
            log.debug("Session resolved concurrently while trying {}: {}", terminalStatus, e.getMessage());
            return reload(session.getId());
        }
    }

    private RentalSession reload(UUID sessionId) {
        return store.findById(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private void releaseQuietly(String providerHandle) {
        try {
            providerGateway.release(providerHandle);
        } catch (RuntimeException e) {
            log.warn("Failed to release provider handle {}: {}", providerHandle, e.getMessage());
        }
    }
}
