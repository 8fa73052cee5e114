package com.flagship.otp_rental.rental;

import com.flagship.otp_rental.exception.SessionConflictException;
import com.flagship.otp_rental.exception.SessionNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary for rental sessions.
 *
 * {@link #transition} is the one synchronization point between the interactive
 * poll path and the background sweep: whoever's guarded UPDATE matches the
 * expected status wins, everyone else gets a {@link SessionConflictException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RentalSessionStore {

    private final RentalSessionRepository repository;
    private final Clock clock;

    @Transactional
    public UUID create(RentalSession session) {
        if (session.getStatus() != RentalStatus.WAITING) {
            throw new IllegalArgumentException("New sessions must start WAITING, got " + session.getStatus());
        }
        RentalSessionEntity saved = repository.save(RentalSessionEntity.fromDomain(session));
        log.debug("Created rental session: id={}, userId={}, serviceType={}",
                saved.getId(), saved.getUserId(), saved.getServiceType());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public Optional<RentalSession> findById(UUID id) {
        return repository.findById(id).map(RentalSessionEntity::toDomain);
    }

    /**
     * Waiting sessions of one user, newest first, optionally for one service type.
     */
    @Transactional(readOnly = true)
    public List<RentalSession> listActiveForUser(Long userId, ServiceType serviceType) {
        List<RentalSessionEntity> entities = serviceType == null
                ? repository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, RentalStatus.WAITING)
                : repository.findByUserIdAndServiceTypeAndStatusOrderByCreatedAtDesc(
                        userId, serviceType, RentalStatus.WAITING);
        return entities.stream().map(RentalSessionEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public Page<RentalSession> findHistory(Long userId, ServiceType serviceType, int page, int size) {
        PageRequest pageRequest = PageRequest.of(page, size);
        Page<RentalSessionEntity> entities = serviceType == null
                ? repository.findByUserIdOrderByCreatedAtDesc(userId, pageRequest)
                : repository.findByUserIdAndServiceTypeOrderByCreatedAtDesc(userId, serviceType, pageRequest);
        return entities.map(RentalSessionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<RentalSession> findExpiredWaiting(Instant now, int limit) {
        return repository.findExpiredWaiting(now, PageRequest.of(0, limit)).stream()
                .map(RentalSessionEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RentalSession> findUnrefundedTerminal(int limit) {
        return repository.findUnrefunded(RentalStatus.REFUNDABLE, PageRequest.of(0, limit)).stream()
                .map(RentalSessionEntity::toDomain)
                .toList();
    }

    /**
     * Moves a session from {@code expected} to {@code next} if, and only if, it is still in {@code expected}.
     *
     * @param otpCode required when {@code next} is COMPLETED, ignored otherwise
     * @throws SessionNotFoundException if the session does not exist
     * @throws SessionConflictException if the session is no longer in {@code expected}
     */
    @Transactional
    public void transition(UUID id, RentalStatus expected, RentalStatus next, String otpCode) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalArgumentException(
                String.format("Illegal rental transition %s -> %s", expected, next));
        }
        if (next == RentalStatus.COMPLETED && (otpCode == null || otpCode.isBlank())) {
            throw new IllegalArgumentException("Completing a rental requires the OTP code");
        }

        String storedCode = next == RentalStatus.COMPLETED ? otpCode : null;
        int updated = repository.transition(id, expected, next, storedCode, clock.instant());

        if (updated == 0) {
            RentalStatus actual = repository.findStatusById(id)
                    .orElseThrow(() -> new SessionNotFoundException(id));
            log.debug("Transition lost: id={}, expected={}, actual={}, requested={}", id, expected, actual, next);
            throw new SessionConflictException(id, expected, actual);
        }

        log.debug("Rental session transitioned: id={}, {} -> {}", id, expected, next);
    }

    /**
     * Sets the refund flag exactly once.
     *
     * @throws SessionConflictException if the session is already refunded or not in a refundable status
     */
    @Transactional
    public void markRefunded(UUID id) {
        int updated = repository.markRefunded(id, RentalStatus.REFUNDABLE, clock.instant());
        if (updated == 0) {
            RentalStatus actual = repository.findStatusById(id)
                    .orElseThrow(() -> new SessionNotFoundException(id));
            throw new SessionConflictException(id,
                String.format("Session %s cannot be marked refunded (status=%s or already refunded)", id, actual));
        }
    }
}
