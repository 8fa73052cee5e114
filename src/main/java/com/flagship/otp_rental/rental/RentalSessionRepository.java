package com.flagship.otp_rental.rental;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RentalSessionRepository extends JpaRepository<RentalSessionEntity, UUID> {

    /**
     * Compare-and-set on status. Returns 1 if this caller won, 0 if the row
     * was missing or already left {@code expected}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE RentalSessionEntity s
        SET s.status = :next, s.otpCode = :otpCode, s.resolvedAt = :now,
            s.updatedAt = :now, s.version = s.version + 1
        WHERE s.id = :id AND s.status = :expected
        """)
    int transition(@Param("id") UUID id,
                   @Param("expected") RentalStatus expected,
                   @Param("next") RentalStatus next,
                   @Param("otpCode") String otpCode,
                   @Param("now") Instant now);

    /**
     * Flips the refund flag once, and only for a refundable terminal status.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE RentalSessionEntity s
        SET s.refunded = true, s.refundedAt = :now, s.updatedAt = :now, s.version = s.version + 1
        WHERE s.id = :id AND s.refunded = false AND s.status IN :statuses
        """)
    int markRefunded(@Param("id") UUID id,
                     @Param("statuses") Collection<RentalStatus> statuses,
                     @Param("now") Instant now);

    @Query("SELECT s.status FROM RentalSessionEntity s WHERE s.id = :id")
    Optional<RentalStatus> findStatusById(@Param("id") UUID id);

    List<RentalSessionEntity> findByUserIdAndStatusOrderByCreatedAtDesc(Long userId, RentalStatus status);

    List<RentalSessionEntity> findByUserIdAndServiceTypeAndStatusOrderByCreatedAtDesc(
        Long userId, ServiceType serviceType, RentalStatus status);

    Page<RentalSessionEntity> findByUserIdOrderByCreatedAtDesc(Long userId, Pageable pageable);

    Page<RentalSessionEntity> findByUserIdAndServiceTypeOrderByCreatedAtDesc(
        Long userId, ServiceType serviceType, Pageable pageable);

    /**
     * Waiting sessions whose TTL has elapsed, oldest first. Input of the auto-refund sweep.
     */
    @Query("""
        SELECT s FROM RentalSessionEntity s
        WHERE s.status = com.flagship.otp_rental.rental.RentalStatus.WAITING AND s.expiresAt <= :now
        ORDER BY s.expiresAt ASC
        """)
    List<RentalSessionEntity> findExpiredWaiting(@Param("now") Instant now, Pageable pageable);

    /**
     * Refundable terminal sessions whose refund never landed. Input of the repair pass.
     */
    @Query("""
        SELECT s FROM RentalSessionEntity s
        WHERE s.status IN :statuses AND s.refunded = false
        ORDER BY s.resolvedAt ASC
        """)
    List<RentalSessionEntity> findUnrefunded(@Param("statuses") Collection<RentalStatus> statuses,
                                             Pageable pageable);

    long countByStatus(RentalStatus status);
}
