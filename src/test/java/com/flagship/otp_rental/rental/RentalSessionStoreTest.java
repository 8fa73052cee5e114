package com.flagship.otp_rental.rental;

import com.flagship.otp_rental.exception.SessionConflictException;
import com.flagship.otp_rental.exception.SessionNotFoundException;
import com.flagship.otp_rental.support.MutableClock;
import com.flagship.otp_rental.support.TestClockConfig;
import com.flagship.otp_rental.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Page;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Persistence of rental sessions and the guarded status transition.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class RentalSessionStoreTest {

    @Autowired
    private RentalSessionStore store;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MutableClock clock;

    private Long userId;

    @BeforeEach
    void setUp() {
        TestData.clearTables(jdbcTemplate);
        clock.reset();
        userId = TestData.randomUserId();
    }

    private RentalSession createSession(ServiceType serviceType) {
        RentalSession session = RentalSession.open(UUID.randomUUID(), userId, serviceType, "VIETTEL",
                "0312345678", "SIM-" + UUID.randomUUID(), new BigDecimal("2000"),
                clock.instant(), clock.instant().plus(Duration.ofMinutes(6)));
        store.create(session);
        return session;
    }

    @Test
    @DisplayName("Created session reads back unchanged")
    void createAndRead() {
        RentalSession session = createSession(ServiceType.PHONE_RENTAL_V2);

        RentalSession loaded = store.findById(session.getId()).orElseThrow();

        assertEquals(session.getUserId(), loaded.getUserId());
        assertEquals(ServiceType.PHONE_RENTAL_V2, loaded.getServiceType());
        assertEquals(session.getPhoneNumber(), loaded.getPhoneNumber());
        assertEquals(session.getProviderHandle(), loaded.getProviderHandle());
        assertEquals(RentalStatus.WAITING, loaded.getStatus());
        assertEquals(0, session.getCost().compareTo(loaded.getCost()));
        assertEquals(session.getCreatedAt(), loaded.getCreatedAt());
        assertEquals(session.getExpiresAt(), loaded.getExpiresAt());
        assertFalse(loaded.isRefunded());
    }

    @Test
    @DisplayName("Winning transition stores status, OTP and resolution time")
    void transitionToCompleted() {
        RentalSession session = createSession(ServiceType.PHONE_RENTAL_V1);

        store.transition(session.getId(), RentalStatus.WAITING, RentalStatus.COMPLETED, "123456");

        RentalSession loaded = store.findById(session.getId()).orElseThrow();
        assertEquals(RentalStatus.COMPLETED, loaded.getStatus());
        assertEquals("123456", loaded.getOtpCode());
        assertEquals(clock.instant(), loaded.getResolvedAt());
    }

    @Test
    @DisplayName("Second transition from WAITING loses and reports the actual status")
    void secondTransitionConflicts() {
        RentalSession session = createSession(ServiceType.PHONE_RENTAL_V1);
        store.transition(session.getId(), RentalStatus.WAITING, RentalStatus.EXPIRED, null);

        SessionConflictException e = assertThrows(SessionConflictException.class, () ->
                store.transition(session.getId(), RentalStatus.WAITING, RentalStatus.COMPLETED, "123456"));

        assertEquals(RentalStatus.EXPIRED, e.getActualStatus());
        RentalSession loaded = store.findById(session.getId()).orElseThrow();
        assertEquals(RentalStatus.EXPIRED, loaded.getStatus());
        assertNull(loaded.getOtpCode());
    }

    @Test
    @DisplayName("Transition of a missing session is not found")
    void transitionMissingSession() {
        assertThrows(SessionNotFoundException.class, () ->
                store.transition(UUID.randomUUID(), RentalStatus.WAITING, RentalStatus.EXPIRED, null));
    }

    @Test
    @DisplayName("Completing without an OTP is refused")
    void completeRequiresOtp() {
        RentalSession session = createSession(ServiceType.PHONE_RENTAL_V1);

        assertThrows(IllegalArgumentException.class, () ->
                store.transition(session.getId(), RentalStatus.WAITING, RentalStatus.COMPLETED, " "));
    }

    @Test
    @DisplayName("Refund flag is set once and only on refundable sessions")
    void markRefundedOnce() {
        RentalSession completed = createSession(ServiceType.TIKTOK_RENTAL);
        store.transition(completed.getId(), RentalStatus.WAITING, RentalStatus.COMPLETED, "999999");
        RentalSession expired = createSession(ServiceType.TIKTOK_RENTAL);
        store.transition(expired.getId(), RentalStatus.WAITING, RentalStatus.EXPIRED, null);

        store.markRefunded(expired.getId());

        assertTrue(store.findById(expired.getId()).orElseThrow().isRefunded());
        assertThrows(SessionConflictException.class, () -> store.markRefunded(expired.getId()));
        assertThrows(SessionConflictException.class, () -> store.markRefunded(completed.getId()));
    }

    @Test
    @DisplayName("Only WAITING sessions past their TTL are due for expiry")
    void findExpiredWaiting() {
        RentalSession due = createSession(ServiceType.PHONE_RENTAL_V1);
        RentalSession resolved = createSession(ServiceType.PHONE_RENTAL_V1);
        store.transition(resolved.getId(), RentalStatus.WAITING, RentalStatus.COMPLETED, "111111");
        clock.advance(Duration.ofMinutes(3));
        RentalSession fresh = createSession(ServiceType.PHONE_RENTAL_V1);

        clock.advance(Duration.ofMinutes(3));
        List<RentalSession> expired = store.findExpiredWaiting(clock.instant(), 10);

        assertEquals(List.of(due.getId()), expired.stream().map(RentalSession::getId).toList());
        assertFalse(expired.stream().anyMatch(s -> s.getId().equals(fresh.getId())));
    }

    @Test
    @DisplayName("Active list and history are per user and filterable by service type")
    void activeAndHistory() {
        RentalSession v1 = createSession(ServiceType.PHONE_RENTAL_V1);
        clock.advance(Duration.ofSeconds(1));
        RentalSession tiktok = createSession(ServiceType.TIKTOK_RENTAL);
        store.transition(v1.getId(), RentalStatus.WAITING, RentalStatus.COMPLETED, "222222");

        List<RentalSession> active = store.listActiveForUser(userId, null);
        assertEquals(List.of(tiktok.getId()), active.stream().map(RentalSession::getId).toList());
        assertTrue(store.listActiveForUser(userId, ServiceType.PHONE_RENTAL_V1).isEmpty());

        Page<RentalSession> history = store.findHistory(userId, null, 0, 10);
        assertEquals(2, history.getTotalElements());
        assertEquals(tiktok.getId(), history.getContent().get(0).getId());

        Page<RentalSession> filtered = store.findHistory(userId, ServiceType.PHONE_RENTAL_V1, 0, 10);
        assertEquals(1, filtered.getTotalElements());
        assertTrue(store.findHistory(TestData.randomUserId(), null, 0, 10).isEmpty());
    }
}
