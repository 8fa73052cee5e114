package com.flagship.otp_rental.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.otp_rental.rental.RentalSession;
import com.flagship.otp_rental.rental.ServiceType;
import com.flagship.otp_rental.rental.event.RentalStartedEvent;
import com.flagship.otp_rental.support.TestClockConfig;
import com.flagship.otp_rental.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox writes: same-transaction requirement, payload shape, retry bookkeeping.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class OutboxServiceTest {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        TestData.clearTables(jdbcTemplate);
    }

    private RentalStartedEvent startedEvent() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        RentalSession session = RentalSession.open(UUID.randomUUID(), TestData.randomUserId(),
                ServiceType.PHONE_RENTAL_V1, "MOBIFONE", "0712345678", "SIM-1",
                new BigDecimal("2100"), now, now.plusSeconds(360));
        return RentalStartedEvent.from(session);
    }

    private OutboxEvent saveInTransaction(RentalStartedEvent event) {
        return transactionTemplate.execute(status -> outboxService.saveEvent(event));
    }

    @Test
    @DisplayName("Saving outside a transaction is refused")
    void requiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(startedEvent()));
    }

    @Test
    @DisplayName("Saved event carries the session as aggregate and the event as JSON")
    void savedEventShape() throws Exception {
        RentalStartedEvent event = startedEvent();

        saveInTransaction(event);

        List<OutboxEvent> events = outboxService.findEventsForSession(event.getSessionId());
        assertEquals(1, events.size());
        OutboxEvent stored = events.get(0);
        assertEquals(OutboxService.RENTAL_AGGREGATE, stored.getAggregateType());
        assertEquals(RentalStartedEvent.EVENT_TYPE, stored.getEventType());
        assertFalse(stored.isPublished());
        assertNotNull(stored.getSequenceNumber());

        JsonNode payload = objectMapper.readTree(stored.getPayload());
        assertEquals(event.getSessionId().toString(), payload.get("sessionId").asText());
        assertEquals("phone-rental-v1", payload.get("serviceType").asText());
        assertEquals(0, new BigDecimal("2100").compareTo(payload.get("cost").decimalValue()));
    }

    @Test
    @DisplayName("Rolled back transaction leaves no event behind")
    void rollbackLeavesNothing() {
        RentalStartedEvent event = startedEvent();

        transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvent(event);
            status.setRollbackOnly();
        });

        assertTrue(outboxService.findEventsForSession(event.getSessionId()).isEmpty());
    }

    @Test
    @DisplayName("Failures count up to the retry limit, then the event is dead-lettered")
    void failuresDeadLetter() {
        OutboxEvent saved = saveInTransaction(startedEvent());
        int maxRetries = outboxService.getMaxRetries();

        for (int i = 1; i < maxRetries; i++) {
            assertFalse(outboxService.markFailed(saved.getId(), "broker unavailable"));
        }
        assertTrue(outboxService.markFailed(saved.getId(), "broker unavailable"));

        OutboxEvent stored = outboxService.findEventsForSession(saved.getAggregateId()).get(0);
        assertEquals(maxRetries, stored.getRetryCount());
        assertEquals("broker unavailable", stored.getLastError());
    }

    @Test
    @DisplayName("Published event records the time and clears the last error")
    void markPublished() {
        OutboxEvent saved = saveInTransaction(startedEvent());
        outboxService.markFailed(saved.getId(), "transient");

        outboxService.markPublished(saved.getId());

        OutboxEvent stored = outboxService.findEventsForSession(saved.getAggregateId()).get(0);
        assertTrue(stored.isPublished());
        assertNull(stored.getLastError());
        assertEquals(1, stored.getRetryCount());
    }
}
