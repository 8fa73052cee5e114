package com.flagship.otp_rental.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.otp_rental.rental.event.RentalEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes rental events into the outbox inside the caller's transaction.
 *
 * A settlement that commits always leaves its event behind; one that rolls
 * back leaves nothing. Publishing to Kafka happens later in {@link OutboxPublisher}.
 */
@Service
@Slf4j
public class OutboxService {

    public static final String RENTAL_AGGREGATE = "RentalSession";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    public OutboxService(OutboxEventRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Appends an event. Must run inside an existing transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(RentalEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.pending(
                RENTAL_AGGREGATE,
                event.getSessionId(),
                event.getEventType(),
                serialize(event),
                clock.instant());

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));
        log.debug("Queued outbox event: type={}, sessionId={}", event.getEventType(), event.getSessionId());
        return saved.toDomain();
    }

    /**
     * Locks and returns the next batch of publishable events.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> lockNextBatch(int limit) {
        return repository.lockNextBatch(maxRetries, limit).stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> entity.markPublished(clock.instant()));
    }

    /**
     * Records a failed publish attempt.
     *
     * @return true when the event has now used up its retries
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId)
                .map(entity -> {
                    entity.markFailed(errorMessage);
                    log.warn("Outbox event {} failed to publish (attempt {}): {}",
                            eventId, entity.getRetryCount(), errorMessage);
                    return entity.getRetryCount() >= maxRetries;
                })
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> findEventsForSession(UUID sessionId) {
        return repository.findByAggregateIdOrderBySequenceNumberAsc(sessionId).stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private String serialize(RentalEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + event.getEventType(), e);
        }
    }
}
