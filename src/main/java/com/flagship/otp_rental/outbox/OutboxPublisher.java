package com.flagship.otp_rental.outbox;

import com.flagship.otp_rental.observability.CorrelationContext;
import com.flagship.otp_rental.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains the outbox into Kafka.
 *
 * Events are sent one at a time and acknowledged before the next, keyed by
 * session id, so consumers see each rental's events in the order they were
 * committed. An event that keeps failing stops being picked up once it hits
 * {@code outbox.publisher.max-retries} and is reported as dead-lettered.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "event-type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.rentals:rentals}")
    private String rentalsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
    }

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.lockNextBatch(batchSize);
        } catch (Exception e) {
            log.error("Could not read the outbox", e);
            return;
        }

        if (!batch.isEmpty()) {
            log.debug("Publishing {} outbox events", batch.size());
        }
        for (OutboxEvent event : batch) {
            publish(event);
        }
    }

    private void publish(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
                rentalsTopic, event.getAggregateId().toString(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                CorrelationContext.getCorrelationId().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

            log.debug("Published {} for session {} to {}-{}@{}",
                    event.getEventType(), event.getAggregateId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted");
        } catch (ExecutionException | TimeoutException e) {
            recordFailure(event, e.getMessage());
        } catch (RuntimeException e) {
            recordFailure(event, e.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        boolean deadLettered = outboxService.markFailed(event.getId(), error);
        if (deadLettered) {
            log.error("Outbox event {} ({}) for session {} exceeded {} attempts and needs manual replay",
                    event.getId(), event.getEventType(), event.getAggregateId(), outboxService.getMaxRetries());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
