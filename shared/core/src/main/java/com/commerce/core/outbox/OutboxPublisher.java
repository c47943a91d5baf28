package com.commerce.core.outbox;

import com.commerce.events.AggregateTypes;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Relays outbox rows to Kafka in creation order. Notification consumers subscribe
 * to these topics; delivery beyond the broker is their concern.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPublisher {

    private static final Logger log = LoggerFactory.getLogger(OutboxPublisher.class);

    static final String DEFAULT_TOPIC = "commerce-events";

    private static final Map<String, String> AGGREGATE_TO_TOPIC = Map.of(
            AggregateTypes.SAGA, "saga-events",
            AggregateTypes.RESERVATION, "inventory-events",
            AggregateTypes.REFUND, "refund-events"
    );

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public OutboxPublisher(OutboxRepository outboxRepository,
                           KafkaTemplate<String, String> kafkaTemplate,
                           TransactionTemplate transactionTemplate,
                           Clock clock,
                           MeterRegistry meterRegistry) {
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @Scheduled(fixedDelayString = "${outbox.publisher.interval-ms:500}")
    public void publishPendingEvents() {
        List<OutboxEvent> events = outboxRepository.findTop100ByPublishedAtIsNullOrderByCreatedAtAscAggregateVersionAsc();
        for (OutboxEvent event : events) {
            try {
                transactionTemplate.executeWithoutResult(status -> publishSingleEvent(event));
            } catch (Exception e) {
                log.error("Failed to publish outbox event {}: {}", event.getId(), e.getMessage());
                break;
            }
        }
    }

    static String topicFor(String aggregateType) {
        return AGGREGATE_TO_TOPIC.getOrDefault(aggregateType, DEFAULT_TOPIC);
    }

    /** Keyed by aggregate id so one aggregate's events stay on one partition, in version order. */
    static ProducerRecord<String, String> toRecord(String topic, OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(topic, event.getAggregateId().toString(), event.getEnvelope());
        record.headers().add("event-id", bytes(event.getId().toString()));
        record.headers().add("event-type", bytes(event.getEventType()));
        record.headers().add("aggregate-version", bytes(Long.toString(event.getAggregateVersion())));
        if (event.getCorrelationId() != null) {
            record.headers().add("correlation-id", bytes(event.getCorrelationId()));
        }
        return record;
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private void publishSingleEvent(OutboxEvent event) {
        String topic = topicFor(event.getAggregateType());
        try {
            kafkaTemplate.send(toRecord(topic, event)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while publishing event " + event.getId(), e);
        } catch (Exception e) {
            throw new RuntimeException("Failed to publish event " + event.getId(), e);
        }
        event.markPublished(clock.instant());
        outboxRepository.save(event);
        meterRegistry.counter("outbox_published_total", "topic", topic).increment();
        log.info("Published outbox event {} ({} v{}) to topic {}",
                event.getId(), event.getEventType(), event.getAggregateVersion(), topic);
    }
}
