package com.commerce.core.outbox;

import com.commerce.events.AggregateTypes;
import com.commerce.events.EventEnvelope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxPublisher Unit Tests")
class OutboxPublisherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private OutboxRepository outboxRepository;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SimpleMeterRegistry meterRegistry;
    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        meterRegistry = new SimpleMeterRegistry();
        publisher = new OutboxPublisher(outboxRepository, kafkaTemplate,
                new TransactionTemplate(transactionManager), Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);
    }

    private static OutboxEvent pending(String eventType, long version, String correlationId) {
        EventEnvelope<Map<String, String>> envelope = new EventEnvelope<>(UUID.randomUUID(), eventType,
                NOW.minusSeconds(5), AggregateTypes.SAGA, UUID.randomUUID(), version, correlationId, Map.of());
        return OutboxEvent.of(envelope, "{\"eventType\":\"" + eventType + "\"}");
    }

    private static String header(ProducerRecord<String, String> record, String name) {
        return new String(record.headers().lastHeader(name).value(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("should route each aggregate type to its topic")
    void shouldRouteByAggregateType() {
        assertThat(OutboxPublisher.topicFor(AggregateTypes.SAGA)).isEqualTo("saga-events");
        assertThat(OutboxPublisher.topicFor(AggregateTypes.RESERVATION)).isEqualTo("inventory-events");
        assertThat(OutboxPublisher.topicFor(AggregateTypes.REFUND)).isEqualTo("refund-events");
        assertThat(OutboxPublisher.topicFor("Other")).isEqualTo(OutboxPublisher.DEFAULT_TOPIC);
    }

    @Test
    @DisplayName("should key the record by aggregate and carry event id, type, version and correlation as headers")
    void shouldBuildRecordWithHeaders() {
        // Arrange
        OutboxEvent event = pending("SagaCompleted", 5, "corr-1");

        // Act
        ProducerRecord<String, String> record = OutboxPublisher.toRecord("saga-events", event);

        // Assert
        assertThat(record.key()).isEqualTo(event.getAggregateId().toString());
        assertThat(record.value()).isEqualTo(event.getEnvelope());
        assertThat(header(record, "event-id")).isEqualTo(event.getId().toString());
        assertThat(header(record, "event-type")).isEqualTo("SagaCompleted");
        assertThat(header(record, "aggregate-version")).isEqualTo("5");
        assertThat(header(record, "correlation-id")).isEqualTo("corr-1");
    }

    @Test
    @DisplayName("should omit the correlation header when the event has none")
    void shouldOmitMissingCorrelation() {
        ProducerRecord<String, String> record = OutboxPublisher.toRecord("saga-events", pending("SagaStarted", 1, null));

        assertThat(record.headers().lastHeader("correlation-id")).isNull();
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("should publish pending events and stamp them as published")
    void shouldPublishAndMark() {
        // Arrange
        OutboxEvent event = pending("SagaStarted", 1, "corr-1");
        when(outboxRepository.findTop100ByPublishedAtIsNullOrderByCreatedAtAscAggregateVersionAsc())
                .thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(CompletableFuture.completedFuture(null));

        // Act
        publisher.publishPendingEvents();

        // Assert
        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        assertThat(captor.getValue().topic()).isEqualTo("saga-events");
        verify(outboxRepository).save(event);
        assertThat(event.getPublishedAt()).isEqualTo(NOW);
        assertThat(meterRegistry.counter("outbox_published_total", "topic", "saga-events").count()).isEqualTo(1.0);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("should stop at the first failure to preserve ordering")
    void shouldStopAtFirstFailure() {
        // Arrange
        OutboxEvent first = pending("SagaStarted", 1, null);
        OutboxEvent second = pending("SagaCompleted", 2, null);
        when(outboxRepository.findTop100ByPublishedAtIsNullOrderByCreatedAtAscAggregateVersionAsc())
                .thenReturn(List.of(first, second));
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        // Act
        publisher.publishPendingEvents();

        // Assert
        verify(kafkaTemplate, times(1)).send(any(ProducerRecord.class));
        verify(outboxRepository, never()).save(any());
        assertThat(first.isPublished()).isFalse();
        assertThat(second.isPublished()).isFalse();
    }
}
