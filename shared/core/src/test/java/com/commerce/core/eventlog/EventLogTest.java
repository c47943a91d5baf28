package com.commerce.core.eventlog;

import com.commerce.core.error.InvalidStateException;
import com.commerce.core.outbox.OutboxEvent;
import com.commerce.core.outbox.OutboxRepository;
import com.commerce.events.AggregateTypes;
import com.commerce.events.EventTypes;
import com.commerce.events.saga.SagaFailedEvent;
import com.commerce.events.serde.EventObjectMapper;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventLog Unit Tests")
class EventLogTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private DomainEventRepository domainEventRepository;

    @Mock
    private OutboxRepository outboxRepository;

    private EventLog eventLog;

    @BeforeEach
    void setUp() {
        eventLog = new EventLog(domainEventRepository, outboxRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("append")
    class AppendTests {

        @Test
        @DisplayName("should write the event and an outbox row carrying the envelope")
        void shouldWriteEventAndOutboxRow() throws Exception {
            // Arrange
            UUID sagaId = UUID.randomUUID();
            when(domainEventRepository.findLatestVersion(sagaId)).thenReturn(2L);
            when(domainEventRepository.save(any(DomainEvent.class))).thenAnswer(inv -> inv.getArgument(0));

            // Act
            DomainEvent event = eventLog.append(AggregateTypes.SAGA, sagaId, 3, EventTypes.SAGA_FAILED,
                    new SagaFailedEvent(sagaId, "REFUND", "boom"), "corr-1");

            // Assert
            assertThat(event.getVersion()).isEqualTo(3);
            assertThat(event.getOccurredAt()).isEqualTo(NOW);
            assertThat(event.getCorrelationId()).isEqualTo("corr-1");

            ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
            verify(outboxRepository).save(captor.capture());
            OutboxEvent outbox = captor.getValue();
            assertThat(outbox.getId()).isEqualTo(event.getId());
            assertThat(outbox.getAggregateType()).isEqualTo(AggregateTypes.SAGA);
            assertThat(outbox.getAggregateVersion()).isEqualTo(3);
            assertThat(outbox.getCorrelationId()).isEqualTo("corr-1");
            assertThat(outbox.getCreatedAt()).isEqualTo(NOW);
            assertThat(outbox.isPublished()).isFalse();

            JsonNode envelope = EventObjectMapper.instance().readTree(outbox.getEnvelope());
            assertThat(envelope.get("eventId").asText()).isEqualTo(event.getId().toString());
            assertThat(envelope.get("version").asLong()).isEqualTo(3);
            assertThat(envelope.get("payload").get("error").asText()).isEqualTo("boom");
        }

        @Test
        @DisplayName("should reject a version that skips or repeats")
        void shouldRejectOutOfSequenceVersion() {
            // Arrange
            UUID sagaId = UUID.randomUUID();
            when(domainEventRepository.findLatestVersion(sagaId)).thenReturn(4L);

            // Act & Assert
            assertThatThrownBy(() -> eventLog.append(AggregateTypes.SAGA, sagaId, 4, EventTypes.SAGA_FAILED,
                    new SagaFailedEvent(sagaId, "REFUND", "boom"), null))
                    .isInstanceOf(InvalidStateException.class);
            verifyNoInteractions(outboxRepository);
        }
    }

    @Nested
    @DisplayName("appendNext / readFrom")
    class AppendNextTests {

        @Test
        @DisplayName("should use the next free version of the aggregate")
        void shouldUseNextVersion() {
            // Arrange
            UUID sagaId = UUID.randomUUID();
            when(domainEventRepository.findLatestVersion(sagaId)).thenReturn(0L);
            when(domainEventRepository.save(any(DomainEvent.class))).thenAnswer(inv -> inv.getArgument(0));

            // Act
            DomainEvent event = eventLog.appendNext(AggregateTypes.SAGA, sagaId, EventTypes.SAGA_FAILED,
                    new SagaFailedEvent(sagaId, "REFUND", "boom"), null);

            // Assert
            assertThat(event.getVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("should read events from the requested version onwards")
        void shouldReadFromVersion() {
            // Arrange
            UUID sagaId = UUID.randomUUID();
            DomainEvent second = new DomainEvent(UUID.randomUUID(), AggregateTypes.SAGA, sagaId, 2,
                    EventTypes.SAGA_FAILED, "{}", null, NOW);
            when(domainEventRepository.findByAggregateIdAndVersionGreaterThanEqualOrderByVersionAsc(sagaId, 2))
                    .thenReturn(List.of(second));

            // Act
            List<DomainEvent> events = eventLog.readFrom(sagaId, 2);

            // Assert
            assertThat(events).containsExactly(second);
        }
    }
}
