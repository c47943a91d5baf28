package com.commerce.core.eventlog;

import com.commerce.core.error.InvalidStateException;
import com.commerce.core.outbox.OutboxEvent;
import com.commerce.core.outbox.OutboxRepository;
import com.commerce.events.EventEnvelope;
import com.commerce.events.serde.EventObjectMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only log of domain events keyed by aggregate id and version.
 * <p>
 * Every append also writes an outbox row in the same transaction, so an event is
 * enqueued for dispatch if and only if the state change that produced it commits.
 */
@Service
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final DomainEventRepository domainEventRepository;
    private final OutboxRepository outboxRepository;
    private final Clock clock;

    public EventLog(DomainEventRepository domainEventRepository,
                    OutboxRepository outboxRepository,
                    Clock clock) {
        this.domainEventRepository = domainEventRepository;
        this.outboxRepository = outboxRepository;
        this.clock = clock;
    }

    @Transactional
    public DomainEvent append(String aggregateType, UUID aggregateId, long version,
                              String eventType, Object payload, String correlationId) {
        long latest = domainEventRepository.findLatestVersion(aggregateId);
        if (version != latest + 1) {
            throw new InvalidStateException(String.format(
                    "Version %d out of sequence for aggregate %s (latest %d)", version, aggregateId, latest));
        }
        return write(aggregateType, aggregateId, version, eventType, payload, correlationId);
    }

    /**
     * Appends at the next free version of the aggregate. Callers must be the only
     * writer of the aggregate at that moment; the unique (aggregate, version) key
     * rejects a concurrent writer.
     */
    @Transactional
    public DomainEvent appendNext(String aggregateType, UUID aggregateId,
                                  String eventType, Object payload, String correlationId) {
        long version = domainEventRepository.findLatestVersion(aggregateId) + 1;
        return write(aggregateType, aggregateId, version, eventType, payload, correlationId);
    }

    @Transactional(readOnly = true)
    public List<DomainEvent> readFrom(UUID aggregateId, long fromVersion) {
        return domainEventRepository.findByAggregateIdAndVersionGreaterThanEqualOrderByVersionAsc(
                aggregateId, fromVersion);
    }

    private DomainEvent write(String aggregateType, UUID aggregateId, long version,
                              String eventType, Object payload, String correlationId) {
        Instant now = clock.instant();
        EventEnvelope<Object> envelope = new EventEnvelope<>(
                UUID.randomUUID(), eventType, now, aggregateType, aggregateId, version, correlationId, payload);
        String payloadJson;
        String envelopeJson;
        try {
            payloadJson = EventObjectMapper.instance().writeValueAsString(payload);
            envelopeJson = EventObjectMapper.instance().writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize event " + eventType, e);
        }

        DomainEvent event = domainEventRepository.save(new DomainEvent(
                envelope.eventId(), aggregateType, aggregateId, version, eventType, payloadJson, correlationId, now));
        outboxRepository.save(OutboxEvent.of(envelope, envelopeJson));

        log.debug("Appended {} v{} for {} {}", eventType, version, aggregateType, aggregateId);
        return event;
    }
}
