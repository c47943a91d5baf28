package com.commerce.core.outbox;

import com.commerce.events.EventEnvelope;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import java.time.Instant;
import java.util.UUID;

/**
 * A serialized {@link EventEnvelope} waiting to be relayed. The row id is the
 * envelope's event id, so consumers can deduplicate on it.
 */
@Entity
@Table(name = "outbox_events")
public class OutboxEvent {

    @Id
    private UUID id;

    @Column(name = "aggregate_type", nullable = false)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    @Column(name = "aggregate_version", nullable = false)
    private long aggregateVersion;

    @Column(name = "event_type", nullable = false)
    private String eventType;

    @Column(name = "correlation_id")
    private String correlationId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "envelope", columnDefinition = "jsonb", nullable = false)
    private String envelope;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    protected OutboxEvent() {}

    private OutboxEvent(EventEnvelope<?> source, String envelopeJson) {
        this.id = source.eventId();
        this.aggregateType = source.aggregateType();
        this.aggregateId = source.aggregateId();
        this.aggregateVersion = source.version();
        this.eventType = source.eventType();
        this.correlationId = source.correlationId();
        this.envelope = envelopeJson;
        this.createdAt = source.occurredAt();
    }

    public static OutboxEvent of(EventEnvelope<?> source, String envelopeJson) {
        return new OutboxEvent(source, envelopeJson);
    }

    public void markPublished(Instant at) {
        this.publishedAt = at;
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public UUID getId() { return id; }
    public String getAggregateType() { return aggregateType; }
    public UUID getAggregateId() { return aggregateId; }
    public long getAggregateVersion() { return aggregateVersion; }
    public String getEventType() { return eventType; }
    public String getCorrelationId() { return correlationId; }
    public String getEnvelope() { return envelope; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getPublishedAt() { return publishedAt; }
}
