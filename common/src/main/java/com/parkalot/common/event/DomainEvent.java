package com.parkalot.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Base payload for events published by the parking service.
 * {@code aggregateType}/{@code aggregateId} name the record the event is about.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class DomainEvent {

    public static final String SOURCE = "parking-service";

    private String eventId;
    private String eventType;
    private String aggregateType;
    private Long aggregateId;
    private String source;
    private Instant occurredAt;

    protected DomainEvent(String eventType, String aggregateType, Long aggregateId) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.source = SOURCE;
        this.occurredAt = Instant.now();
    }
}
