package com.fountain.common.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base implementation of a domain event
 */
public abstract class AbstractDomainEvent implements DomainEvent {
    private final String eventId;
    private final Instant timestamp;

    protected AbstractDomainEvent(Instant timestamp) {
        this.eventId = UUID.randomUUID().toString();
        this.timestamp = timestamp;
    }

    @Override
    public String getEventId() {
        return eventId;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String getEventType() {
        return this.getClass().getSimpleName();
    }

    @Override
    public abstract String getAggregateId();
}
