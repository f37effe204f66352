package com.fountain.pool.event;

import com.fountain.common.event.AbstractDomainEvent;
import lombok.Getter;

import java.time.Instant;

/**
 * Event about one money pool, keyed by its owner so per-owner order is kept on
 * the Kafka topic.
 */
@Getter
public abstract class MoneyPoolEvent extends AbstractDomainEvent {

    private final long poolNumber;
    private final String owner;

    protected MoneyPoolEvent(Instant timestamp, long poolNumber, String owner) {
        super(timestamp);
        this.poolNumber = poolNumber;
        this.owner = owner;
    }

    @Override
    public String getAggregateId() {
        return owner;
    }
}
