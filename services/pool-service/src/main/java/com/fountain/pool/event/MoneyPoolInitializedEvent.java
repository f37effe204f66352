package com.fountain.pool.event;

import lombok.Getter;

import java.time.Instant;

/**
 * A new pool was committed to an owner's chain.
 */
@Getter
public class MoneyPoolInitializedEvent extends MoneyPoolEvent {

    private final long previousNumber;
    private final long start;

    public MoneyPoolInitializedEvent(Instant timestamp, long poolNumber, String owner, long previousNumber, long start) {
        super(timestamp, poolNumber, owner);
        this.previousNumber = previousNumber;
        this.start = start;
    }
}
