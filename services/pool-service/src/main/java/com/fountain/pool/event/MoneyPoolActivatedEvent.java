package com.fountain.pool.event;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A pool received its first contribution; its configuration is frozen from now on.
 */
@Getter
public class MoneyPoolActivatedEvent extends MoneyPoolEvent {

    private final BigDecimal target;
    private final long duration;
    private final String want;

    public MoneyPoolActivatedEvent(Instant timestamp, long poolNumber, String owner,
                                   BigDecimal target, long duration, String want) {
        super(timestamp, poolNumber, owner);
        this.target = target;
        this.duration = duration;
        this.want = want;
    }
}
