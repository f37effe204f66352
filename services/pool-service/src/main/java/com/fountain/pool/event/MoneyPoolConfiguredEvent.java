package com.fountain.pool.event;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
public class MoneyPoolConfiguredEvent extends MoneyPoolEvent {

    private final BigDecimal target;
    private final long duration;
    private final String want;

    public MoneyPoolConfiguredEvent(Instant timestamp, long poolNumber, String owner,
                                    BigDecimal target, long duration, String want) {
        super(timestamp, poolNumber, owner);
        this.target = target;
        this.duration = duration;
        this.want = want;
    }
}
