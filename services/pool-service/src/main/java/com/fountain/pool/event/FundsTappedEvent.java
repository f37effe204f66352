package com.fountain.pool.event;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
public class FundsTappedEvent extends MoneyPoolEvent {

    private final BigDecimal amount;
    private final BigDecimal totalTapped;

    public FundsTappedEvent(Instant timestamp, long poolNumber, String owner, BigDecimal amount, BigDecimal totalTapped) {
        super(timestamp, poolNumber, owner);
        this.amount = amount;
        this.totalTapped = totalTapped;
    }
}
