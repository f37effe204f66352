package com.fountain.pool.event;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
public class ContributionRecordedEvent extends MoneyPoolEvent {

    private final String payer;
    private final String beneficiary;
    private final BigDecimal amount;
    private final BigDecimal poolTotal;

    public ContributionRecordedEvent(Instant timestamp, long poolNumber, String owner,
                                     String payer, String beneficiary, BigDecimal amount, BigDecimal poolTotal) {
        super(timestamp, poolNumber, owner);
        this.payer = payer;
        this.beneficiary = beneficiary;
        this.amount = amount;
        this.poolTotal = poolTotal;
    }
}
