package com.fountain.pool.event;

import com.fountain.common.event.AbstractDomainEvent;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A sustainer was paid their surplus share of one or more pools in one asset.
 */
@Getter
public class RedistributionClaimedEvent extends AbstractDomainEvent {

    private final String sustainer;
    private final String asset;
    private final BigDecimal amount;
    private final List<Long> poolNumbers;

    public RedistributionClaimedEvent(Instant timestamp, String sustainer, String asset,
                                      BigDecimal amount, List<Long> poolNumbers) {
        super(timestamp);
        this.sustainer = sustainer;
        this.asset = asset;
        this.amount = amount;
        this.poolNumbers = List.copyOf(poolNumbers);
    }

    @Override
    public String getAggregateId() {
        return sustainer;
    }
}
