package com.fountain.pool.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a redistribution claim: amount paid per asset and the pools marked claimed
 */
@Value
@Builder
public class ClaimResult {
    String sustainer;
    @Singular
    Map<String, BigDecimal> payouts;
    @Singular
    List<Long> claimedPoolNumbers;

    /**
     * Sum of all payouts, meaningful when every pool shares one asset.
     */
    public BigDecimal getTotalPaid() {
        return payouts.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
