package com.fountain.pool.dto;

import com.fountain.pool.domain.MoneyPoolState;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only snapshot of a money pool
 */
@Value
@Builder
public class MoneyPoolDto {
    long number;
    String owner;
    String want;
    BigDecimal target;
    BigDecimal total;
    BigDecimal tapped;
    BigDecimal tappableAmount;
    BigDecimal surplus;
    long start;
    long duration;
    long end;
    long previousNumber;
    MoneyPoolState state;
    int sustainerCount;
}
