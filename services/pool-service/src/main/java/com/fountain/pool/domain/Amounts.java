package com.fountain.pool.domain;

import com.fountain.pool.exception.InvalidAmountException;

import java.math.BigDecimal;

/**
 * Amounts are whole units of the pool's asset, held as scale-0 {@link BigDecimal}s.
 */
public final class Amounts {

    private Amounts() {
    }

    /**
     * @return {@code amount} at scale 0
     * @throws InvalidAmountException if the amount is null, not positive or fractional
     */
    public static BigDecimal requirePositiveUnits(BigDecimal amount) {
        if (!isPositiveUnits(amount)) {
            throw new InvalidAmountException(amount);
        }
        return amount.setScale(0);
    }

    public static boolean isPositiveUnits(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return false;
        }
        return amount.stripTrailingZeros().scale() <= 0;
    }
}
