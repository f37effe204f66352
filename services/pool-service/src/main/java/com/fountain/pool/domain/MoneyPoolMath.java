package com.fountain.pool.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pure calculations over a {@link MoneyPool}. Nothing here reads a clock or
 * mutates a pool; callers pass {@code now} in epoch seconds.
 */
public final class MoneyPoolMath {

    private MoneyPoolMath() {
    }

    /**
     * Start plus duration, saturated at {@link Long#MAX_VALUE}: a pool whose end
     * cannot be represented never ends.
     */
    public static long endOf(MoneyPool pool) {
        long start = pool.getStart();
        long duration = pool.getDuration();
        if (duration > Long.MAX_VALUE - start) {
            return Long.MAX_VALUE;
        }
        return start + duration;
    }

    public static MoneyPoolState state(MoneyPool pool, long now) {
        if (now < pool.getStart()) {
            return MoneyPoolState.UPCOMING;
        }
        if (now <= endOf(pool)) {
            return MoneyPoolState.ACTIVE;
        }
        return MoneyPoolState.REDISTRIBUTING;
    }

    /**
     * Part of the total, up to the target, that the owner has not withdrawn yet.
     */
    public static BigDecimal tappableAmount(MoneyPool pool) {
        return pool.getTarget().min(pool.getTotal()).subtract(pool.getTapped());
    }

    /**
     * Contributions beyond the target.
     */
    public static BigDecimal surplus(MoneyPool pool) {
        return pool.getTotal().subtract(pool.getTarget()).max(BigDecimal.ZERO);
    }

    /**
     * {@code surplus * contributed / total}, truncated toward zero.
     */
    public static BigDecimal proportionalShare(MoneyPool pool, String account) {
        if (pool.getTotal().signum() == 0) {
            return BigDecimal.ZERO;
        }
        return surplus(pool)
                .multiply(pool.getContribution(account))
                .divide(pool.getTotal(), 0, RoundingMode.DOWN);
    }

    /**
     * Start of the pool that follows {@code pool} when it is rolled forward at
     * {@code now}.
     *
     * <p>Within one duration of the pool's end the next pool starts exactly at
     * that end. Past that, the start snaps to the phase the chain would have
     * reached had pools ticked continuously, without creating the missed ones.
     */
    public static long nextAlignedStart(MoneyPool pool, long now) {
        long duration = pool.getDuration();
        if (duration < 1) {
            throw new IllegalStateException("Money pool " + pool.getNumber() + " has no duration");
        }
        long end = endOf(pool);
        if (now < end || now - end < duration) {
            return end;
        }
        long offset = (now - end) % duration;
        return now - offset;
    }
}
