package com.fountain.pool.domain;

import com.fountain.pool.exception.ImmutableMoneyPoolException;
import com.fountain.pool.exception.InsufficientFundsException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One funding window of an owner's chain.
 *
 * <p>A pool is staged (number 0) until the repository commits it and assigns its
 * number. Target, duration and asset are frozen once the first contribution lands.
 */
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MoneyPool {

    private long number;

    private final String owner;

    private String want;

    @Builder.Default
    private BigDecimal target = BigDecimal.ZERO;

    private long start;

    private long duration;

    @Builder.Default
    private BigDecimal total = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal tapped = BigDecimal.ZERO;

    private final long previousNumber;

    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final Map<String, BigDecimal> contributions = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final Set<String> claimed = new HashSet<>();

    /**
     * A first pool for {@code owner}, awaiting configuration.
     */
    public static MoneyPool fresh(String owner, long start) {
        return MoneyPool.builder()
                .owner(owner)
                .start(start)
                .build();
    }

    /**
     * A new staged pool that carries this pool's target, duration and asset and
     * links back to it.
     */
    public MoneyPool cloneStartingAt(long start) {
        if (!isCommitted()) {
            throw new IllegalStateException("Cannot clone a money pool that has not been committed");
        }
        return MoneyPool.builder()
                .owner(owner)
                .want(want)
                .target(target)
                .duration(duration)
                .start(start)
                .previousNumber(number)
                .build();
    }

    public void assignNumber(long number) {
        if (isCommitted()) {
            throw new IllegalStateException("Money pool already numbered: " + this.number);
        }
        if (number < 1) {
            throw new IllegalArgumentException("Money pool numbers start at 1");
        }
        this.number = number;
    }

    public void configure(BigDecimal target, long duration, String want) {
        if (isFunded()) {
            throw new ImmutableMoneyPoolException(number);
        }
        this.target = target;
        this.duration = duration;
        this.want = want;
    }

    /**
     * @return true if this was the pool's first contribution
     */
    public boolean addContribution(String account, BigDecimal amount) {
        boolean firstFunding = !isFunded();
        contributions.merge(account, amount, BigDecimal::add);
        total = total.add(amount);
        return firstFunding;
    }

    public void addTapped(BigDecimal amount) {
        BigDecimal tappable = MoneyPoolMath.tappableAmount(this);
        if (amount.compareTo(tappable) > 0) {
            throw new InsufficientFundsException(number, amount, tappable);
        }
        tapped = tapped.add(amount);
    }

    /**
     * @return false if the account had already claimed this pool
     */
    public boolean markClaimed(String account) {
        return claimed.add(account);
    }

    public boolean hasClaimed(String account) {
        return claimed.contains(account);
    }

    public BigDecimal getContribution(String account) {
        return contributions.getOrDefault(account, BigDecimal.ZERO);
    }

    public Map<String, BigDecimal> getContributions() {
        return Collections.unmodifiableMap(contributions);
    }

    public int getSustainerCount() {
        return contributions.size();
    }

    public boolean isCommitted() {
        return number > 0;
    }

    public boolean isFunded() {
        return total.signum() > 0;
    }

    public boolean isConfigured() {
        return target.signum() > 0 && duration >= 1 && want != null;
    }
}
