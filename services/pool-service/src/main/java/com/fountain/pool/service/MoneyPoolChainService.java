package com.fountain.pool.service;

import com.fountain.pool.domain.Amounts;
import com.fountain.pool.domain.MoneyPool;
import com.fountain.pool.domain.MoneyPoolMath;
import com.fountain.pool.domain.MoneyPoolState;
import com.fountain.pool.event.EventBatch;
import com.fountain.pool.event.MoneyPoolConfiguredEvent;
import com.fountain.pool.event.MoneyPoolInitializedEvent;
import com.fountain.pool.exception.InvalidConfigurationException;
import com.fountain.pool.exception.MoneyPoolNotFoundException;
import com.fountain.pool.metrics.PoolMetricsService;
import com.fountain.pool.repository.MoneyPoolRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves which pool of an owner's chain receives a configuration or a
 * contribution, staging a new pool when none is eligible.
 *
 * <p>New pools are cloned from the owner's latest pool on demand. A chain that
 * sat idle for any number of periods resumes with a single clone whose start is
 * aligned to the chain's phase.
 *
 * <p>Staged pools stay outside the repository until {@link #commit} so that an
 * operation failing after resolution leaves the chain untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MoneyPoolChainService {

    private final MoneyPoolRepository repository;
    private final PoolMetricsService metricsService;

    public Optional<MoneyPool> findLatest(String owner) {
        return repository.findLatestByOwner(owner);
    }

    /**
     * The owner's pool accepting contributions at {@code now}: the latest pool if
     * active, or its predecessor when the latest one is still queued.
     */
    public Optional<MoneyPool> findActive(String owner, Instant now) {
        Optional<MoneyPool> latest = repository.findLatestByOwner(owner);
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        MoneyPool pool = latest.get();
        MoneyPoolState state = stateOf(pool, now);
        if (state == MoneyPoolState.ACTIVE) {
            return latest;
        }
        if (state == MoneyPoolState.UPCOMING && pool.getPreviousNumber() != 0) {
            return repository.findByNumber(pool.getPreviousNumber())
                    .filter(previous -> stateOf(previous, now) == MoneyPoolState.ACTIVE);
        }
        return Optional.empty();
    }

    public Optional<MoneyPool> findUpcoming(String owner, Instant now) {
        return repository.findLatestByOwner(owner)
                .filter(pool -> stateOf(pool, now) == MoneyPoolState.UPCOMING);
    }

    /**
     * The owner's pools, newest first.
     */
    public List<MoneyPool> getChain(String owner) {
        List<MoneyPool> chain = new ArrayList<>();
        Optional<MoneyPool> cursor = repository.findLatestByOwner(owner);
        while (cursor.isPresent()) {
            MoneyPool pool = cursor.get();
            chain.add(pool);
            cursor = previousOf(pool);
        }
        return chain;
    }

    public Optional<MoneyPool> previousOf(MoneyPool pool) {
        if (pool.getPreviousNumber() == 0) {
            return Optional.empty();
        }
        return repository.findByNumber(pool.getPreviousNumber());
    }

    /**
     * Pool whose configuration may change at {@code now}. Never a funded pool.
     */
    public MoneyPool poolToConfigure(String owner, Instant now) {
        Optional<MoneyPool> active = findActive(owner, now);
        if (active.isPresent() && !active.get().isFunded()) {
            return active.get();
        }
        Optional<MoneyPool> upcoming = findUpcoming(owner, now);
        if (upcoming.isPresent()) {
            return upcoming.get();
        }
        Optional<MoneyPool> latest = repository.findLatestByOwner(owner);
        if (latest.isEmpty()) {
            return MoneyPool.fresh(owner, now.getEpochSecond());
        }
        MoneyPool pool = latest.get();
        // a still-active latest pool is funded here; queue the clone behind it
        long start = stateOf(pool, now) == MoneyPoolState.ACTIVE
                ? MoneyPoolMath.endOf(pool)
                : now.getEpochSecond();
        return pool.cloneStartingAt(start);
    }

    /**
     * Pool that receives a contribution at {@code now}.
     *
     * @throws MoneyPoolNotFoundException if the owner never configured a pool
     */
    public MoneyPool poolToContribute(String owner, Instant now) {
        Optional<MoneyPool> active = findActive(owner, now);
        if (active.isPresent()) {
            return active.get();
        }
        Optional<MoneyPool> upcoming = findUpcoming(owner, now);
        if (upcoming.isPresent()) {
            return upcoming.get();
        }
        MoneyPool latest = repository.findLatestByOwner(owner)
                .orElseThrow(() -> MoneyPoolNotFoundException.forOwner(owner));
        return latest.cloneStartingAt(MoneyPoolMath.nextAlignedStart(latest, now.getEpochSecond()));
    }

    /**
     * Applies target, duration and asset to the owner's configurable pool.
     */
    public MoneyPool configure(String owner, BigDecimal target, long duration, String want,
                               Instant now, EventBatch events) {
        validateConfiguration(target, duration, want);

        MoneyPool pool = poolToConfigure(owner, now);
        requireRepresentableSchedule(pool.getStart(), duration);
        pool.configure(target.setScale(0), duration, want);
        commit(pool, "configure", now, events);

        events.add(new MoneyPoolConfiguredEvent(now, pool.getNumber(), owner,
                pool.getTarget(), pool.getDuration(), pool.getWant()));
        log.info("Configured money pool {} for owner {}: target={}, duration={}s, want={}",
                pool.getNumber(), owner, pool.getTarget(), duration, want);
        return pool;
    }

    /**
     * Stores a staged pool and announces it. Committed pools pass through.
     */
    public MoneyPool commit(MoneyPool pool, String trigger, Instant now, EventBatch events) {
        if (pool.isCommitted()) {
            return pool;
        }
        repository.save(pool);
        metricsService.recordPoolCreated(trigger);
        events.add(new MoneyPoolInitializedEvent(now, pool.getNumber(), pool.getOwner(),
                pool.getPreviousNumber(), pool.getStart()));
        log.info("Initialized money pool {} for owner {} starting at {} (previous {})",
                pool.getNumber(), pool.getOwner(), pool.getStart(), pool.getPreviousNumber());
        return pool;
    }

    public MoneyPoolState stateOf(MoneyPool pool, Instant now) {
        return MoneyPoolMath.state(pool, now.getEpochSecond());
    }

    /**
     * The pool's end and the start of the pool rolled over after it must both fit in epoch seconds.
     */
    private void requireRepresentableSchedule(long start, long duration) {
        try {
            Math.addExact(Math.addExact(start, duration), duration);
        } catch (ArithmeticException e) {
            throw new InvalidConfigurationException("Duration " + duration + "s overflows the schedule starting at " + start);
        }
    }

    private void validateConfiguration(BigDecimal target, long duration, String want) {
        if (!Amounts.isPositiveUnits(target)) {
            throw new InvalidConfigurationException("Target must be a positive whole amount: " + target);
        }
        if (duration < 1) {
            throw new InvalidConfigurationException("Duration must be at least one second: " + duration);
        }
        if (want == null || want.isBlank()) {
            throw new InvalidConfigurationException("Asset must be specified");
        }
    }
}
