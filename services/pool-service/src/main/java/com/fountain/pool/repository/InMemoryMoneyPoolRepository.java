package com.fountain.pool.repository;

import com.fountain.pool.domain.MoneyPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Arena of money pools keyed by their dense number, with owner -> latest number
 * and sustainer -> owners side indices. Backward links live on the pools.
 */
@Repository
@Slf4j
public class InMemoryMoneyPoolRepository implements MoneyPoolRepository {

    private final Map<Long, MoneyPool> pools = new ConcurrentHashMap<>();
    private final Map<String, Long> latestNumbers = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sustainedOwners = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public MoneyPool save(MoneyPool pool) {
        if (pool.isCommitted()) {
            return pool;
        }
        pool.assignNumber(sequence.incrementAndGet());
        pools.put(pool.getNumber(), pool);
        latestNumbers.put(pool.getOwner(), pool.getNumber());
        log.debug("Committed money pool {} for owner {} (previous {})",
                pool.getNumber(), pool.getOwner(), pool.getPreviousNumber());
        return pool;
    }

    @Override
    public Optional<MoneyPool> findByNumber(long number) {
        return Optional.ofNullable(pools.get(number));
    }

    @Override
    public Optional<MoneyPool> findLatestByOwner(String owner) {
        Long number = latestNumbers.get(owner);
        return number == null ? Optional.empty() : findByNumber(number);
    }

    @Override
    public long count() {
        return sequence.get();
    }

    @Override
    public boolean addSustainedOwner(String sustainer, String owner) {
        return sustainedOwners
                .computeIfAbsent(sustainer, key -> Collections.synchronizedSet(new LinkedHashSet<>()))
                .add(owner);
    }

    @Override
    public Set<String> findSustainedOwners(String sustainer) {
        Set<String> owners = sustainedOwners.get(sustainer);
        if (owners == null) {
            return Collections.emptySet();
        }
        synchronized (owners) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(owners));
        }
    }
}
