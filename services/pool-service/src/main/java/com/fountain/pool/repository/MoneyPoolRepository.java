package com.fountain.pool.repository;

import com.fountain.pool.domain.MoneyPool;

import java.util.Optional;
import java.util.Set;

/**
 * Storage of money pools: records indexed by number, each owner's latest pool,
 * and the owners every sustainer has contributed to.
 */
public interface MoneyPoolRepository {

    /**
     * Commits a staged pool: assigns the next number and makes it the owner's
     * latest pool. Saving an already committed pool is a no-op.
     */
    MoneyPool save(MoneyPool pool);

    Optional<MoneyPool> findByNumber(long number);

    Optional<MoneyPool> findLatestByOwner(String owner);

    /**
     * Number of pools ever committed.
     */
    long count();

    /**
     * @return true if {@code owner} was not yet recorded for {@code sustainer}
     */
    boolean addSustainedOwner(String sustainer, String owner);

    /**
     * Owners {@code sustainer} has contributed to, in first-contribution order.
     */
    Set<String> findSustainedOwners(String sustainer);
}
