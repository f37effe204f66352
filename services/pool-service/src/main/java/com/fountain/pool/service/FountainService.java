package com.fountain.pool.service;

import com.fountain.common.concurrent.ConcurrencyUtils;
import com.fountain.pool.config.FountainProperties;
import com.fountain.pool.domain.MoneyPool;
import com.fountain.pool.domain.MoneyPoolMath;
import com.fountain.pool.dto.ClaimResult;
import com.fountain.pool.dto.MoneyPoolDto;
import com.fountain.pool.event.EventBatch;
import com.fountain.pool.event.MoneyPoolEventPublisher;
import com.fountain.pool.exception.MoneyPoolNotFoundException;
import com.fountain.pool.exception.ReentrantOperationException;
import com.fountain.pool.integration.CallerIdentityProvider;
import com.fountain.pool.repository.MoneyPoolRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point of the money-pool ledger.
 *
 * Every state-changing operation runs under one ledger lock, held across the
 * asset transfer, so operations are serialized. Starting an operation from a
 * thread that is already inside one is rejected. Events are published after the
 * lock is released.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FountainService {

    private static final String LOCK_NAME = "fountain-ledger";

    private final MoneyPoolChainService chainService;
    private final ContributionLedgerService ledgerService;
    private final RedistributionService redistributionService;
    private final MoneyPoolRepository repository;
    private final CallerIdentityProvider callerIdentityProvider;
    private final MoneyPoolEventPublisher eventPublisher;
    private final FountainProperties properties;
    private final Clock clock;

    private final ReentrantLock ledgerLock = new ReentrantLock(true);

    /**
     * Sets target, duration and asset of the caller's configurable pool, creating
     * the caller's chain on first use. A funded pool is never changed: the
     * configuration lands on the upcoming pool instead.
     */
    public MoneyPoolDto configure(BigDecimal target, long duration, String want) {
        String owner = callerIdentityProvider.currentAccount();
        return execute("configure", (now, events) ->
                mapToDto(chainService.configure(owner, target, duration, want, now, events), now));
    }

    /**
     * Contributes on the caller's own behalf.
     *
     * @return number of the pool that received the contribution
     */
    public long contribute(String owner, BigDecimal amount) {
        String payer = callerIdentityProvider.currentAccount();
        return contribute(payer, owner, amount, payer);
    }

    /**
     * Contributes from the caller, crediting {@code beneficiary}.
     *
     * @return number of the pool that received the contribution
     */
    public long contribute(String owner, BigDecimal amount, String beneficiary) {
        String payer = callerIdentityProvider.currentAccount();
        return contribute(payer, owner, amount, beneficiary);
    }

    private long contribute(String payer, String owner, BigDecimal amount, String beneficiary) {
        return execute("contribute", (now, events) ->
                ledgerService.contribute(payer, owner, amount, beneficiary, now, events).getNumber());
    }

    /**
     * Withdraws part of a pool's reserved share to the caller, who must own it.
     */
    public MoneyPoolDto tap(long poolNumber, BigDecimal amount) {
        String caller = callerIdentityProvider.currentAccount();
        return execute("tap", (now, events) ->
                mapToDto(ledgerService.tap(caller, poolNumber, amount, now, events), now));
    }

    /**
     * Pays the caller their unclaimed surplus shares from the given owners' chains.
     */
    public ClaimResult claimRedistribution(Collection<String> owners) {
        String sustainer = callerIdentityProvider.currentAccount();
        return execute("claimRedistribution", (now, events) ->
                redistributionService.claim(sustainer, owners, now, events));
    }

    /**
     * Claims from every owner the caller has ever contributed to.
     */
    public ClaimResult claimAllRedistributions() {
        String sustainer = callerIdentityProvider.currentAccount();
        return execute("claimAllRedistributions", (now, events) ->
                redistributionService.claim(sustainer, repository.findSustainedOwners(sustainer), now, events));
    }

    // ===== QUERIES =====

    public MoneyPoolDto getPool(long number) {
        return read(now -> mapToDto(requirePool(number), now));
    }

    public Optional<MoneyPoolDto> getActivePool(String owner) {
        return read(now -> chainService.findActive(owner, now).map(pool -> mapToDto(pool, now)));
    }

    public Optional<MoneyPoolDto> getUpcomingPool(String owner) {
        return read(now -> chainService.findUpcoming(owner, now).map(pool -> mapToDto(pool, now)));
    }

    public Optional<MoneyPoolDto> getLatestPool(String owner) {
        return read(now -> chainService.findLatest(owner).map(pool -> mapToDto(pool, now)));
    }

    /**
     * The owner's pools, newest first.
     */
    public List<MoneyPoolDto> getChain(String owner) {
        return read(now -> chainService.getChain(owner).stream()
                .map(pool -> mapToDto(pool, now))
                .collect(Collectors.toList()));
    }

    public BigDecimal getContribution(long poolNumber, String account) {
        return read(now -> requirePool(poolNumber).getContribution(account));
    }

    public BigDecimal getTappableAmount(long poolNumber) {
        return read(now -> MoneyPoolMath.tappableAmount(requirePool(poolNumber)));
    }

    public BigDecimal getUnclaimedShare(long poolNumber, String account) {
        return read(now -> redistributionService.unclaimedShare(requirePool(poolNumber), account));
    }

    public BigDecimal getClaimableAmount(String sustainer, String owner) {
        return read(now -> redistributionService.previewClaimable(sustainer, owner, now));
    }

    public Set<String> getSustainedOwners(String sustainer) {
        return read(now -> repository.findSustainedOwners(sustainer));
    }

    public int getSustainerCount(long poolNumber) {
        return read(now -> requirePool(poolNumber).getSustainerCount());
    }

    public long getPoolCount() {
        return read(now -> repository.count());
    }

    // ===== HELPERS =====

    @FunctionalInterface
    private interface LedgerOperation<T> {
        T apply(Instant now, EventBatch events);
    }

    private <T> T execute(String operation, LedgerOperation<T> action) {
        if (ledgerLock.isHeldByCurrentThread()) {
            log.warn("Rejected re-entrant {} while another ledger operation is in flight", operation);
            throw new ReentrantOperationException(operation);
        }
        EventBatch events = new EventBatch();
        try {
            return ConcurrencyUtils.withLock(ledgerLock, LOCK_NAME, properties.getLockTimeout(),
                    () -> action.apply(clock.instant(), events));
        } finally {
            // whatever committed before a failure is still announced
            eventPublisher.publishAll(events.drain());
        }
    }

    private <T> T read(Function<Instant, T> query) {
        return ConcurrencyUtils.withLock(ledgerLock, LOCK_NAME, properties.getLockTimeout(),
                () -> query.apply(clock.instant()));
    }

    private MoneyPool requirePool(long number) {
        return repository.findByNumber(number)
                .orElseThrow(() -> MoneyPoolNotFoundException.forNumber(number));
    }

    private MoneyPoolDto mapToDto(MoneyPool pool, Instant now) {
        long nowSeconds = now.getEpochSecond();
        return MoneyPoolDto.builder()
                .number(pool.getNumber())
                .owner(pool.getOwner())
                .want(pool.getWant())
                .target(pool.getTarget())
                .total(pool.getTotal())
                .tapped(pool.getTapped())
                .tappableAmount(MoneyPoolMath.tappableAmount(pool))
                .surplus(MoneyPoolMath.surplus(pool))
                .start(pool.getStart())
                .duration(pool.getDuration())
                .end(MoneyPoolMath.endOf(pool))
                .previousNumber(pool.getPreviousNumber())
                .state(MoneyPoolMath.state(pool, nowSeconds))
                .sustainerCount(pool.getSustainerCount())
                .build();
    }
}
