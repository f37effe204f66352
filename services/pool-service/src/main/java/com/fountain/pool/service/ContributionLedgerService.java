package com.fountain.pool.service;

import com.fountain.pool.domain.Amounts;
import com.fountain.pool.domain.MoneyPool;
import com.fountain.pool.domain.MoneyPoolMath;
import com.fountain.pool.event.ContributionRecordedEvent;
import com.fountain.pool.event.EventBatch;
import com.fountain.pool.event.FundsTappedEvent;
import com.fountain.pool.event.MoneyPoolActivatedEvent;
import com.fountain.pool.exception.InsufficientFundsException;
import com.fountain.pool.exception.MoneyPoolNotFoundException;
import com.fountain.pool.exception.UnauthorizedOperationException;
import com.fountain.pool.metrics.PoolMetricsService;
import com.fountain.pool.repository.MoneyPoolRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Records contributions into pools and owner withdrawals out of them.
 *
 * Funds move before the ledger changes: when the transfer fails nothing has
 * been committed, including a pool staged for the contribution.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContributionLedgerService {

    private final MoneyPoolChainService chainService;
    private final MoneyPoolRepository repository;
    private final AssetTransferGateway transferGateway;
    private final PoolMetricsService metricsService;

    /**
     * Pays {@code amount} from {@code payer} into the owner's current pool and
     * credits it to {@code beneficiary}.
     *
     * @return the pool that received the contribution
     */
    public MoneyPool contribute(String payer, String owner, BigDecimal amount, String beneficiary,
                                Instant now, EventBatch events) {
        BigDecimal units = Amounts.requirePositiveUnits(amount);
        requireAccount(owner, "owner");
        requireAccount(beneficiary, "beneficiary");

        MoneyPool pool = chainService.poolToContribute(owner, now);

        transferGateway.pull(pool.getWant(), payer, units);

        chainService.commit(pool, "contribution", now, events);
        boolean firstFunding = pool.addContribution(beneficiary, units);
        repository.addSustainedOwner(beneficiary, owner);
        metricsService.recordContribution(pool.getWant());

        if (firstFunding) {
            events.add(new MoneyPoolActivatedEvent(now, pool.getNumber(), owner,
                    pool.getTarget(), pool.getDuration(), pool.getWant()));
        }
        events.add(new ContributionRecordedEvent(now, pool.getNumber(), owner,
                payer, beneficiary, units, pool.getTotal()));

        log.info("Contribution of {} {} to money pool {} of {} by {} for {} (total {})",
                units, pool.getWant(), pool.getNumber(), owner, payer, beneficiary, pool.getTotal());
        return pool;
    }

    /**
     * Withdraws {@code amount} of the pool's reserved share to its owner.
     */
    public MoneyPool tap(String caller, long poolNumber, BigDecimal amount, Instant now, EventBatch events) {
        MoneyPool pool = repository.findByNumber(poolNumber)
                .orElseThrow(() -> MoneyPoolNotFoundException.forNumber(poolNumber));

        if (!pool.getOwner().equals(caller)) {
            log.warn("Rejected tap of money pool {} by {}: owner is {}", poolNumber, caller, pool.getOwner());
            throw new UnauthorizedOperationException("Only the owner may tap money pool " + poolNumber);
        }

        BigDecimal units = Amounts.requirePositiveUnits(amount);
        BigDecimal tappable = MoneyPoolMath.tappableAmount(pool);
        if (units.compareTo(tappable) > 0) {
            log.warn("Rejected tap of {} from money pool {}: only {} tappable", units, poolNumber, tappable);
            throw new InsufficientFundsException(poolNumber, units, tappable);
        }

        transferGateway.push(pool.getWant(), pool.getOwner(), units);

        pool.addTapped(units);
        metricsService.recordTap(pool.getWant());
        events.add(new FundsTappedEvent(now, poolNumber, pool.getOwner(), units, pool.getTapped()));

        log.info("Owner {} tapped {} {} from money pool {} (tapped {} of {})",
                caller, units, pool.getWant(), poolNumber, pool.getTapped(), pool.getTarget().min(pool.getTotal()));
        return pool;
    }

    private void requireAccount(String account, String role) {
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException("The " + role + " account must be specified");
        }
    }
}
