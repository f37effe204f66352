package com.fountain.pool.service;

import com.fountain.pool.domain.MoneyPool;
import com.fountain.pool.domain.MoneyPoolMath;
import com.fountain.pool.domain.MoneyPoolState;
import com.fountain.pool.dto.ClaimResult;
import com.fountain.pool.event.EventBatch;
import com.fountain.pool.event.RedistributionClaimedEvent;
import com.fountain.pool.exception.NothingToClaimException;
import com.fountain.pool.metrics.PoolMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pays sustainers their proportional share of pool surpluses.
 *
 * <p>For every owner the walk starts at the owner's latest pool and follows the
 * backward links. Pools still upcoming or active are skipped, and the walk
 * carries on past them. The walk ends at the first pool the sustainer has
 * already claimed: claims always sweep from the newest pool backwards, so
 * everything older was settled by that earlier claim.
 *
 * <p>Each owner's claimable pools are split into runs of consecutive pools
 * sharing an asset. Runs are paid oldest first, one layer at a time, with one
 * transfer per asset in each layer; a single-asset claim is one transfer per
 * asset. Pools are marked claimed only once the transfer carrying their share
 * succeeded, so after a failed transfer the marked pools of a chain are always
 * its oldest ones and the walk still reaches what is left.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RedistributionService {

    private final MoneyPoolChainService chainService;
    private final AssetTransferGateway transferGateway;
    private final PoolMetricsService metricsService;

    public ClaimResult claim(String sustainer, Collection<String> owners, Instant now, EventBatch events) {
        if (owners == null || owners.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Owners must be specified");
        }

        List<List<List<MoneyPool>>> runsPerOwner = new ArrayList<>();
        BigDecimal owed = BigDecimal.ZERO;
        for (String owner : new LinkedHashSet<>(owners)) {
            List<MoneyPool> pools = findClaimablePools(sustainer, owner, now);
            for (MoneyPool pool : pools) {
                owed = owed.add(MoneyPoolMath.proportionalShare(pool, sustainer));
            }
            runsPerOwner.add(runsOldestFirst(pools));
        }

        if (owed.signum() == 0) {
            log.warn("Nothing to claim for {} across owners {}", sustainer, owners);
            throw new NothingToClaimException(sustainer);
        }

        Map<String, BigDecimal> payouts = new LinkedHashMap<>();
        List<Long> claimedPoolNumbers = new ArrayList<>();
        int depth = runsPerOwner.stream().mapToInt(List::size).max().orElse(0);
        for (int layer = 0; layer < depth; layer++) {
            Map<String, List<MoneyPool>> poolsByAsset = new LinkedHashMap<>();
            for (List<List<MoneyPool>> runs : runsPerOwner) {
                if (layer < runs.size()) {
                    List<MoneyPool> run = runs.get(layer);
                    poolsByAsset.computeIfAbsent(run.get(0).getWant(), asset -> new ArrayList<>()).addAll(run);
                }
            }
            for (Map.Entry<String, List<MoneyPool>> entry : poolsByAsset.entrySet()) {
                payOut(sustainer, entry.getKey(), entry.getValue(), now, events, payouts, claimedPoolNumbers);
            }
        }

        return ClaimResult.builder()
                .sustainer(sustainer)
                .payouts(payouts)
                .claimedPoolNumbers(claimedPoolNumbers)
                .build();
    }

    /**
     * Amount {@code sustainer} would receive from {@code owner}'s chain if they
     * claimed at {@code now}. Nothing is marked.
     */
    public BigDecimal previewClaimable(String sustainer, String owner, Instant now) {
        return findClaimablePools(sustainer, owner, now).stream()
                .map(pool -> MoneyPoolMath.proportionalShare(pool, sustainer))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * The account's share of the pool's surplus, or zero once it was paid out.
     * Also reported while the pool is still collecting.
     */
    public BigDecimal unclaimedShare(MoneyPool pool, String account) {
        if (pool.hasClaimed(account)) {
            return BigDecimal.ZERO;
        }
        return MoneyPoolMath.proportionalShare(pool, account);
    }

    private void payOut(String sustainer, String asset, List<MoneyPool> pools, Instant now, EventBatch events,
                        Map<String, BigDecimal> payouts, List<Long> claimedPoolNumbers) {
        BigDecimal amount = pools.stream()
                .map(pool -> MoneyPoolMath.proportionalShare(pool, sustainer))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        if (amount.signum() > 0) {
            transferGateway.push(asset, sustainer, amount);
        }

        List<Long> poolNumbers = new ArrayList<>();
        for (MoneyPool pool : pools) {
            pool.markClaimed(sustainer);
            poolNumbers.add(pool.getNumber());
        }
        claimedPoolNumbers.addAll(poolNumbers);

        if (amount.signum() > 0) {
            payouts.merge(asset, amount, BigDecimal::add);
            metricsService.recordClaim(asset);
            events.add(new RedistributionClaimedEvent(now, sustainer, asset, amount, poolNumbers));
            log.info("Paid redistribution of {} {} to {} from money pools {}", amount, asset, sustainer, poolNumbers);
        }
    }

    /**
     * Splits newest-first pools into runs of one asset, oldest run first.
     */
    private static List<List<MoneyPool>> runsOldestFirst(List<MoneyPool> newestFirst) {
        List<List<MoneyPool>> runs = new ArrayList<>();
        List<MoneyPool> run = null;
        for (int i = newestFirst.size() - 1; i >= 0; i--) {
            MoneyPool pool = newestFirst.get(i);
            if (run == null || !run.get(0).getWant().equals(pool.getWant())) {
                run = new ArrayList<>();
                runs.add(run);
            }
            run.add(pool);
        }
        return runs;
    }

    private List<MoneyPool> findClaimablePools(String sustainer, String owner, Instant now) {
        List<MoneyPool> claimable = new ArrayList<>();
        Optional<MoneyPool> cursor = chainService.findLatest(owner);
        while (cursor.isPresent()) {
            MoneyPool pool = cursor.get();
            if (pool.hasClaimed(sustainer)) {
                break;
            }
            if (chainService.stateOf(pool, now) == MoneyPoolState.REDISTRIBUTING) {
                claimable.add(pool);
            }
            cursor = chainService.previousOf(pool);
        }
        return claimable;
    }
}
