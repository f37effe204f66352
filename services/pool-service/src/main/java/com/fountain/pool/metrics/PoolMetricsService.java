package com.fountain.pool.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Pool Metrics Service
 * Tracks ledger activity for monitoring
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoolMetricsService {

    private final MeterRegistry meterRegistry;

    public void recordPoolCreated(String trigger) {
        Counter.builder("fountain.pool.created")
                .tag("trigger", trigger)
                .description("Money pools committed to a chain")
                .register(meterRegistry)
                .increment();
    }

    public void recordContribution(String asset) {
        Counter.builder("fountain.pool.contributions")
                .tag("asset", asset)
                .description("Contributions recorded")
                .register(meterRegistry)
                .increment();
    }

    public void recordTap(String asset) {
        Counter.builder("fountain.pool.taps")
                .tag("asset", asset)
                .description("Owner withdrawals")
                .register(meterRegistry)
                .increment();
    }

    public void recordClaim(String asset) {
        Counter.builder("fountain.pool.claims")
                .tag("asset", asset)
                .description("Redistribution payouts")
                .register(meterRegistry)
                .increment();
    }

    public void recordTransferFailure(String direction) {
        log.debug("Recording transfer failure metric: direction={}", direction);
        Counter.builder("fountain.pool.transfer.failures")
                .tag("direction", direction)
                .description("Asset transfers rejected by the custody collaborator")
                .register(meterRegistry)
                .increment();
    }
}
