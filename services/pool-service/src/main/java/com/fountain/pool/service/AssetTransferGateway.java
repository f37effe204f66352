package com.fountain.pool.service;

import com.fountain.pool.exception.ReentrantOperationException;
import com.fountain.pool.exception.TransferFailedException;
import com.fountain.pool.integration.AssetTransferService;
import com.fountain.pool.metrics.PoolMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Calls the asset transfer collaborator and normalizes its failures into
 * {@link TransferFailedException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssetTransferGateway {

    private final AssetTransferService assetTransferService;
    private final PoolMetricsService metricsService;

    public void pull(String asset, String from, BigDecimal amount) {
        execute("in", asset, from, amount, () -> assetTransferService.transferIn(asset, from, amount));
    }

    public void push(String asset, String to, BigDecimal amount) {
        execute("out", asset, to, amount, () -> assetTransferService.transferOut(asset, to, amount));
    }

    private void execute(String direction, String asset, String account, BigDecimal amount, Runnable transfer) {
        try {
            transfer.run();
        } catch (ReentrantOperationException e) {
            metricsService.recordTransferFailure(direction);
            throw e;
        } catch (TransferFailedException e) {
            metricsService.recordTransferFailure(direction);
            log.error("Transfer {} of {} {} for {} rejected: {}", direction, amount, asset, account, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metricsService.recordTransferFailure(direction);
            log.error("Transfer {} of {} {} for {} failed", direction, amount, asset, account, e);
            throw new TransferFailedException(asset, account, amount, e);
        }
    }
}
