package com.fountain.pool.integration;

import com.fountain.pool.exception.TransferFailedException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Asset balances kept in memory: one balance per (asset, account) and the
 * ledger's custody balance per asset.
 */
@Slf4j
public class InMemoryAssetCustody implements AssetTransferService {

    private final Map<String, Map<String, BigDecimal>> balances = new HashMap<>();
    private final Map<String, BigDecimal> custody = new HashMap<>();

    /**
     * Credits an account from outside the ledger.
     */
    public synchronized void deposit(String asset, String account, BigDecimal amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Deposit must be positive: " + amount);
        }
        balances.computeIfAbsent(asset, key -> new HashMap<>()).merge(account, amount, BigDecimal::add);
    }

    public synchronized BigDecimal balanceOf(String asset, String account) {
        return balances.getOrDefault(asset, Map.of()).getOrDefault(account, BigDecimal.ZERO);
    }

    public synchronized BigDecimal custodyBalance(String asset) {
        return custody.getOrDefault(asset, BigDecimal.ZERO);
    }

    @Override
    public synchronized void transferIn(String asset, String from, BigDecimal amount) {
        BigDecimal available = balanceOf(asset, from);
        if (available.compareTo(amount) < 0) {
            throw new TransferFailedException(asset, from, amount, "balance " + available + " is too low");
        }
        balances.get(asset).put(from, available.subtract(amount));
        custody.merge(asset, amount, BigDecimal::add);
        log.debug("Custody received {} {} from {}", amount, asset, from);
    }

    @Override
    public synchronized void transferOut(String asset, String to, BigDecimal amount) {
        BigDecimal held = custodyBalance(asset);
        if (held.compareTo(amount) < 0) {
            throw new TransferFailedException(asset, to, amount, "custody holds only " + held);
        }
        custody.put(asset, held.subtract(amount));
        balances.computeIfAbsent(asset, key -> new HashMap<>()).merge(to, amount, BigDecimal::add);
        log.debug("Custody paid {} {} to {}", amount, asset, to);
    }
}
