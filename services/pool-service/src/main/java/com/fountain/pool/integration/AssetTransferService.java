package com.fountain.pool.integration;

import com.fountain.pool.exception.TransferFailedException;

import java.math.BigDecimal;

/**
 * Moves assets between accounts and the ledger's custody.
 *
 * Calls are synchronous. A call that returns normally has moved the funds; a
 * call that fails must leave balances untouched.
 */
public interface AssetTransferService {

    /**
     * Pulls {@code amount} of {@code asset} from {@code from} into custody.
     *
     * @throws TransferFailedException if the funds were not moved
     */
    void transferIn(String asset, String from, BigDecimal amount);

    /**
     * Pays {@code amount} of {@code asset} out of custody to {@code to}.
     *
     * @throws TransferFailedException if the funds were not moved
     */
    void transferOut(String asset, String to, BigDecimal amount);
}
