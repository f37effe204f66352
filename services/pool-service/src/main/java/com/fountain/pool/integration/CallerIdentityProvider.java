package com.fountain.pool.integration;

/**
 * Supplies the authenticated account of the current operation.
 */
public interface CallerIdentityProvider {

    /**
     * @throws com.fountain.pool.exception.UnauthorizedOperationException if no
     *         account is authenticated
     */
    String currentAccount();
}
