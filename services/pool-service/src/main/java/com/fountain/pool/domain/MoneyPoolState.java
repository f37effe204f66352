package com.fountain.pool.domain;

/**
 * Lifecycle of a money pool relative to the current time
 */
public enum MoneyPoolState {
    /** now &lt; start */
    UPCOMING,
    /** start &le; now &le; start + duration */
    ACTIVE,
    /** now &gt; start + duration; surplus may be claimed */
    REDISTRIBUTING
}
