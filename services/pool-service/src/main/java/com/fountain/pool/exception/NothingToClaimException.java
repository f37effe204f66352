package com.fountain.pool.exception;

import com.fountain.common.exception.ErrorCode;

/**
 * Exception thrown when a sustainer has no unclaimed redistribution
 */
public class NothingToClaimException extends FountainException {

    public NothingToClaimException(String sustainer) {
        super(ErrorCode.POOL_NOTHING_TO_CLAIM, "No redistribution available to claim for " + sustainer);
        withMetadata("sustainer", sustainer);
    }
}
