package com.quantbacktest.portfolio.domain;

/**
 * Outcome of a ledger order. Rejections never mutate ledger state.
 */
public enum ExecutionResult {
    EXECUTED,
    NO_CHANGE,
    REJECTED_INVALID_PRICE,
    REJECTED_SHORT_NOT_ALLOWED,
    REJECTED_INSUFFICIENT_CASH;

    public boolean isAccepted() {
        return this == EXECUTED || this == NO_CHANGE;
    }
}
