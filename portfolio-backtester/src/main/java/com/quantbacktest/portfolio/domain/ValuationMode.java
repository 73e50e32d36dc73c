package com.quantbacktest.portfolio.domain;

/**
 * Prices used for the end-of-day equity sample.
 */
public enum ValuationMode {
    /** Today's close. */
    CLOSE,
    /** The next common date's open; today's close on the last date. */
    NEXT_OPEN
}
