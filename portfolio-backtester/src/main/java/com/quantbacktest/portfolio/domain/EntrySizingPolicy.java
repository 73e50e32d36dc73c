package com.quantbacktest.portfolio.domain;

/**
 * How a trader's entry fraction combines with the engine's notional cap.
 */
public enum EntrySizingPolicy {
    /**
     * A fresh entry from flat is scaled by the trader's fraction, then
     * downsized by the engine if the ledger rejects it.
     */
    FRACTION_THEN_DOWNSIZE,
    /** Always size to the full notional cap. */
    IGNORE_FRACTION
}
