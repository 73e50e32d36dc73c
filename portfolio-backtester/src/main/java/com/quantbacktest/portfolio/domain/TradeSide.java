package com.quantbacktest.portfolio.domain;

/**
 * Direction of a fill. Negative quantity deltas are sells.
 */
public enum TradeSide {
    BUY, SELL;

    public static TradeSide of(double quantityDelta) {
        return quantityDelta < 0 ? SELL : BUY;
    }
}
