package com.quantbacktest.portfolio.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Point-in-time view of the ledger, optionally restricted to one trader.
 */
@Value
@Builder
public class LedgerSummary {

    /** Empty for the whole portfolio. */
    String traderId;
    double equity;
    double cash;
    double reservedMargin;
    List<PositionSnapshot> positions;
    double fees;
    double taxes;
    double borrow;
    /** Realized plus unrealized PnL net of fees, taxes and borrow. */
    double contributionPnL;

    public long openPositionCount() {
        return positions.stream().filter(p -> p.getQuantity() != 0.0).count();
    }

    @Value
    @Builder
    public static class PositionSnapshot {
        String symbol;
        String traderId;
        double quantity;
        double avgPrice;
        double lastPrice;
        double multiplier;
        double notional;
        double realizedPnL;
        double unrealizedPnL;
    }
}
