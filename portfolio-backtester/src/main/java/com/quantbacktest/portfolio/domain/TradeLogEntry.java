package com.quantbacktest.portfolio.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One executed ledger fill.
 */
@Value
@Builder
public class TradeLogEntry {

    LocalDate time;
    String symbol;
    String traderId;
    TradeSide side;
    double quantityDelta;
    double quantityAfter;
    double price;
    /** Absolute notional (|delta| x price x multiplier). */
    double notional;
    double fee;
    double tax;
    String reason;

    public double quantityBefore() {
        return quantityAfter - quantityDelta;
    }

    /**
     * Cash moved by this fill: the signed notional plus all costs, as a debit.
     */
    public double cashChange(double multiplier) {
        return -(quantityDelta * price * multiplier) - fee - tax;
    }
}
