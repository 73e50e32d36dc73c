package com.quantbacktest.portfolio.domain.cost;

import com.quantbacktest.portfolio.domain.TradeSide;

import java.time.LocalDate;

/**
 * Transaction tax. The effective rate may depend on the trade date and side.
 */
@FunctionalInterface
public interface TaxModel {

    /**
     * @param date        trade date
     * @param side        BUY or SELL
     * @param notionalAbs absolute traded notional
     * @return tax in account currency, never negative
     */
    double tax(LocalDate date, TradeSide side, double notionalAbs);
}
