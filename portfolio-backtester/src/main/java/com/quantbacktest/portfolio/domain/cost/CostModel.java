package com.quantbacktest.portfolio.domain.cost;

import com.quantbacktest.portfolio.domain.TradeSide;

import java.time.LocalDate;

/**
 * The cost capabilities the ledger needs from an instrument.
 */
public interface CostModel {

    double fee(double notionalAbs);

    double tax(LocalDate date, TradeSide side, double notionalAbs);

    double margin(double quantity, double price, double multiplier);
}
