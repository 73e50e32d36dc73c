package com.quantbacktest.portfolio.domain.cost;

import com.quantbacktest.portfolio.domain.TradeSide;

import java.time.LocalDate;

/**
 * Tax-free instruments.
 */
public final class NoTaxModel implements TaxModel {

    public static final NoTaxModel INSTANCE = new NoTaxModel();

    private NoTaxModel() {
    }

    @Override
    public double tax(LocalDate date, TradeSide side, double notionalAbs) {
        return 0.0;
    }
}
