package com.quantbacktest.portfolio.domain.cost;

import lombok.Value;

/**
 * Proportional costs: commission plus slippage, both as a rate of notional.
 */
@Value
public class RateFeeModel implements FeeModel {

    public static final RateFeeModel ZERO = new RateFeeModel(0.0, 0.0);

    double commissionRate;
    double slippageRate;

    public RateFeeModel(double commissionRate, double slippageRate) {
        this.commissionRate = Math.max(0.0, commissionRate);
        this.slippageRate = Math.max(0.0, slippageRate);
    }

    public static RateFeeModel ofRate(double rate) {
        return new RateFeeModel(rate, 0.0);
    }

    public double totalRate() {
        return commissionRate + slippageRate;
    }

    @Override
    public double fee(double notionalAbs) {
        return Math.max(0.0, notionalAbs) * totalRate();
    }
}
