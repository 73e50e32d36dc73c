package com.quantbacktest.portfolio.domain.cost;

/**
 * Transaction fee charged on the absolute notional of a fill.
 */
@FunctionalInterface
public interface FeeModel {

    /**
     * @param notionalAbs absolute traded notional (quantity x price x multiplier)
     * @return fee in account currency, never negative
     */
    double fee(double notionalAbs);
}
