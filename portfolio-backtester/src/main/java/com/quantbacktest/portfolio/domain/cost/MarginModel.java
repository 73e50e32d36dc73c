package com.quantbacktest.portfolio.domain.cost;

/**
 * Cash that must stay reserved against an open position.
 */
@FunctionalInterface
public interface MarginModel {

    /**
     * @param quantity   signed position quantity (+long / -short)
     * @param price      mark price
     * @param multiplier contract multiplier
     * @return required margin, never negative
     */
    double margin(double quantity, double price, double multiplier);
}
