package com.quantbacktest.portfolio.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Position change as seen by a trader.
 */
@Value
@Builder
public class TraderTradeLogEntry {

    public enum FillAction {
        ENTER,
        EXIT,
        FLIP,
        REBALANCE;

        public static FillAction of(double quantityBefore, double quantityAfter) {
            if (quantityBefore == 0.0) {
                return ENTER;
            }
            if (quantityAfter == 0.0) {
                return EXIT;
            }
            if (Math.signum(quantityBefore) != Math.signum(quantityAfter)) {
                return FLIP;
            }
            return REBALANCE;
        }
    }

    LocalDate time;
    FillAction action;
    double price;
    double positionBefore;
    double positionAfter;
    String reason;
    double equityBefore;
    double equityAfter;
    double positionFraction;
}
