package com.quantbacktest.portfolio.domain;

import lombok.Getter;
import lombok.ToString;
import lombok.Value;

/**
 * Average-cost position for one symbol with accumulated realized PnL.
 * The average price is {@code NaN} exactly when the position is flat.
 */
@Getter
@ToString
public class Position {

    private final String symbol;
    private double quantity;
    private double avgPrice = Double.NaN;
    private double realizedPnL;

    public Position(String symbol) {
        this.symbol = symbol;
    }

    public boolean isFlat() {
        return quantity == 0.0;
    }

    public int sign() {
        return (int) Math.signum(quantity);
    }

    /**
     * Project a fill without mutating this position.
     * Realized PnL is expressed per unit of multiplier (price points x quantity).
     */
    public TradeProjection simulateTrade(double quantityDelta, double price) {
        double oldQty = quantity;
        double oldAvg = avgPrice;

        if (oldQty == 0.0) {
            double newAvg = quantityDelta == 0.0 ? Double.NaN : price;
            return new TradeProjection(quantityDelta, newAvg, 0.0);
        }

        double newQty = oldQty + quantityDelta;

        if (Math.signum(newQty) == Math.signum(oldQty) && Math.signum(quantityDelta) == Math.signum(oldQty)) {
            double newAvg = (Math.abs(oldQty) * oldAvg + Math.abs(quantityDelta) * price)
                    / Math.max(Double.MIN_NORMAL, Math.abs(newQty));
            return new TradeProjection(newQty, newAvg, 0.0);
        }

        // reduction or reversal: realize on the closed portion
        double closedQty = Math.min(Math.abs(quantityDelta), Math.abs(oldQty));
        double realizedDelta = closedQty * (price - oldAvg) * Math.signum(oldQty);

        double newAvg;
        if (newQty == 0.0) {
            newAvg = Double.NaN;
        } else if (Math.signum(newQty) == Math.signum(oldQty)) {
            newAvg = oldAvg;
        } else {
            newAvg = price;
        }
        return new TradeProjection(newQty, newAvg, realizedDelta);
    }

    /**
     * Apply a fill. {@code multiplier} scales the realized PnL into account currency.
     */
    void applyTrade(double quantityDelta, double price, double multiplier) {
        TradeProjection projection = simulateTrade(quantityDelta, price);
        this.quantity = projection.getQuantity();
        this.avgPrice = projection.getAvgPrice();
        this.realizedPnL += projection.getRealizedDelta() * multiplier;
    }

    public double notional(double price, double multiplier) {
        return quantity * price * multiplier;
    }

    public double unrealizedPnL(double price, double multiplier) {
        if (isFlat()) {
            return 0.0;
        }
        return (price - avgPrice) * quantity * multiplier;
    }

    @Value
    public static class TradeProjection {
        double quantity;
        double avgPrice;
        double realizedDelta;
    }
}
