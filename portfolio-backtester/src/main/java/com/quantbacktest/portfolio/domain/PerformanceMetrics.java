package com.quantbacktest.portfolio.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Calculator for backtest performance metrics.
 */
public final class PerformanceMetrics {

    private PerformanceMetrics() {
    }

    /**
     * Calculate total return percentage.
     */
    public static BigDecimal calculateTotalReturn(double initialCapital, double finalValue) {
        if (initialCapital == 0.0 || !Double.isFinite(initialCapital) || !Double.isFinite(finalValue)) {
            return BigDecimal.ZERO;
        }

        return BigDecimal.valueOf(finalValue).subtract(BigDecimal.valueOf(initialCapital))
                .divide(BigDecimal.valueOf(initialCapital), 6, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(100))
                .setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Calculate annualized Sharpe ratio (risk-free rate of 0).
     */
    public static BigDecimal calculateSharpeRatio(List<Double> equityValues, int tradingDaysPerYear) {
        if (equityValues.size() < 2) {
            return BigDecimal.ZERO;
        }

        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityValues.size(); i++) {
            double prev = equityValues.get(i - 1);
            double current = equityValues.get(i);
            if (prev > 0) {
                returns.add(current / prev - 1);
            }
        }

        if (returns.isEmpty()) {
            return BigDecimal.ZERO;
        }

        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream()
                .mapToDouble(r -> (r - mean) * (r - mean))
                .sum() / returns.size();
        double stdDev = Math.sqrt(variance);

        if (stdDev == 0 || !Double.isFinite(stdDev)) {
            return BigDecimal.ZERO;
        }

        int days = tradingDaysPerYear > 0 ? tradingDaysPerYear : 252;
        double sharpe = (mean / stdDev) * Math.sqrt(days);
        return BigDecimal.valueOf(sharpe).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Calculate maximum drawdown percentage, returned as a non-positive number.
     */
    public static BigDecimal calculateMaxDrawdown(List<Double> equityValues) {
        if (equityValues.isEmpty()) {
            return BigDecimal.ZERO;
        }

        double maxDrawdown = 0.0;
        double peak = equityValues.get(0);

        for (double value : equityValues) {
            if (value > peak) {
                peak = value;
            }
            if (peak > 0) {
                double drawdown = (peak - value) / peak;
                if (drawdown > maxDrawdown) {
                    maxDrawdown = drawdown;
                }
            }
        }

        return BigDecimal.valueOf(maxDrawdown * 100).setScale(4, RoundingMode.HALF_UP).negate();
    }

    /**
     * Fraction of closed round trips whose net cash flow (including costs) was positive.
     * A round trip runs from a fill out of flat to the fill that returns the symbol to flat
     * or flips it to the other side. A flip splits its cash between the closed leg and the
     * new one in proportion to quantity.
     */
    public static BigDecimal calculateWinRate(List<TradeLogEntry> trades, Map<String, InstrumentSpec> specs) {
        Map<String, Double> openCash = new TreeMap<>();
        int wins = 0;
        int roundTrips = 0;

        for (TradeLogEntry trade : trades) {
            InstrumentSpec spec = specs.get(trade.getSymbol());
            double multiplier = spec != null ? spec.getMultiplier() : 1.0;
            double change = trade.cashChange(multiplier);
            double before = trade.quantityBefore();
            double after = trade.getQuantityAfter();

            boolean closes = before != 0.0 && (after == 0.0 || Math.signum(after) != Math.signum(before));
            if (!closes) {
                openCash.put(trade.getSymbol(), openCash.getOrDefault(trade.getSymbol(), 0.0) + change);
                continue;
            }

            double closedShare = after == 0.0 ? 1.0 : Math.abs(before) / Math.abs(trade.getQuantityDelta());
            double closedCash = openCash.getOrDefault(trade.getSymbol(), 0.0) + change * closedShare;
            roundTrips++;
            if (closedCash > 0) {
                wins++;
            }
            if (after == 0.0) {
                openCash.remove(trade.getSymbol());
            } else {
                openCash.put(trade.getSymbol(), change * (1 - closedShare));
            }
        }

        if (roundTrips == 0) {
            return BigDecimal.ZERO;
        }

        return BigDecimal.valueOf(wins)
                .divide(BigDecimal.valueOf(roundTrips), 4, RoundingMode.HALF_UP);
    }
}
