package com.quantbacktest.portfolio.domain.cost;

import com.quantbacktest.portfolio.domain.TradeSide;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sell-side securities transaction tax whose rate changes by calendar year
 * (the Korean STT went from 0.18% in 2024 to 0.15% in 2025).
 * Years without an explicit rate fall back to the default rate.
 */
@ToString
@EqualsAndHashCode
public class CalendarYearTaxModel implements TaxModel {

    private final Map<Integer, Double> ratesByYear;
    private final double defaultRate;

    public CalendarYearTaxModel(Map<Integer, Double> ratesByYear, double defaultRate) {
        TreeMap<Integer, Double> rates = new TreeMap<>();
        ratesByYear.forEach((year, rate) -> rates.put(year, Math.max(0.0, rate)));
        this.ratesByYear = Collections.unmodifiableMap(rates);
        this.defaultRate = Math.max(0.0, defaultRate);
    }

    public static CalendarYearTaxModel flat(double rate) {
        return new CalendarYearTaxModel(Map.of(), rate);
    }

    /**
     * KRX stock transaction tax: separate 2024 and 2025 rates, later years use the 2025 rate.
     */
    public static CalendarYearTaxModel krxStt(double rate2024, double rate2025) {
        return new CalendarYearTaxModel(Map.of(2024, rate2024, 2025, rate2025), rate2025);
    }

    public double rateFor(LocalDate date) {
        return ratesByYear.getOrDefault(date.getYear(), defaultRate);
    }

    @Override
    public double tax(LocalDate date, TradeSide side, double notionalAbs) {
        if (side != TradeSide.SELL) {
            return 0.0;
        }
        return Math.max(0.0, notionalAbs) * rateFor(date);
    }
}
