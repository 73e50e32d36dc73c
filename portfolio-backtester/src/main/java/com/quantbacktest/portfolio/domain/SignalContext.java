package com.quantbacktest.portfolio.domain;

import lombok.Value;

import java.time.LocalDate;

/**
 * Indicator snapshot of the bar preceding the decision bar.
 */
@Value
public class SignalContext {

    private static final SignalContext INVALID = new SignalContext(false, null, null);

    boolean valid;
    /** Date of the decision bar. */
    LocalDate date;
    /** The previous bar, whose indicators drive the decision. */
    Bar previous;

    public static SignalContext invalid() {
        return INVALID;
    }

    public static SignalContext of(LocalDate date, Bar previous) {
        return new SignalContext(true, date, previous);
    }

    public double closePrev() {
        return previous.getClose();
    }

    public double maFast() {
        return previous.getMaFast();
    }

    public double maMid() {
        return previous.getMaMid();
    }

    public double maSlow() {
        return previous.getMaSlow();
    }

    public double atr() {
        return previous.getAtr();
    }

    public int longTermTrend() {
        return previous.getLongTermTrend();
    }

    public double macdLine() {
        return previous.getMacdLine();
    }

    public double macdSignal() {
        return previous.getMacdSignal();
    }

    public double macdHistogram() {
        return previous.getMacdHistogram();
    }
}
