package com.quantbacktest.portfolio.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One daily bar with the indicator values computed through its close.
 * Missing indicators are {@code NaN}.
 */
@Value
@Builder(toBuilder = true)
public class Bar {

    LocalDate date;
    double open;
    double high;
    double low;
    double close;

    @Builder.Default
    double maFast = Double.NaN;
    @Builder.Default
    double maMid = Double.NaN;
    @Builder.Default
    double maSlow = Double.NaN;
    @Builder.Default
    double maLongTerm = Double.NaN;
    @Builder.Default
    double atr = Double.NaN;
    /** Sign of the long-term moving average slope: -1, 0 or +1. */
    int longTermTrend;
    @Builder.Default
    double macdLine = Double.NaN;
    @Builder.Default
    double macdSignal = Double.NaN;
    @Builder.Default
    double macdHistogram = Double.NaN;

    public boolean isLongStacked() {
        return Double.isFinite(maFast) && Double.isFinite(maMid) && Double.isFinite(maSlow)
                && maFast > maMid && maMid > maSlow;
    }

    public boolean isShortStacked() {
        return Double.isFinite(maFast) && Double.isFinite(maMid) && Double.isFinite(maSlow)
                && maSlow > maMid && maMid > maFast;
    }
}
