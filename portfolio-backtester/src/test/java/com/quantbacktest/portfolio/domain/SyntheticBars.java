package com.quantbacktest.portfolio.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic bar fixtures for tests. Dates are consecutive weekdays.
 */
public final class SyntheticBars {

    public static final LocalDate START = LocalDate.of(2024, 1, 1); // a Monday

    private SyntheticBars() {
    }

    public static List<LocalDate> weekdays(LocalDate start, int count) {
        List<LocalDate> dates = new ArrayList<>(count);
        LocalDate date = start;
        while (dates.size() < count) {
            if (date.getDayOfWeek() != DayOfWeek.SATURDAY && date.getDayOfWeek() != DayOfWeek.SUNDAY) {
                dates.add(date);
            }
            date = date.plusDays(1);
        }
        return dates;
    }

    /**
     * Bars whose open, high, low and close all equal {@code price}.
     */
    public static List<Bar> flat(LocalDate start, int count, double price) {
        List<Bar> bars = new ArrayList<>(count);
        for (LocalDate date : weekdays(start, count)) {
            bars.add(Bar.builder().date(date).open(price).high(price).low(price).close(price).build());
        }
        return bars;
    }

    /**
     * One bar per open price; close equals open and the range is one percent either side.
     */
    public static List<Bar> fromOpens(LocalDate start, double... opens) {
        List<Bar> bars = new ArrayList<>(opens.length);
        List<LocalDate> dates = weekdays(start, opens.length);
        for (int i = 0; i < opens.length; i++) {
            double open = opens[i];
            bars.add(Bar.builder()
                    .date(dates.get(i))
                    .open(open)
                    .high(open * 1.01)
                    .low(open * 0.99)
                    .close(open)
                    .build());
        }
        return bars;
    }

    /**
     * Flat-priced bars with a fixed moving-average stack on every bar.
     *
     * @param direction +1 for fast &gt; mid &gt; slow, -1 for the inverse, 0 for no stack
     */
    public static List<Bar> stacked(LocalDate start, int count, double price, int direction) {
        List<Bar> bars = new ArrayList<>(count);
        for (LocalDate date : weekdays(start, count)) {
            bars.add(stackedBar(date, price, direction));
        }
        return bars;
    }

    public static Bar stackedBar(LocalDate date, double price, int direction) {
        double fast = price;
        double mid = price;
        double slow = price;
        if (direction > 0) {
            fast = price * 1.03;
            mid = price * 1.01;
            slow = price * 0.99;
        } else if (direction < 0) {
            fast = price * 0.97;
            mid = price * 0.99;
            slow = price * 1.01;
        }
        return Bar.builder()
                .date(date)
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .maFast(fast)
                .maMid(mid)
                .maSlow(slow)
                .atr(price * 0.02)
                .longTermTrend(direction)
                .build();
    }

    /**
     * Seeded random walk with a slowly rotating drift and computed indicators:
     * SMA 5/20/60, long-term SMA 120 with its slope sign, ATR 14 and MACD 12/26/9.
     */
    public static List<Bar> randomWalk(LocalDate start, int count, double startPrice, long seed) {
        Random random = new Random(seed);
        List<LocalDate> dates = weekdays(start, count);

        double[] open = new double[count];
        double[] high = new double[count];
        double[] low = new double[count];
        double[] close = new double[count];

        double previousClose = startPrice;
        for (int i = 0; i < count; i++) {
            double drift = 0.002 * Math.sin(2 * Math.PI * i / 120.0);
            double gap = 0.003 * random.nextGaussian();
            open[i] = previousClose * (1 + gap);
            close[i] = open[i] * Math.exp(drift + 0.012 * random.nextGaussian());
            high[i] = Math.max(open[i], close[i]) * (1 + Math.abs(0.005 * random.nextGaussian()));
            low[i] = Math.min(open[i], close[i]) * (1 - Math.abs(0.005 * random.nextGaussian()));
            previousClose = close[i];
        }

        double[] sma5 = sma(close, 5);
        double[] sma20 = sma(close, 20);
        double[] sma60 = sma(close, 60);
        double[] sma120 = sma(close, 120);
        double[] atr = atr(high, low, close, 14);
        double[] ema12 = ema(close, 12);
        double[] ema26 = ema(close, 26);
        double[] macdLine = new double[count];
        for (int i = 0; i < count; i++) {
            macdLine[i] = ema12[i] - ema26[i];
        }
        double[] macdSignal = ema(macdLine, 9);

        List<Bar> bars = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int trend = 0;
            if (i > 0 && Double.isFinite(sma120[i]) && Double.isFinite(sma120[i - 1])) {
                trend = (int) Math.signum(sma120[i] - sma120[i - 1]);
            }
            bars.add(Bar.builder()
                    .date(dates.get(i))
                    .open(open[i])
                    .high(high[i])
                    .low(low[i])
                    .close(close[i])
                    .maFast(sma5[i])
                    .maMid(sma20[i])
                    .maSlow(sma60[i])
                    .maLongTerm(sma120[i])
                    .atr(atr[i])
                    .longTermTrend(trend)
                    .macdLine(i >= 25 ? macdLine[i] : Double.NaN)
                    .macdSignal(i >= 33 ? macdSignal[i] : Double.NaN)
                    .macdHistogram(i >= 33 ? macdLine[i] - macdSignal[i] : Double.NaN)
                    .build());
        }
        return bars;
    }

    public static BarFeed feed(String symbol, List<Bar> bars) {
        return new ListBarFeed(symbol, bars);
    }

    private static double[] sma(double[] values, int window) {
        double[] out = new double[values.length];
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= window) {
                sum -= values[i - window];
            }
            out[i] = i >= window - 1 ? sum / window : Double.NaN;
        }
        return out;
    }

    private static double[] ema(double[] values, int window) {
        double[] out = new double[values.length];
        double alpha = 2.0 / (window + 1);
        for (int i = 0; i < values.length; i++) {
            out[i] = i == 0 ? values[0] : alpha * values[i] + (1 - alpha) * out[i - 1];
        }
        return out;
    }

    private static double[] atr(double[] high, double[] low, double[] close, int window) {
        double[] trueRange = new double[high.length];
        for (int i = 0; i < high.length; i++) {
            double range = high[i] - low[i];
            if (i > 0) {
                range = Math.max(range, Math.max(Math.abs(high[i] - close[i - 1]), Math.abs(low[i] - close[i - 1])));
            }
            trueRange[i] = range;
        }
        return sma(trueRange, window);
    }
}
