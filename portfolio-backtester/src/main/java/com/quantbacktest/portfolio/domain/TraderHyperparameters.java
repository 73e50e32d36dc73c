package com.quantbacktest.portfolio.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;

/**
 * Tunable parameters of {@link SignalTrader}. Use {@link #normalized()} before reading.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TraderHyperparameters {

    /** Minimum fast/mid separation, relative to the mid MA, to enter. */
    @Builder.Default
    double spreadEnterPct = 0.003;
    @Builder.Default
    double spreadExitPct = 0.001;

    /** Measure separation in ATR units when ATR is available. */
    @Builder.Default
    boolean useAtrFilter = true;
    @Builder.Default
    double atrEnterK = 0.35;
    @Builder.Default
    double atrExitK = 0.10;

    @Builder.Default
    int confirmDays = 2;
    @Builder.Default
    int minHoldDays = 3;
    @Builder.Default
    int cooldownDays = 0;

    @Builder.Default
    boolean useLongTrendFilter = true;
    @Builder.Default
    boolean useShortTrendFilter = false;

    @Builder.Default
    double longDailyStop = 0.05;
    @Builder.Default
    double longTrailStop = 0.10;
    @Builder.Default
    double shortDailyStop = 0.03;
    @Builder.Default
    double shortTrailStop = 0.10;

    @Builder.Default
    boolean enableShort = true;

    @Builder.Default
    MacdSignalMode macdSignalMode = MacdSignalMode.HISTOGRAM;
    @Builder.Default
    boolean useMacdRegimeFilter = false;
    @Builder.Default
    boolean useMacdExit = false;
    @Builder.Default
    boolean useMacdSizeScaling = false;
    @Builder.Default
    double macdSizeMin = 0.25;
    @Builder.Default
    double macdSizeMax = 1.0;
    /** MACD strength, in ATR units, at which the entry fraction saturates at {@code macdSizeMax}. */
    @Builder.Default
    double macdSizeAtrK = 0.5;

    @Builder.Default
    boolean usePrevCloseFilter = false;
    @Builder.Default
    PrevCloseReference prevCloseReference = PrevCloseReference.MID;

    public static TraderHyperparameters defaults() {
        return TraderHyperparameters.builder().build();
    }

    /**
     * Copy with every value clamped into its legal range.
     */
    public TraderHyperparameters normalized() {
        double sizeMin = clampUnit(macdSizeMin);
        double sizeMax = clampUnit(macdSizeMax);
        if (sizeMax < sizeMin) {
            double tmp = sizeMin;
            sizeMin = sizeMax;
            sizeMax = tmp;
        }
        return toBuilder()
                .spreadEnterPct(nonNegative(spreadEnterPct))
                .spreadExitPct(nonNegative(spreadExitPct))
                .atrEnterK(nonNegative(atrEnterK))
                .atrExitK(nonNegative(atrExitK))
                .confirmDays(Math.max(1, confirmDays))
                .minHoldDays(Math.max(0, minHoldDays))
                .cooldownDays(Math.max(0, cooldownDays))
                .macdSizeMin(sizeMin)
                .macdSizeMax(sizeMax)
                .macdSizeAtrK(Double.isFinite(macdSizeAtrK) && macdSizeAtrK > 0 ? macdSizeAtrK : 0.5)
                .macdSignalMode(macdSignalMode != null ? macdSignalMode : MacdSignalMode.HISTOGRAM)
                .prevCloseReference(prevCloseReference != null ? prevCloseReference : PrevCloseReference.MID)
                .build();
    }

    private static double nonNegative(double value) {
        return Double.isFinite(value) ? Math.max(0.0, value) : 0.0;
    }

    private static double clampUnit(double value) {
        return Double.isFinite(value) ? Math.max(0.0, Math.min(1.0, value)) : 0.0;
    }

    public enum MacdSignalMode {
        /** Bullish while the histogram is positive. */
        HISTOGRAM,
        /** Bullish while the MACD line is above its signal line. */
        CROSS;

        @JsonCreator
        public static MacdSignalMode from(String value) {
            if (value == null) {
                return HISTOGRAM;
            }
            String v = value.trim().toUpperCase(Locale.ROOT);
            return v.equals("CROSS") ? CROSS : HISTOGRAM;
        }
    }

    public enum PrevCloseReference {
        /** Compare the previous close with the mid moving average. */
        MID,
        /** Compare the previous close with the fast moving average. */
        FAST;

        @JsonCreator
        public static PrevCloseReference from(String value) {
            if (value == null) {
                return MID;
            }
            String v = value.trim().toUpperCase(Locale.ROOT);
            return v.equals("FAST") || v.equals("WEEK") ? FAST : MID;
        }
    }
}
