package com.quantbacktest.portfolio.domain;

import com.quantbacktest.portfolio.domain.cost.SignalCostModel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Moving-average stacking trader with ATR separation, confirmation bars,
 * intraday stops and optional MACD and previous-close filters.
 *
 * <p>Decisions at bar {@code t} use only the indicators of bar {@code t - 1}
 * and execute at the open of {@code t}. Missing indicators give a flat target.
 */
@Slf4j
public class SignalTrader extends AbstractTrader {

    private static final double MIN_DENOMINATOR = Double.MIN_NORMAL;

    @Getter
    private final TraderHyperparameters hyperparameters;

    public SignalTrader(String name, double initialEquity, SignalCostModel costModel,
                        TraderHyperparameters hyperparameters) {
        super(name, initialEquity, costModel);
        TraderHyperparameters hp = hyperparameters != null ? hyperparameters : TraderHyperparameters.defaults();
        this.hyperparameters = hp.normalized();
    }

    @Override
    protected void onStep(int t) {
        Bar bar = feed.get(t);
        double open = bar.getOpen();

        applyShortBorrow();

        if (position != 0) {
            updateExtrema(open, bar.getClose());
        }

        if (shortDeadlineReached(t)) {
            exitPosition(t, open, REASON_FORCED_COVER);
            recordCurves(t);
            return;
        }

        if (checkStop(t, bar)) {
            recordCurves(t);
            return;
        }

        SignalContext ctx = feed.previousContext(t);
        if (!ctx.isValid()) {
            recordCurves(t);
            return;
        }

        int target = decideTarget(t, ctx);
        if (target != position) {
            if (position != 0) {
                exitPosition(t, open, REASON_SIGNAL_EXIT);
            }
            if (target != 0) {
                enterPosition(t, target, open, entryFraction(ctx), REASON_SIGNAL_ENTRY);
            }
        }

        mark(open, feed.get(t + 1).getOpen());
        recordCurves(t);
    }

    @Override
    protected int cooldownDays() {
        return hyperparameters.getCooldownDays();
    }

    /**
     * Exit at the active stop if today's range touches it.
     *
     * @return true when a stop fired
     */
    private boolean checkStop(int t, Bar bar) {
        if (position == 0) {
            return false;
        }
        TraderHyperparameters hp = hyperparameters;
        double open = bar.getOpen();

        double stopPrice;
        double referencePrice;
        StopLogEntry.StopType type;
        if (position == 1) {
            double dailyPrice = open * (1 - hp.getLongDailyStop());
            double trailPrice = histMax * (1 - hp.getLongTrailStop());
            stopPrice = Math.max(dailyPrice, trailPrice);
            if (!(bar.getLow() <= stopPrice)) {
                return false;
            }
            if (dailyPrice >= trailPrice) {
                type = StopLogEntry.StopType.LONG_DAILY;
                referencePrice = dailyPrice;
            } else {
                type = StopLogEntry.StopType.LONG_TRAIL;
                referencePrice = histMax;
            }
        } else {
            double dailyPrice = open * (1 + hp.getShortDailyStop());
            double trailPrice = histMin * (1 + hp.getShortTrailStop());
            stopPrice = Math.min(dailyPrice, trailPrice);
            if (!(bar.getHigh() >= stopPrice)) {
                return false;
            }
            if (dailyPrice <= trailPrice) {
                type = StopLogEntry.StopType.SHORT_DAILY;
                referencePrice = dailyPrice;
            } else {
                type = StopLogEntry.StopType.SHORT_TRAIL;
                referencePrice = histMin;
            }
        }

        mark(open, stopPrice);
        logStop(t, type, stopPrice, referencePrice);
        exitPosition(t, stopPrice, REASON_STOP_PREFIX + type.name());
        log.debug("{} stop {} at {} on {}", getName(), type, stopPrice, bar.getDate());
        return true;
    }

    int decideTarget(int t, SignalContext ctx) {
        TraderHyperparameters hp = hyperparameters;

        if (position == 0 && t <= cooldownUntil) {
            return 0;
        }

        double fast = ctx.maFast();
        double mid = ctx.maMid();
        double slow = ctx.maSlow();
        if (!Double.isFinite(fast) || !Double.isFinite(mid) || !Double.isFinite(slow)) {
            return 0;
        }

        boolean longStack = fast > mid && mid > slow;
        boolean shortStack = slow > mid && mid > fast;

        double sepLong = fast - mid;
        double sepShort = mid - fast;
        double atr = ctx.atr();

        boolean enterLongOk;
        boolean exitLongOk;
        boolean enterShortOk;
        boolean exitShortOk;
        if (hp.isUseAtrFilter() && Double.isFinite(atr) && atr > 0) {
            enterLongOk = sepLong >= hp.getAtrEnterK() * atr;
            exitLongOk = sepLong <= hp.getAtrExitK() * atr;
            enterShortOk = sepShort >= hp.getAtrEnterK() * atr;
            exitShortOk = sepShort <= hp.getAtrExitK() * atr;
        } else {
            double den = Math.max(Math.abs(mid), MIN_DENOMINATOR);
            enterLongOk = sepLong / den >= hp.getSpreadEnterPct();
            exitLongOk = sepLong / den <= hp.getSpreadExitPct();
            enterShortOk = sepShort / den >= hp.getSpreadEnterPct();
            exitShortOk = sepShort / den <= hp.getSpreadExitPct();
        }

        int trend = ctx.longTermTrend();
        boolean trendLongOk = !hp.isUseLongTrendFilter() || trend == 1;
        boolean trendShortOk = !hp.isUseShortTrendFilter() || trend == -1;

        int macd = macdState(ctx);
        boolean macdLongOk = !hp.isUseMacdRegimeFilter() || macd > 0;
        boolean macdShortOk = !hp.isUseMacdRegimeFilter() || macd < 0;

        boolean longConfirmed = confirmed(t - 1, hp.getConfirmDays(), true);
        boolean shortConfirmed = confirmed(t - 1, hp.getConfirmDays(), false);

        double closePrev = ctx.closePrev();
        double refMa = hp.getPrevCloseReference() == TraderHyperparameters.PrevCloseReference.FAST ? fast : mid;
        boolean prevCloseActive = hp.isUsePrevCloseFilter() && Double.isFinite(closePrev) && Double.isFinite(refMa);
        boolean prevCloseLongOk = !prevCloseActive || closePrev >= refMa;
        boolean prevCloseShortOk = !prevCloseActive || closePrev <= refMa;

        boolean longEntry = longStack && enterLongOk && trendLongOk && macdLongOk && longConfirmed
                && prevCloseLongOk;
        boolean shortEntry = shortStack && enterShortOk && trendShortOk && macdShortOk && shortConfirmed
                && hp.isEnableShort() && prevCloseShortOk;

        int held = position != 0 && entryIndex >= 0 ? t - entryIndex : 0;
        boolean canExit = held >= hp.getMinHoldDays();

        boolean macdExitLong = hp.isUseMacdExit() && canExit && macd < 0;
        boolean macdExitShort = hp.isUseMacdExit() && canExit && macd > 0;
        boolean prevCloseExitLong = prevCloseActive && canExit && closePrev < refMa;
        boolean prevCloseExitShort = prevCloseActive && canExit && closePrev > refMa;

        if (position == 0) {
            if (longEntry) {
                return 1;
            }
            return shortEntry ? -1 : 0;
        }
        if (position == 1) {
            boolean crossExit = mid > fast;
            return canExit && (crossExit || exitLongOk || macdExitLong || prevCloseExitLong) ? 0 : 1;
        }
        boolean crossExit = fast > mid;
        return canExit && (crossExit || exitShortOk || macdExitShort || prevCloseExitShort) ? 0 : -1;
    }

    /**
     * @return +1 bullish, -1 bearish, 0 undefined
     */
    private int macdState(SignalContext ctx) {
        if (hyperparameters.getMacdSignalMode() == TraderHyperparameters.MacdSignalMode.CROSS) {
            double line = ctx.macdLine();
            double signal = ctx.macdSignal();
            if (!Double.isFinite(line) || !Double.isFinite(signal)) {
                return 0;
            }
            return line > signal ? 1 : (line < signal ? -1 : 0);
        }
        double hist = ctx.macdHistogram();
        if (!Double.isFinite(hist)) {
            return 0;
        }
        return hist > 0 ? 1 : (hist < 0 ? -1 : 0);
    }

    /**
     * True when the {@code days} bars ending at {@code last} are all stacked in one direction.
     */
    private boolean confirmed(int last, int days, boolean longSide) {
        int first = last - days + 1;
        if (first < 0) {
            return false;
        }
        for (int i = first; i <= last; i++) {
            Bar bar = feed.get(i);
            if (longSide ? !bar.isLongStacked() : !bar.isShortStacked()) {
                return false;
            }
        }
        return true;
    }

    double entryFraction(SignalContext ctx) {
        TraderHyperparameters hp = hyperparameters;
        if (!hp.isUseMacdSizeScaling()) {
            return 1.0;
        }
        double hist = ctx.macdHistogram();
        if (!Double.isFinite(hist)) {
            return 1.0;
        }
        double atr = ctx.atr();
        double strength;
        if (Double.isFinite(atr) && atr > 0) {
            strength = Math.abs(hist) / atr;
        } else {
            double den = MIN_DENOMINATOR;
            if (Double.isFinite(ctx.macdLine())) {
                den = Math.max(den, Math.abs(ctx.macdLine()));
            }
            if (Double.isFinite(ctx.macdSignal())) {
                den = Math.max(den, Math.abs(ctx.macdSignal()));
            }
            strength = Math.abs(hist) / den;
        }
        double k = Math.max(MIN_DENOMINATOR, hp.getMacdSizeAtrK());
        double x = Math.min(1.0, strength / k);
        double fraction = hp.getMacdSizeMin() + x * (hp.getMacdSizeMax() - hp.getMacdSizeMin());
        return Math.max(0.0, Math.min(1.0, fraction));
    }
}
