package com.quantbacktest.portfolio.domain;

import com.quantbacktest.portfolio.domain.cost.NullSignalCostModel;
import com.quantbacktest.portfolio.domain.cost.SignalCostModel;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Position bookkeeping, notional equity and logs shared by all traders.
 *
 * <p>Subclasses implement {@link #onStep(int)} and change position only
 * through {@link #enterPosition} and {@link #exitPosition}.
 */
@Slf4j
public abstract class AbstractTrader implements Trader {

    static final String REASON_SIGNAL_ENTRY = "SIGNAL_ENTRY";
    static final String REASON_SIGNAL_EXIT = "SIGNAL_EXIT";
    static final String REASON_FORCED_COVER = "FORCED_COVER_MAX_HOLD";
    static final String REASON_STOP_PREFIX = "STOP:";

    private final String name;
    private final double initialEquity;
    private final SignalCostModel costModel;

    protected BarFeed feed;

    protected double equity;
    protected int position;
    private int executedPosition;
    protected double entryPrice = Double.NaN;
    protected LocalDate entryDate;
    protected int entryIndex = -1;
    protected int cooldownUntil = Integer.MIN_VALUE;
    protected double entryFraction = 1.0;
    protected double histMax = Double.NEGATIVE_INFINITY;
    protected double histMin = Double.POSITIVE_INFINITY;

    private EntryState preStep = EntryState.FLAT;

    private boolean externalAccounting;
    private LocalDate logStart;
    private LocalDate logEnd;
    private boolean enforceShortMaxHold;
    private int shortMaxHoldDays;

    private final BufferedLog<TraderTradeLogEntry> tradeLog = new BufferedLog<>(10);
    private final BufferedLog<StopLogEntry> stopLog = new BufferedLog<>(10);
    private final BufferedLog<TraderCurvePoint> curve = new BufferedLog<>(30);

    protected AbstractTrader(String name, double initialEquity, SignalCostModel costModel) {
        this.name = name;
        this.initialEquity = initialEquity;
        this.costModel = costModel != null ? costModel : NullSignalCostModel.INSTANCE;
        this.equity = initialEquity;
    }

    @Override
    public void reset(BarFeed feed) {
        this.feed = feed;
        this.equity = initialEquity;
        this.position = 0;
        this.executedPosition = 0;
        this.cooldownUntil = Integer.MIN_VALUE;
        clearEntry();
        this.preStep = EntryState.FLAT;
        tradeLog.clear();
        stopLog.clear();
        curve.clear();
        onReset();
    }

    /**
     * Hook for subclass state; called at the end of {@link #reset(BarFeed)}.
     */
    protected void onReset() {
    }

    @Override
    public final void step(int t) {
        preStep = snapshot();
        if (feed == null || t < 2 || t > feed.size() - 2) {
            return;
        }
        onStep(t);
    }

    /**
     * One bar of decision logic; {@code t} has two bars before it and one after.
     */
    protected abstract void onStep(int t);

    @Override
    public int getDesiredPosition() {
        return position;
    }

    @Override
    public int getExecutedPosition() {
        return executedPosition;
    }

    @Override
    public double getEntryFraction() {
        return entryFraction;
    }

    @Override
    public void reconcile(int executedSign) {
        int sign = Integer.signum(executedSign);
        if (sign == 0) {
            if (position != 0) {
                clearEntry();
            }
        } else if (sign == preStep.position && sign != position) {
            restore(preStep);
        }
        position = sign;
        executedPosition = sign;
    }

    @Override
    public void onPortfolioFill(LocalDate date, double quantityBefore, double quantityAfter, double price,
                                String reason) {
        tradeLog.append(TraderTradeLogEntry.builder()
                .time(date)
                .action(TraderTradeLogEntry.FillAction.of(quantityBefore, quantityAfter))
                .price(price)
                .positionBefore(Math.signum(quantityBefore))
                .positionAfter(Math.signum(quantityAfter))
                .reason(reason != null ? reason : "FILL")
                .equityBefore(equity)
                .equityAfter(equity)
                .positionFraction(entryFraction)
                .build());
    }

    @Override
    public void enableExternalAccounting(boolean enabled) {
        this.externalAccounting = enabled;
    }

    public boolean isExternalAccounting() {
        return externalAccounting;
    }

    @Override
    public void setLoggingWindow(LocalDate start, LocalDate end) {
        this.logStart = start;
        this.logEnd = end;
    }

    @Override
    public void setShortDeadline(boolean enforce, int maxHoldDays) {
        this.enforceShortMaxHold = enforce && maxHoldDays > 0;
        this.shortMaxHoldDays = Math.max(0, maxHoldDays);
    }

    @Override
    public void onFinish() {
        log.debug("{} finished: position {}, equity {}", name, position, equity);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public double getEquity() {
        return equity;
    }

    public double getInitialEquity() {
        return initialEquity;
    }

    public LocalDate getEntryDate() {
        return entryDate;
    }

    public double getEntryPrice() {
        return entryPrice;
    }

    @Override
    public List<TraderTradeLogEntry> getTradeLog() {
        return tradeLog.entries();
    }

    @Override
    public List<StopLogEntry> getStopLog() {
        return stopLog.entries();
    }

    @Override
    public List<TraderCurvePoint> getCurve() {
        return curve.entries();
    }

    // ---------------------------------------------------------------------
    // Helpers for subclasses
    // ---------------------------------------------------------------------

    protected void applyShortBorrow() {
        if (position == -1) {
            equity *= 1 - entryFraction * costModel.shortBorrowDaily();
        }
    }

    protected void updateExtrema(double open, double close) {
        if (position == 1) {
            histMax = Math.max(histMax, Math.max(open, close));
        } else if (position == -1) {
            histMin = Math.min(histMin, Math.min(open, close));
        }
    }

    /**
     * True when an enforced short has reached its deadline today, or would
     * pass it before the next bar.
     */
    protected boolean shortDeadlineReached(int t) {
        if (!enforceShortMaxHold || position != -1 || entryDate == null) {
            return false;
        }
        long heldToday = ChronoUnit.DAYS.between(entryDate, feed.get(t).getDate());
        if (heldToday >= shortMaxHoldDays) {
            return true;
        }
        long heldNext = ChronoUnit.DAYS.between(entryDate, feed.get(t + 1).getDate());
        return heldNext > shortMaxHoldDays;
    }

    protected void enterPosition(int t, int newPosition, double price, double fraction, String reason) {
        LocalDate date = feed.get(t).getDate();
        double equityBefore = equity;
        int positionBefore = position;

        entryFraction = fraction;
        equity *= 1 - costModel.entryFee(newPosition, date) * entryFraction;

        position = newPosition;
        entryPrice = price;
        entryDate = date;
        entryIndex = t;
        if (position == 1) {
            histMax = price;
            histMin = Double.POSITIVE_INFINITY;
        } else {
            histMin = price;
            histMax = Double.NEGATIVE_INFINITY;
        }

        if (!externalAccounting) {
            appendTrade(date, TraderTradeLogEntry.FillAction.ENTER, price, positionBefore, reason, equityBefore);
        }
    }

    protected void exitPosition(int t, double price, String reason) {
        LocalDate date = feed.get(t).getDate();
        double equityBefore = equity;
        int positionBefore = position;

        equity *= 1 - costModel.exitFee(position, date) * entryFraction;

        position = 0;
        clearEntry();
        cooldownUntil = t + cooldownDays();

        if (!externalAccounting) {
            appendTrade(date, TraderTradeLogEntry.FillAction.EXIT, price, positionBefore, reason, equityBefore);
        }
    }

    protected void logStop(int t, StopLogEntry.StopType type, double stopPrice, double referencePrice) {
        Bar bar = feed.get(t);
        stopLog.append(StopLogEntry.builder()
                .time(bar.getDate())
                .type(type)
                .stopPrice(stopPrice)
                .referencePrice(referencePrice)
                .openPrice(bar.getOpen())
                .build());
    }

    /**
     * Mark the open position from {@code fromPrice} to {@code toPrice}, scaled by the entry fraction.
     */
    protected void mark(double fromPrice, double toPrice) {
        if (position == 0) {
            return;
        }
        double r = position * (toPrice / fromPrice - 1);
        if (Double.isFinite(r)) {
            equity *= 1 + entryFraction * r;
        }
    }

    protected void recordCurves(int t) {
        LocalDate date = feed.get(t).getDate();
        if (logStart != null && date.isBefore(logStart)) {
            return;
        }
        if (logEnd != null && date.isAfter(logEnd)) {
            return;
        }
        curve.append(new TraderCurvePoint(date, equity, position));
    }

    /**
     * Bars to wait after an exit before a new entry.
     */
    protected int cooldownDays() {
        return 0;
    }

    private void appendTrade(LocalDate date, TraderTradeLogEntry.FillAction action, double price,
                             int positionBefore, String reason, double equityBefore) {
        tradeLog.append(TraderTradeLogEntry.builder()
                .time(date)
                .action(action)
                .price(price)
                .positionBefore(positionBefore)
                .positionAfter(position)
                .reason(reason)
                .equityBefore(equityBefore)
                .equityAfter(equity)
                .positionFraction(entryFraction)
                .build());
    }

    private void clearEntry() {
        entryPrice = Double.NaN;
        entryDate = null;
        entryIndex = -1;
        entryFraction = 1.0;
        histMax = Double.NEGATIVE_INFINITY;
        histMin = Double.POSITIVE_INFINITY;
    }

    private EntryState snapshot() {
        return new EntryState(position, entryPrice, entryDate, entryIndex, cooldownUntil, entryFraction,
                histMax, histMin);
    }

    private void restore(EntryState state) {
        entryPrice = state.entryPrice;
        entryDate = state.entryDate;
        entryIndex = state.entryIndex;
        cooldownUntil = state.cooldownUntil;
        entryFraction = state.entryFraction;
        histMax = state.histMax;
        histMin = state.histMin;
    }

    /**
     * Entry bookkeeping captured before each step so a rejected order can be undone.
     */
    private static final class EntryState {

        static final EntryState FLAT = new EntryState(0, Double.NaN, null, -1, Integer.MIN_VALUE, 1.0,
                Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

        final int position;
        final double entryPrice;
        final LocalDate entryDate;
        final int entryIndex;
        final int cooldownUntil;
        final double entryFraction;
        final double histMax;
        final double histMin;

        EntryState(int position, double entryPrice, LocalDate entryDate, int entryIndex, int cooldownUntil,
                   double entryFraction, double histMax, double histMin) {
            this.position = position;
            this.entryPrice = entryPrice;
            this.entryDate = entryDate;
            this.entryIndex = entryIndex;
            this.cooldownUntil = cooldownUntil;
            this.entryFraction = entryFraction;
            this.histMax = histMax;
            this.histMin = histMin;
        }
    }
}
