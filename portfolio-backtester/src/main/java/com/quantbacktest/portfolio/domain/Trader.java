package com.quantbacktest.portfolio.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Per-instrument decision state machine driven by the backtest engine.
 * A trader states the position sign it wants; the portfolio ledger decides
 * what is actually held and reports it back through {@link #reconcile(int)}.
 */
public interface Trader {

    /**
     * Bind the trader to a feed and clear all state and logs.
     */
    void reset(BarFeed feed);

    /**
     * Advance one bar. {@code t} indexes the bound feed.
     */
    void step(int t);

    /**
     * Position sign (-1, 0, +1) the trader wants after its last step.
     */
    int getDesiredPosition();

    /**
     * Position sign last confirmed by the ledger.
     */
    int getExecutedPosition();

    /**
     * Size fraction fixed when the current position was entered.
     */
    double getEntryFraction();

    /**
     * Align internal state with the sign the ledger actually holds.
     *
     * @param executedSign sign of the ledger quantity after execution
     */
    void reconcile(int executedSign);

    /**
     * Called by the engine after a fill that changed the ledger quantity.
     */
    void onPortfolioFill(LocalDate date, double quantityBefore, double quantityAfter, double price, String reason);

    void enableExternalAccounting(boolean enabled);

    /**
     * Curves are sampled only for dates inside {@code [start, end]}; a null bound is open.
     */
    void setLoggingWindow(LocalDate start, LocalDate end);

    /**
     * Calendar-day limit on holding a short; {@code maxHoldDays <= 0} disables it.
     */
    void setShortDeadline(boolean enforce, int maxHoldDays);

    /**
     * Called once after the last date of a run.
     */
    void onFinish();

    String getName();

    /**
     * Standalone notional equity, tracked with the trader's own cost model.
     */
    double getEquity();

    List<TraderTradeLogEntry> getTradeLog();

    List<StopLogEntry> getStopLog();

    List<TraderCurvePoint> getCurve();
}
