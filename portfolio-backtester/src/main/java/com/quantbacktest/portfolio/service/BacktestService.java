package com.quantbacktest.portfolio.service;

/**
 * Service interface for running portfolio backtests.
 */
public interface BacktestService {

    /**
     * Run one backtest and, when enabled, verify its accounting.
     *
     * @param request the universe and window to simulate
     * @return the engine result together with the accounting report
     * @throws IllegalArgumentException when the request is invalid
     * @throws IllegalStateException    when no instrument has data in the window
     */
    BacktestOutcome runBacktest(BacktestRequest request);
}
