package com.quantbacktest.portfolio.domain.cost;

import java.time.LocalDate;

/**
 * Cost rates a trader applies to its own notional equity when it simulates
 * a position on its own. Under the portfolio engine the ledger owns all costs
 * and traders use {@link NullSignalCostModel}.
 */
public interface SignalCostModel {

    /**
     * Fee rate for opening a position in direction {@code targetPosition} (+1 / -1).
     */
    double entryFee(int targetPosition, LocalDate date);

    /**
     * Fee rate for closing a position currently in direction {@code currentPosition}.
     */
    double exitFee(int currentPosition, LocalDate date);

    /**
     * Daily borrow rate charged while short.
     */
    double shortBorrowDaily();
}
