package com.quantbacktest.portfolio.domain.cost;

import java.time.LocalDate;

/**
 * Cost-free signal accounting, used when the portfolio ledger is authoritative.
 */
public final class NullSignalCostModel implements SignalCostModel {

    public static final NullSignalCostModel INSTANCE = new NullSignalCostModel();

    private NullSignalCostModel() {
    }

    @Override
    public double entryFee(int targetPosition, LocalDate date) {
        return 0.0;
    }

    @Override
    public double exitFee(int currentPosition, LocalDate date) {
        return 0.0;
    }

    @Override
    public double shortBorrowDaily() {
        return 0.0;
    }
}
