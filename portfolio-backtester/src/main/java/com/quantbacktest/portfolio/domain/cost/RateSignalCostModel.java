package com.quantbacktest.portfolio.domain.cost;

import com.quantbacktest.portfolio.domain.TradeSide;
import lombok.RequiredArgsConstructor;

import java.time.LocalDate;

/**
 * Signal-level costs built from the same fee and tax models the ledger uses.
 * A short entry and a long exit are sells and therefore pay tax.
 */
@RequiredArgsConstructor
public class RateSignalCostModel implements SignalCostModel {

    private final RateFeeModel feeModel;
    private final TaxModel taxModel;
    private final double borrowRateAnnual;
    private final int tradingDaysPerYear;

    @Override
    public double entryFee(int targetPosition, LocalDate date) {
        TradeSide side = targetPosition < 0 ? TradeSide.SELL : TradeSide.BUY;
        return feeModel.totalRate() + taxModel.tax(date, side, 1.0);
    }

    @Override
    public double exitFee(int currentPosition, LocalDate date) {
        TradeSide side = currentPosition > 0 ? TradeSide.SELL : TradeSide.BUY;
        return feeModel.totalRate() + taxModel.tax(date, side, 1.0);
    }

    @Override
    public double shortBorrowDaily() {
        if (tradingDaysPerYear <= 0) {
            return 0.0;
        }
        return Math.max(0.0, borrowRateAnnual) / tradingDaysPerYear;
    }
}
