package com.quantbacktest.portfolio.domain;

import com.quantbacktest.portfolio.domain.cost.SignalCostModel;
import lombok.Getter;

/**
 * Benchmark trader that wants the same direction on every eligible bar.
 * Long gives buy-and-hold; short gives a permanent short, re-entered after any forced cover.
 */
public class FixedDirectionTrader extends AbstractTrader {

    @Getter
    private final int direction;

    public FixedDirectionTrader(String name, double initialEquity, SignalCostModel costModel, int direction) {
        super(name, initialEquity, costModel);
        if (direction != 1 && direction != -1) {
            throw new IllegalArgumentException("Direction must be +1 or -1, got " + direction);
        }
        this.direction = direction;
    }

    public static FixedDirectionTrader buyAndHold(double initialEquity, SignalCostModel costModel) {
        return new FixedDirectionTrader("BuyAndHold", initialEquity, costModel, 1);
    }

    @Override
    protected void onStep(int t) {
        Bar bar = feed.get(t);
        double open = bar.getOpen();

        applyShortBorrow();

        if (shortDeadlineReached(t)) {
            exitPosition(t, open, REASON_FORCED_COVER);
            recordCurves(t);
            return;
        }

        if (position != direction && t > cooldownUntil) {
            if (position != 0) {
                exitPosition(t, open, REASON_SIGNAL_EXIT);
            }
            enterPosition(t, direction, open, 1.0, REASON_SIGNAL_ENTRY);
        }

        mark(open, feed.get(t + 1).getOpen());
        recordCurves(t);
    }
}
