package com.quantbacktest.portfolio.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Random-access bar and indicator series for one symbol, indexed from 0.
 * Indicator computation happens upstream; the engine only reads.
 */
public interface BarFeed {

    String symbol();

    int size();

    Bar get(int index);

    /**
     * @return index of the bar dated {@code date}, or -1 when the feed has no such bar
     */
    int indexOf(LocalDate date);

    List<LocalDate> dates();

    /**
     * Context for deciding at bar {@code t}: the indicators of bar {@code t - 1}.
     * Invalid when fewer than two bars precede {@code t}.
     */
    default SignalContext previousContext(int t) {
        if (t < 2 || t >= size()) {
            return SignalContext.invalid();
        }
        return SignalContext.of(get(t).getDate(), get(t - 1));
    }

    default boolean isEmpty() {
        return size() == 0;
    }

    default LocalDate firstDate() {
        return get(0).getDate();
    }

    default LocalDate lastDate() {
        return get(size() - 1).getDate();
    }
}
