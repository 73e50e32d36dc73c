package com.quantbacktest.portfolio.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable list-backed feed. Bars must be in strictly increasing date order.
 */
public class ListBarFeed implements BarFeed {

    private final String symbol;
    private final List<Bar> bars;
    private final List<LocalDate> dates;
    private final Map<LocalDate, Integer> indexByDate;

    public ListBarFeed(String symbol, List<Bar> bars) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Feed symbol is required");
        }
        if (bars == null) {
            throw new IllegalArgumentException("Bars are required for " + symbol);
        }
        this.symbol = symbol;
        this.bars = List.copyOf(bars);

        List<LocalDate> dateList = new ArrayList<>(bars.size());
        Map<LocalDate, Integer> index = new HashMap<>();
        LocalDate previous = null;
        for (int i = 0; i < this.bars.size(); i++) {
            LocalDate date = this.bars.get(i).getDate();
            if (date == null) {
                throw new IllegalArgumentException("Bar " + i + " of " + symbol + " has no date");
            }
            if (previous != null && !date.isAfter(previous)) {
                throw new IllegalArgumentException("Bars of " + symbol + " are not in increasing date order at " + date);
            }
            dateList.add(date);
            index.put(date, i);
            previous = date;
        }
        this.dates = Collections.unmodifiableList(dateList);
        this.indexByDate = index;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public int size() {
        return bars.size();
    }

    @Override
    public Bar get(int index) {
        return bars.get(index);
    }

    @Override
    public int indexOf(LocalDate date) {
        Integer index = indexByDate.get(date);
        return index != null ? index : -1;
    }

    @Override
    public List<LocalDate> dates() {
        return dates;
    }
}
