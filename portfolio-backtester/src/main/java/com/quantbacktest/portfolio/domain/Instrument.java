package com.quantbacktest.portfolio.domain;

import lombok.Value;

/**
 * One tradable unit of the universe: its rules, its data and the trader driving it.
 */
@Value
public class Instrument {

    InstrumentSpec spec;
    BarFeed feed;
    Trader trader;
    String traderId;

    public Instrument(InstrumentSpec spec, BarFeed feed, Trader trader, String traderId) {
        if (spec == null) {
            throw new IllegalArgumentException("Instrument spec is required");
        }
        if (feed == null) {
            throw new IllegalArgumentException("Bar feed is required for " + spec.getSymbol());
        }
        if (trader == null) {
            throw new IllegalArgumentException("Trader is required for " + spec.getSymbol());
        }
        this.spec = spec;
        this.feed = feed;
        this.trader = trader;
        this.traderId = traderId != null ? traderId : "";
    }

    public String getSymbol() {
        return spec.getSymbol();
    }
}
