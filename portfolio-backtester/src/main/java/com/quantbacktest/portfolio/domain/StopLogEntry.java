package com.quantbacktest.portfolio.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class StopLogEntry {

    public enum StopType {
        LONG_DAILY,
        LONG_TRAIL,
        SHORT_DAILY,
        SHORT_TRAIL
    }

    LocalDate time;
    StopType type;
    double stopPrice;
    /** Daily stop level for a daily stop, running extreme for a trailing stop. */
    double referencePrice;
    double openPrice;
}
