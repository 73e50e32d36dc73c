package com.quantbacktest.portfolio.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Daily stock-borrow charge on one short position.
 */
@Value
@Builder
public class BorrowLogEntry {

    LocalDate time;
    String symbol;
    String traderId;
    double notional;
    double dailyRate;
    double cost;
}
