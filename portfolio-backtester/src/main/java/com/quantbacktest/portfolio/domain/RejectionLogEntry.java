package com.quantbacktest.portfolio.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * An order the ledger kept rejecting after every downsizing attempt.
 */
@Value
@Builder
public class RejectionLogEntry {

    LocalDate time;
    String symbol;
    String traderId;
    int desiredPosition;
    double currentQuantity;
    double targetQuantity;
    double finalQuantity;
    double price;
    int iterations;
    ExecutionResult lastResult;
}
