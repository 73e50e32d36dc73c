package com.quantbacktest.portfolio.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One finding of {@link AccountingTester}.
 */
@Value
@Builder
public class AccountingIssue {

    public static final String PORTFOLIO = "(PORTFOLIO)";

    public enum Severity {
        ERROR,
        WARNING
    }

    public enum IssueCode {
        TRADER_FILL_WITHOUT_LEDGER_TRADE,
        LEDGER_TRADE_WITHOUT_TRADER_FILL,
        FINAL_POSITION_MISMATCH,
        EQUITY_CURVE_EMPTY,
        EQUITY_CURVE_NON_MONOTONIC,
        EQUITY_CURVE_NON_FINITE,
        EQUITY_MISMATCH,
        CASH_MISMATCH,
        FEE_TOTAL_MISMATCH,
        TAX_TOTAL_MISMATCH,
        BORROW_TOTAL_MISMATCH,
        FEE_BY_TRADER_MISMATCH,
        TAX_BY_TRADER_MISMATCH,
        BORROW_BY_TRADER_MISMATCH,
        AVG_PRICE_INVARIANT,
        SHORT_HOLD_EXCEEDED
    }

    Severity severity;
    /** Symbol, or {@link #PORTFOLIO} for portfolio-wide findings. */
    String symbol;
    /** Null when the finding is not tied to a date. */
    LocalDate time;
    IssueCode code;
    String detail;

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
