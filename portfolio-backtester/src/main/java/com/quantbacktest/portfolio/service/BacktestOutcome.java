package com.quantbacktest.portfolio.service;

import com.quantbacktest.portfolio.domain.AccountingReport;
import com.quantbacktest.portfolio.domain.BacktestEngine.BacktestResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BacktestOutcome {
    String runId;
    BacktestResult result;
    /** Null when verification is disabled. */
    AccountingReport accountingReport;
    long executionTimeMs;

    public boolean isVerified() {
        return accountingReport != null && accountingReport.isPass();
    }
}
