package com.quantbacktest.portfolio.service;

import com.quantbacktest.portfolio.domain.Instrument;
import com.quantbacktest.portfolio.domain.ValuationMode;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * One backtest run: the universe, the window and optional overrides of the configured defaults.
 */
@Data
@Builder
public class BacktestRequest {
    private String runId;
    private List<Instrument> instruments;
    private LocalDate startDate;
    private LocalDate endDate;
    /** Overrides {@code backtest.initial-capital} when set. */
    private Double initialCapital;
    /** Overrides {@code backtest.valuation-mode} when set. */
    private ValuationMode valuationMode;
}
