package com.quantbacktest.portfolio.service;

import com.quantbacktest.portfolio.config.BacktestProperties;
import com.quantbacktest.portfolio.domain.AccountingIssue;
import com.quantbacktest.portfolio.domain.AccountingReport;
import com.quantbacktest.portfolio.domain.AccountingTester;
import com.quantbacktest.portfolio.domain.BacktestEngine;
import com.quantbacktest.portfolio.domain.BacktestEngine.BacktestConfig;
import com.quantbacktest.portfolio.domain.BacktestEngine.BacktestResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Runs the engine with the configured defaults and audits the result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final BacktestEngine backtestEngine;
    private final BacktestProperties properties;
    private final BacktestMetricsService metricsService;

    @Override
    public BacktestOutcome runBacktest(BacktestRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Backtest request cannot be null");
        }
        String runId = request.getRunId() != null ? request.getRunId() : UUID.randomUUID().toString();

        // Set MDC for structured logging
        MDC.put("runId", runId);

        try {
            return runInternal(runId, request);
        } finally {
            MDC.remove("runId");
        }
    }

    private BacktestOutcome runInternal(String runId, BacktestRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Started");

        BacktestResult result;
        try {
            result = backtestEngine.runBacktest(buildConfig(request));
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Invalid backtest configuration: {}", e.getMessage());
            metricsService.recordRunFailed();
            throw e;
        }

        AccountingReport report = null;
        if (properties.getTester().isEnabled()) {
            report = buildTester().verify(result);
            metricsService.recordAccountingReport(report);
            logReport(report);
        }

        long executionTimeMs = System.currentTimeMillis() - startTime;
        metricsService.recordRunCompleted(result.getStatistics(), executionTimeMs);
        log.info("Completed in {} ms - {}", executionTimeMs, metricsService.getMetricsSummary());

        return BacktestOutcome.builder()
                .runId(runId)
                .result(result)
                .accountingReport(report)
                .executionTimeMs(executionTimeMs)
                .build();
    }

    BacktestConfig buildConfig(BacktestRequest request) {
        return BacktestConfig.builder()
                .instruments(request.getInstruments())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .initialCapital(request.getInitialCapital() != null
                        ? request.getInitialCapital() : properties.getInitialCapital())
                .tradingDaysPerYear(properties.getTradingDaysPerYear())
                .dynamicSizing(properties.isDynamicSizing())
                .rebalanceWhileHolding(properties.isRebalanceWhileHolding())
                .valuationMode(request.getValuationMode() != null
                        ? request.getValuationMode() : properties.getValuationMode())
                .entrySizingPolicy(properties.getEntrySizingPolicy())
                .downsizeFactor(properties.getDownsizeFactor())
                .downsizeMaxIterations(properties.getDownsizeMaxIterations())
                .minHistoryBars(properties.getMinHistoryBars())
                .logRejections(properties.isLogRejections())
                .tradeLogBufferSize(properties.getLogBuffers().getTrade())
                .borrowLogBufferSize(properties.getLogBuffers().getBorrow())
                .equityLogBufferSize(properties.getLogBuffers().getEquity())
                .build();
    }

    private AccountingTester buildTester() {
        BacktestProperties.Tester tester = properties.getTester();
        return AccountingTester.builder()
                .equityCheckSamples(tester.getEquityCheckSamples())
                .absoluteTolerance(tester.getAbsoluteTolerance())
                .relativeTolerance(tester.getRelativeTolerance())
                .failFast(tester.isFailFast())
                .build();
    }

    private void logReport(AccountingReport report) {
        for (AccountingIssue issue : report.getIssues()) {
            if (issue.isError()) {
                log.warn("Accounting {} {} {}: {}", issue.getCode(), issue.getSymbol(), issue.getTime(),
                        issue.getDetail());
            } else {
                log.debug("Accounting {} {} {}: {}", issue.getCode(), issue.getSymbol(), issue.getTime(),
                        issue.getDetail());
            }
        }
    }
}
