package com.quantbacktest.portfolio.service;

import com.quantbacktest.portfolio.domain.AccountingReport;
import com.quantbacktest.portfolio.domain.BacktestEngine.RunStatistics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest run metrics.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Counter ordersExecutedCounter;
    private final Counter ordersRejectedCounter;
    private final Counter accountingFailuresCounter;
    private final Timer executionTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.runsCompletedCounter = Counter.builder("backtest.runs.completed")
                .description("Total number of backtest runs completed")
                .register(meterRegistry);

        this.runsFailedCounter = Counter.builder("backtest.runs.failed")
                .description("Total number of backtest runs aborted by a configuration error")
                .register(meterRegistry);

        this.ordersExecutedCounter = Counter.builder("backtest.orders.executed")
                .description("Ledger orders that changed a position")
                .register(meterRegistry);

        this.ordersRejectedCounter = Counter.builder("backtest.orders.rejected")
                .description("Ledger orders rejected after every downsizing attempt")
                .register(meterRegistry);

        this.accountingFailuresCounter = Counter.builder("backtest.accounting.failures")
                .description("Runs whose accounting verification reported errors")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("backtest.execution.time")
                .description("Backtest run execution time")
                .register(meterRegistry);

        log.info("BacktestMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a completed run with its order counts and execution time.
     */
    public void recordRunCompleted(RunStatistics statistics, long executionTimeMs) {
        runsCompletedCounter.increment();
        ordersExecutedCounter.increment(statistics.getExecutedOrders());
        ordersRejectedCounter.increment(statistics.getRejectedOrders());
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunFailed() {
        runsFailedCounter.increment();
    }

    public void recordAccountingReport(AccountingReport report) {
        if (!report.isPass()) {
            accountingFailuresCounter.increment();
        }
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Completed=%d, Failed=%d, Executed=%d, Rejected=%d, "
                        + "AccountingFailures=%d, AvgExecTime=%.2fs",
                (long) runsCompletedCounter.count(),
                (long) runsFailedCounter.count(),
                (long) ordersExecutedCounter.count(),
                (long) ordersRejectedCounter.count(),
                (long) accountingFailuresCounter.count(),
                executionTimer.mean(TimeUnit.SECONDS));
    }
}
