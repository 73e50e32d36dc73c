package com.quantbacktest.portfolio.config;

import com.quantbacktest.portfolio.domain.EntrySizingPolicy;
import com.quantbacktest.portfolio.domain.ValuationMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Engine and tester settings bound from the {@code backtest} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    @Positive(message = "Initial capital must be positive")
    private double initialCapital = 100_000_000.0;

    @Min(value = 1, message = "Trading days per year must be at least 1")
    private int tradingDaysPerYear = 252;

    private boolean dynamicSizing = true;

    private boolean rebalanceWhileHolding = false;

    @NotNull
    private ValuationMode valuationMode = ValuationMode.CLOSE;

    @NotNull
    private EntrySizingPolicy entrySizingPolicy = EntrySizingPolicy.FRACTION_THEN_DOWNSIZE;

    @DecimalMin(value = "0.0", inclusive = false, message = "Downsize factor must be greater than 0")
    @DecimalMax(value = "1.0", inclusive = false, message = "Downsize factor must be less than 1")
    private double downsizeFactor = 0.98;

    @Min(0)
    @Max(1000)
    private int downsizeMaxIterations = 12;

    @Min(value = 3, message = "At least 3 bars of history are required")
    private int minHistoryBars = 3;

    private boolean logRejections = true;

    @Valid
    @NotNull
    private LogBuffers logBuffers = new LogBuffers();

    @Valid
    @NotNull
    private Tester tester = new Tester();

    @Data
    public static class LogBuffers {
        @Min(1)
        private int trade = 10;
        @Min(1)
        private int borrow = 30;
        @Min(1)
        private int equity = 30;
    }

    @Data
    public static class Tester {
        /** Run the accounting verification after every backtest. */
        private boolean enabled = true;
        @Min(1)
        private int equityCheckSamples = 10;
        @PositiveOrZero
        private double absoluteTolerance = 1e-6;
        @PositiveOrZero
        private double relativeTolerance = 1e-8;
        private boolean failFast = false;
    }
}
