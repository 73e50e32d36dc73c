package com.quantbacktest.portfolio.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PerformanceMetrics.
 */
class PerformanceMetricsTest {

    private static TradeLogEntry trade(String symbol, double delta, double after, double price) {
        return TradeLogEntry.builder()
                .time(LocalDate.of(2024, 1, 2))
                .symbol(symbol)
                .traderId("TR01")
                .side(TradeSide.of(delta))
                .quantityDelta(delta)
                .quantityAfter(after)
                .price(price)
                .notional(Math.abs(delta * price))
                .reason("TARGET")
                .build();
    }

    @Test
    void testTotalReturn() {
        assertEquals(new BigDecimal("10.0000"), PerformanceMetrics.calculateTotalReturn(100.0, 110.0));
        assertEquals(BigDecimal.ZERO, PerformanceMetrics.calculateTotalReturn(0.0, 110.0));
    }

    @Test
    void testMaxDrawdown_NegativePercentFromPeak() {
        BigDecimal drawdown = PerformanceMetrics.calculateMaxDrawdown(List.of(100.0, 120.0, 90.0, 130.0));

        assertEquals(new BigDecimal("-25.0000"), drawdown);
    }

    @Test
    void testSharpe_ZeroForConstantCurve() {
        assertEquals(BigDecimal.ZERO, PerformanceMetrics.calculateSharpeRatio(List.of(100.0, 100.0, 100.0), 252));
        assertEquals(BigDecimal.ZERO, PerformanceMetrics.calculateSharpeRatio(List.of(100.0), 252));
    }

    @Test
    void testSharpe_PositiveForRisingCurve() {
        BigDecimal sharpe = PerformanceMetrics.calculateSharpeRatio(List.of(100.0, 101.0, 101.5, 103.0), 252);

        assertTrue(sharpe.signum() > 0);
    }

    @Test
    void testWinRate_CountsClosedRoundTrips() {
        // Arrange - one winning long, one losing long, one still open
        List<TradeLogEntry> trades = List.of(
                trade("AAA", 10, 10, 100.0),
                trade("AAA", -10, 0, 110.0),
                trade("BBB", 10, 10, 100.0),
                trade("BBB", -10, 0, 90.0),
                trade("CCC", -5, -5, 50.0));
        Map<String, InstrumentSpec> specs = Map.of(
                "AAA", InstrumentSpec.builder().symbol("AAA").build(),
                "BBB", InstrumentSpec.builder().symbol("BBB").build());

        // Act
        BigDecimal winRate = PerformanceMetrics.calculateWinRate(trades, specs);

        // Assert
        assertEquals(new BigDecimal("0.5000"), winRate);
    }

    @Test
    void testWinRate_FlipClosesLongLeg() {
        // Arrange - long 10 at 100, one fill flips to short 10 at 110, cover at 120
        List<TradeLogEntry> trades = List.of(
                trade("AAA", 10, 10, 100.0),
                trade("AAA", -20, -10, 110.0),
                trade("AAA", 10, 0, 120.0));
        Map<String, InstrumentSpec> specs = Map.of("AAA", InstrumentSpec.builder().symbol("AAA").build());

        // Act
        BigDecimal winRate = PerformanceMetrics.calculateWinRate(trades, specs);

        // Assert - the long won 100, the short lost 100
        assertEquals(new BigDecimal("0.5000"), winRate);
    }

    @Test
    void testWinRate_ZeroWithoutRoundTrips() {
        assertEquals(BigDecimal.ZERO, PerformanceMetrics.calculateWinRate(List.of(), Map.of()));
    }
}
