package com.quantbacktest.portfolio.service;

import com.quantbacktest.portfolio.config.BacktestProperties;
import com.quantbacktest.portfolio.domain.AccountingReport;
import com.quantbacktest.portfolio.domain.BacktestEngine;
import com.quantbacktest.portfolio.domain.BacktestEngine.BacktestConfig;
import com.quantbacktest.portfolio.domain.BacktestEngine.BacktestResult;
import com.quantbacktest.portfolio.domain.BacktestEngine.RunStatistics;
import com.quantbacktest.portfolio.domain.FixedDirectionTrader;
import com.quantbacktest.portfolio.domain.Instrument;
import com.quantbacktest.portfolio.domain.InstrumentSpec;
import com.quantbacktest.portfolio.domain.SyntheticBars;
import com.quantbacktest.portfolio.domain.ValuationMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BacktestServiceImpl focusing on configuration, verification and failure handling.
 */
@ExtendWith(MockitoExtension.class)
class BacktestServiceImplTest {

    @Mock
    private BacktestEngine backtestEngine;

    @Mock
    private BacktestMetricsService metricsService;

    private BacktestProperties properties;
    private BacktestServiceImpl backtestService;

    @BeforeEach
    void setUp() {
        properties = new BacktestProperties();
        backtestService = new BacktestServiceImpl(backtestEngine, properties, metricsService);
    }

    private static List<Instrument> universe() {
        InstrumentSpec spec = InstrumentSpec.builder().symbol("AAA").build();
        return List.of(new Instrument(spec, SyntheticBars.feed("AAA", SyntheticBars.flat(SyntheticBars.START, 10, 100.0)),
                FixedDirectionTrader.buyAndHold(1.0, null), null));
    }

    private static BacktestRequest createValidRequest() {
        return BacktestRequest.builder()
                .runId("run-1")
                .instruments(universe())
                .build();
    }

    @Test
    void testRunBacktest_VerifiesRealResult() {
        // Arrange
        BacktestResult result = new BacktestEngine().runBacktest(BacktestConfig.builder()
                .instruments(universe())
                .initialCapital(1_000_000.0)
                .build());
        when(backtestEngine.runBacktest(any())).thenReturn(result);

        // Act
        BacktestOutcome outcome = backtestService.runBacktest(createValidRequest());

        // Assert
        assertEquals("run-1", outcome.getRunId());
        assertSame(result, outcome.getResult());
        assertTrue(outcome.isVerified());
        verify(metricsService).recordAccountingReport(any(AccountingReport.class));
        verify(metricsService).recordRunCompleted(eq(result.getStatistics()), anyLong());
        verify(metricsService, never()).recordRunFailed();
    }

    @Test
    void testRunBacktest_TesterDisabled_NoReport() {
        // Arrange
        properties.getTester().setEnabled(false);
        BacktestResult result = BacktestResult.builder().statistics(RunStatistics.builder().build()).build();
        when(backtestEngine.runBacktest(any())).thenReturn(result);

        // Act
        BacktestOutcome outcome = backtestService.runBacktest(createValidRequest());

        // Assert
        assertNull(outcome.getAccountingReport());
        assertFalse(outcome.isVerified());
        verify(metricsService, never()).recordAccountingReport(any());
    }

    @Test
    void testRunBacktest_MissingRunId_Generated() {
        properties.getTester().setEnabled(false);
        when(backtestEngine.runBacktest(any()))
                .thenReturn(BacktestResult.builder().statistics(RunStatistics.builder().build()).build());
        BacktestRequest request = createValidRequest();
        request.setRunId(null);

        BacktestOutcome outcome = backtestService.runBacktest(request);

        assertNotNull(outcome.getRunId());
        assertFalse(outcome.getRunId().isBlank());
    }

    @Test
    void testRunBacktest_RunIdInMdcDuringRunOnly() {
        // Arrange
        properties.getTester().setEnabled(false);
        when(backtestEngine.runBacktest(any())).thenAnswer(invocation -> {
            assertEquals("run-1", MDC.get("runId"));
            return BacktestResult.builder().statistics(RunStatistics.builder().build()).build();
        });

        // Act
        backtestService.runBacktest(createValidRequest());

        // Assert
        assertNull(MDC.get("runId"));
    }

    @Test
    void testRunBacktest_EngineRejectsConfig_RecordsFailureAndRethrows() {
        // Arrange
        when(backtestEngine.runBacktest(any())).thenThrow(new IllegalStateException("Universe is empty"));

        // Act & Assert
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> backtestService.runBacktest(createValidRequest()));
        assertEquals("Universe is empty", e.getMessage());
        verify(metricsService).recordRunFailed();
        verify(metricsService, never()).recordRunCompleted(any(), anyLong());
        assertNull(MDC.get("runId"));
    }

    @Test
    void testRunBacktest_NullRequest_Throws() {
        assertThrows(IllegalArgumentException.class, () -> backtestService.runBacktest(null));
        verifyNoInteractions(backtestEngine);
    }

    @Test
    void testBuildConfig_RequestOverridesDefaults() {
        // Arrange
        properties.setDownsizeFactor(0.9);
        properties.getLogBuffers().setTrade(5);
        BacktestRequest request = createValidRequest();
        request.setValuationMode(ValuationMode.NEXT_OPEN);

        // Act
        BacktestConfig config = backtestService.buildConfig(request);

        // Assert
        assertEquals(100_000_000.0, config.getInitialCapital());
        assertEquals(ValuationMode.NEXT_OPEN, config.getValuationMode());
        assertEquals(0.9, config.getDownsizeFactor());
        assertEquals(5, config.getTradeLogBufferSize());
        assertEquals(properties.getEntrySizingPolicy(), config.getEntrySizingPolicy());

        request.setInitialCapital(5_000_000.0);
        assertEquals(5_000_000.0, backtestService.buildConfig(request).getInitialCapital());
    }

    @Test
    void testRunBacktest_PassesBuiltConfigToEngine() {
        properties.getTester().setEnabled(false);
        when(backtestEngine.runBacktest(any()))
                .thenReturn(BacktestResult.builder().statistics(RunStatistics.builder().build()).build());
        ArgumentCaptor<BacktestConfig> captor = ArgumentCaptor.forClass(BacktestConfig.class);

        backtestService.runBacktest(createValidRequest());

        verify(backtestEngine).runBacktest(captor.capture());
        assertEquals(1, captor.getValue().getInstruments().size());
        assertEquals(properties.getMinHistoryBars(), captor.getValue().getMinHistoryBars());
    }
}
