package com.quantbacktest.portfolio.domain;

import lombok.Builder;
import lombok.Data;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Shared-cash portfolio backtest engine.
 *
 * <p>Marches over the dates common to every active instrument. On each date
 * all traders step first, then each instrument's desired sign is turned into
 * a ledger order at today's open, in registration order. A rejected order is
 * retried at a smaller size. Borrow cost is charged at the close and one
 * equity sample is appended per date.
 */
@Slf4j
public class BacktestEngine {

    /**
     * Run a backtest with the given parameters.
     *
     * @throws IllegalArgumentException when the configuration is invalid
     * @throws IllegalStateException    when no instrument has data in the window
     */
    public BacktestResult runBacktest(BacktestConfig config) {
        validate(config);

        List<String> excluded = new ArrayList<>();
        List<Instrument> active = selectActive(config, excluded);
        List<LocalDate> commonDates = commonDates(active, config);
        if (commonDates.isEmpty()) {
            throw new IllegalStateException("No common dates in the requested window across "
                    + active.size() + " instruments");
        }

        log.info("Starting backtest - Instruments: {}, Excluded: {}, Dates: {} .. {} ({} days)",
                active.size(), excluded.size(), commonDates.get(0),
                commonDates.get(commonDates.size() - 1), commonDates.size());

        Map<String, InstrumentSpec> specs = new TreeMap<>();
        Map<String, String> traderIds = new LinkedHashMap<>();
        List<int[]> indexMaps = new ArrayList<>();
        for (Instrument instrument : active) {
            specs.put(instrument.getSymbol(), instrument.getSpec());
            traderIds.put(instrument.getSymbol(), resolveTraderId(config, instrument));
            indexMaps.add(indexMap(instrument.getFeed(), commonDates));
        }

        PortfolioLedger ledger = new PortfolioLedger(config.getInitialCapital(),
                config.getTradeLogBufferSize(), config.getBorrowLogBufferSize(), config.getEquityLogBufferSize());

        for (Instrument instrument : active) {
            Trader trader = instrument.getTrader();
            trader.reset(instrument.getFeed());
            trader.enableExternalAccounting(true);
            trader.setLoggingWindow(config.getStartDate(), config.getEndDate());
            InstrumentSpec spec = instrument.getSpec();
            trader.setShortDeadline(spec.hasShortDeadline(), spec.getShortMaxHoldDays());
        }

        Map<String, Double> firstCloses = new TreeMap<>();
        for (int i = 0; i < active.size(); i++) {
            Instrument instrument = active.get(i);
            firstCloses.put(instrument.getSymbol(), instrument.getFeed().get(indexMaps.get(i)[0]).getClose());
        }
        ledger.updateLastPrices(firstCloses);

        RunState state = new RunState();
        List<RejectionLogEntry> rejections = new ArrayList<>();

        for (int k = 0; k < commonDates.size(); k++) {
            LocalDate date = commonDates.get(k);
            LocalDate nextDate = k + 1 < commonDates.size() ? commonDates.get(k + 1) : null;

            Map<String, Double> openPrices = new TreeMap<>();
            Map<String, Double> closePrices = new TreeMap<>();
            Map<String, Double> nextOpenPrices = new TreeMap<>();
            for (int i = 0; i < active.size(); i++) {
                Instrument instrument = active.get(i);
                BarFeed feed = instrument.getFeed();
                Bar bar = feed.get(indexMaps.get(i)[k]);
                openPrices.put(instrument.getSymbol(), bar.getOpen());
                closePrices.put(instrument.getSymbol(), bar.getClose());
                if (nextDate != null) {
                    nextOpenPrices.put(instrument.getSymbol(), feed.get(indexMaps.get(i)[k + 1]).getOpen());
                }
            }

            for (int i = 0; i < active.size(); i++) {
                active.get(i).getTrader().step(indexMaps.get(i)[k]);
            }

            for (Instrument instrument : active) {
                executeInstrument(config, ledger, instrument, traderIds.get(instrument.getSymbol()), specs,
                        openPrices, date, nextDate, state, rejections);
            }

            ledger.applyBorrowCost(date, closePrices, specs, config.getTradingDaysPerYear());

            Map<String, Double> valuationPrices =
                    config.getValuationMode() == ValuationMode.NEXT_OPEN && nextDate != null
                            ? nextOpenPrices : closePrices;
            ledger.appendEquityCurve(date, valuationPrices, specs);
        }

        ledger.flushAll();
        for (Instrument instrument : active) {
            instrument.getTrader().onFinish();
        }

        List<Double> equityValues = ledger.getEquityCurve().stream()
                .map(EquityCurvePoint::getEquity)
                .collect(Collectors.toList());
        double finalEquity = equityValues.get(equityValues.size() - 1);

        BigDecimal totalReturn = PerformanceMetrics.calculateTotalReturn(config.getInitialCapital(), finalEquity);
        BigDecimal maxDrawdown = PerformanceMetrics.calculateMaxDrawdown(equityValues);
        BigDecimal sharpeRatio = PerformanceMetrics.calculateSharpeRatio(equityValues, config.getTradingDaysPerYear());
        BigDecimal winRate = PerformanceMetrics.calculateWinRate(ledger.getTradeLog(), specs);

        RunStatistics statistics = state.toStatistics(commonDates.size());

        log.info("Backtest completed - Final equity: {}, Total Return: {}%, Max DD: {}%, Sharpe: {}, "
                        + "Trades: {}, Rejected: {}, Fees: {}, Taxes: {}, Borrow: {}",
                finalEquity, totalReturn, maxDrawdown, sharpeRatio, statistics.getExecutedOrders(),
                statistics.getRejectedOrders(), ledger.getFeesPaid(), ledger.getTaxesPaid(), ledger.getBorrowPaid());

        return BacktestResult.builder()
                .ledger(ledger)
                .instruments(Collections.unmodifiableList(active))
                .specs(Collections.unmodifiableMap(specs))
                .traderIds(Collections.unmodifiableMap(traderIds))
                .commonDates(Collections.unmodifiableList(commonDates))
                .excludedSymbols(Collections.unmodifiableList(excluded))
                .rejectionLog(Collections.unmodifiableList(rejections))
                .statistics(statistics)
                .valuationMode(config.getValuationMode())
                .initialCapital(config.getInitialCapital())
                .finalEquity(finalEquity)
                .totalReturn(totalReturn)
                .maxDrawdown(maxDrawdown)
                .sharpeRatio(sharpeRatio)
                .winRate(winRate)
                .build();
    }

    private void executeInstrument(BacktestConfig config, PortfolioLedger ledger, Instrument instrument,
                                   String traderId, Map<String, InstrumentSpec> specs,
                                   Map<String, Double> openPrices, LocalDate date, LocalDate nextDate,
                                   RunState state, List<RejectionLogEntry> rejections) {
        InstrumentSpec spec = instrument.getSpec();
        Trader trader = instrument.getTrader();
        String symbol = spec.getSymbol();

        double price = openPrices.get(symbol);
        double currentQuantity = ledger.getPosition(symbol).getQuantity();
        int currentSign = (int) Math.signum(currentQuantity);

        if (!Double.isFinite(price) || price <= 0) {
            log.debug("Skipping {} on {}: invalid open {}", symbol, date, price);
            trader.reconcile(currentSign);
            return;
        }

        int desired = Integer.signum(trader.getDesiredPosition());

        if (desired < 0 && currentSign < 0 && shortDeadlineReached(spec, state.shortOpenedOn.get(symbol), date, nextDate)) {
            log.debug("Forcing cover of {} on {}: short held since {}", symbol, date, state.shortOpenedOn.get(symbol));
            desired = 0;
            state.forcedCovers++;
        }

        if (currentSign != desired) {
            state.signalChanges++;
        }

        double target = targetQuantity(config, ledger, spec, trader, specs, openPrices, price,
                currentQuantity, currentSign, desired);

        if (desired != 0 && target == 0.0) {
            state.zeroQuantitySignals++;
        }
        if (target == currentQuantity) {
            trader.reconcile(currentSign);
            return;
        }

        DownsizeOutcome outcome = executeWithDownsizing(config, ledger, date, symbol, target, price, spec, specs,
                traderId);

        if (outcome.isAccepted()) {
            double newQuantity = ledger.getPosition(symbol).getQuantity();
            if (outcome.getIterations() > 0) {
                state.downsizedOrders++;
            }
            if (newQuantity != currentQuantity) {
                state.executedOrders++;
                trader.onPortfolioFill(date, currentQuantity, newQuantity, price, "FILL");
                trackShortEntry(state, symbol, currentQuantity, newQuantity, date);
            }
            trader.reconcile((int) Math.signum(newQuantity));
        } else {
            state.rejectedOrders++;
            if (config.isLogRejections()) {
                rejections.add(RejectionLogEntry.builder()
                        .time(date)
                        .symbol(symbol)
                        .traderId(traderId)
                        .desiredPosition(desired)
                        .currentQuantity(currentQuantity)
                        .targetQuantity(target)
                        .finalQuantity(outcome.getFinalQuantity())
                        .price(price)
                        .iterations(outcome.getIterations())
                        .lastResult(outcome.getLastResult())
                        .build());
            }
            log.debug("Order for {} on {} rejected after {} attempts: {}", symbol, date,
                    outcome.getIterations(), outcome.getLastResult());
            trader.reconcile(currentSign);
        }
    }

    double targetQuantity(BacktestConfig config, PortfolioLedger ledger, InstrumentSpec spec, Trader trader,
                          Map<String, InstrumentSpec> specs, Map<String, Double> openPrices, double price,
                          double currentQuantity, int currentSign, int desired) {
        if (desired == 0) {
            return 0.0;
        }
        if (!config.isRebalanceWhileHolding() && currentSign != 0 && desired == currentSign) {
            return currentQuantity;
        }

        double basis = config.isDynamicSizing()
                ? ledger.computeEquity(openPrices, specs)
                : config.getInitialCapital();
        double maxNotional = spec.getMaxNotionalFraction() * basis;
        if (config.getEntrySizingPolicy() == EntrySizingPolicy.FRACTION_THEN_DOWNSIZE && currentSign == 0) {
            maxNotional *= trader.getEntryFraction();
        }

        double denominator = price * spec.getMultiplier();
        if (!(denominator > 0) || !(maxNotional > 0)) {
            return 0.0;
        }
        double targetAbs = Math.floor(maxNotional / denominator);
        return targetAbs <= 0 ? 0.0 : desired * targetAbs;
    }

    /**
     * Try {@code target}; on rejection shrink its magnitude by the configured
     * factor and retry. An accepted zero target ends the search successfully.
     */
    DownsizeOutcome executeWithDownsizing(BacktestConfig config, PortfolioLedger ledger, LocalDate date,
                                          String symbol, double target, double price, InstrumentSpec spec,
                                          Map<String, InstrumentSpec> specs, String traderId) {
        if (target < 0 && !spec.isAllowShort()) {
            return new DownsizeOutcome(false, target, 0, ExecutionResult.REJECTED_SHORT_NOT_ALLOWED);
        }

        double quantity = target;
        ExecutionResult result = ExecutionResult.NO_CHANGE;
        int iteration = 0;
        while (iteration <= config.getDownsizeMaxIterations()) {
            result = ledger.setTargetQuantity(date, symbol, quantity, price, spec, specs, traderId,
                    iteration == 0 ? "TARGET" : "DOWNSIZED");
            if (result.isAccepted()) {
                return new DownsizeOutcome(true, quantity, iteration, result);
            }
            if (quantity == 0.0) {
                return new DownsizeOutcome(false, quantity, iteration, result);
            }
            double reducedAbs = Math.floor(Math.abs(quantity) * config.getDownsizeFactor());
            quantity = reducedAbs < 1 ? 0.0 : Math.signum(quantity) * reducedAbs;
            iteration++;
            log.debug("Downsizing {} on {} to {} (attempt {})", symbol, date, quantity, iteration);
        }
        return new DownsizeOutcome(false, quantity, iteration, result);
    }

    static boolean shortDeadlineReached(InstrumentSpec spec, LocalDate openedOn, LocalDate date, LocalDate nextDate) {
        if (!spec.hasShortDeadline() || openedOn == null) {
            return false;
        }
        long max = spec.getShortMaxHoldDays();
        if (ChronoUnit.DAYS.between(openedOn, date) >= max) {
            return true;
        }
        return nextDate != null && ChronoUnit.DAYS.between(openedOn, nextDate) > max;
    }

    private static void trackShortEntry(RunState state, String symbol, double before, double after, LocalDate date) {
        if (after < 0 && before >= 0) {
            state.shortOpenedOn.put(symbol, date);
        } else if (after >= 0) {
            state.shortOpenedOn.remove(symbol);
        }
    }

    // ---------------------------------------------------------------------
    // Setup
    // ---------------------------------------------------------------------

    private void validate(BacktestConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Backtest config is required");
        }
        if (config.getInstruments() == null || config.getInstruments().isEmpty()) {
            throw new IllegalStateException("Universe is empty");
        }
        if (!Double.isFinite(config.getInitialCapital()) || config.getInitialCapital() <= 0) {
            throw new IllegalArgumentException("Initial capital must be positive, got " + config.getInitialCapital());
        }
        if (config.getStartDate() != null && config.getEndDate() != null
                && config.getEndDate().isBefore(config.getStartDate())) {
            throw new IllegalArgumentException("End date " + config.getEndDate()
                    + " is before start date " + config.getStartDate());
        }
        if (!(config.getDownsizeFactor() > 0 && config.getDownsizeFactor() < 1)) {
            throw new IllegalArgumentException("Downsize factor must be in (0, 1), got " + config.getDownsizeFactor());
        }
        if (config.getDownsizeMaxIterations() < 0) {
            throw new IllegalArgumentException("Downsize iterations must be non-negative");
        }
        if (config.getTradingDaysPerYear() <= 0) {
            throw new IllegalArgumentException("Trading days per year must be positive");
        }

        Set<String> symbols = new HashSet<>();
        for (Instrument instrument : config.getInstruments()) {
            if (instrument == null) {
                throw new IllegalArgumentException("Instrument list contains null");
            }
            if (!symbols.add(instrument.getSymbol())) {
                throw new IllegalArgumentException("Duplicate instrument symbol: " + instrument.getSymbol());
            }
            if (instrument.getFeed().size() < config.getMinHistoryBars()) {
                throw new IllegalArgumentException("Instrument " + instrument.getSymbol() + " has "
                        + instrument.getFeed().size() + " bars, at least " + config.getMinHistoryBars()
                        + " required");
            }
        }
    }

    private List<Instrument> selectActive(BacktestConfig config, List<String> excluded) {
        List<Instrument> active = new ArrayList<>();
        for (Instrument instrument : config.getInstruments()) {
            BarFeed feed = instrument.getFeed();
            long inWindow = feed.dates().stream().filter(d -> inWindow(d, config)).count();
            if (inWindow == 0) {
                log.warn("Excluding {}: no data between {} and {}", instrument.getSymbol(),
                        config.getStartDate(), config.getEndDate());
                excluded.add(instrument.getSymbol());
                continue;
            }
            if ((config.getStartDate() != null && feed.firstDate().isAfter(config.getStartDate()))
                    || (config.getEndDate() != null && feed.lastDate().isBefore(config.getEndDate()))) {
                log.warn("Partial coverage for {}: data {} .. {}, window {} .. {}", instrument.getSymbol(),
                        feed.firstDate(), feed.lastDate(), config.getStartDate(), config.getEndDate());
            }
            active.add(instrument);
        }
        if (active.isEmpty()) {
            throw new IllegalStateException("No instrument has data between "
                    + config.getStartDate() + " and " + config.getEndDate());
        }
        return active;
    }

    private List<LocalDate> commonDates(List<Instrument> active, BacktestConfig config) {
        Set<LocalDate> common = null;
        for (Instrument instrument : active) {
            Set<LocalDate> dates = instrument.getFeed().dates().stream()
                    .filter(d -> inWindow(d, config))
                    .collect(Collectors.toCollection(TreeSet::new));
            if (common == null) {
                common = dates;
            } else {
                common.retainAll(dates);
            }
        }
        return common == null ? new ArrayList<>() : new ArrayList<>(common);
    }

    private static boolean inWindow(LocalDate date, BacktestConfig config) {
        return (config.getStartDate() == null || !date.isBefore(config.getStartDate()))
                && (config.getEndDate() == null || !date.isAfter(config.getEndDate()));
    }

    private static int[] indexMap(BarFeed feed, List<LocalDate> dates) {
        int[] indexes = new int[dates.size()];
        for (int k = 0; k < dates.size(); k++) {
            indexes[k] = feed.indexOf(dates.get(k));
        }
        return indexes;
    }

    private static String resolveTraderId(BacktestConfig config, Instrument instrument) {
        if (!instrument.getTraderId().isEmpty()) {
            return instrument.getTraderId();
        }
        int position = config.getInstruments().indexOf(instrument) + 1;
        return String.format("TR%02d", position);
    }

    /**
     * Mutable counters for one run.
     */
    private static final class RunState {
        final Map<String, LocalDate> shortOpenedOn = new TreeMap<>();
        int executedOrders;
        int rejectedOrders;
        int signalChanges;
        int zeroQuantitySignals;
        int forcedCovers;
        int downsizedOrders;

        RunStatistics toStatistics(int tradingDates) {
            return RunStatistics.builder()
                    .tradingDates(tradingDates)
                    .executedOrders(executedOrders)
                    .rejectedOrders(rejectedOrders)
                    .signalChanges(signalChanges)
                    .zeroQuantitySignals(zeroQuantitySignals)
                    .forcedCovers(forcedCovers)
                    .downsizedOrders(downsizedOrders)
                    .build();
        }
    }

    @Value
    static class DownsizeOutcome {
        boolean accepted;
        double finalQuantity;
        int iterations;
        ExecutionResult lastResult;
    }

    /**
     * Configuration for a backtest run.
     */
    @Data
    @Builder
    public static class BacktestConfig {
        private List<Instrument> instruments;
        /** Inclusive; null means the start of the data. */
        private LocalDate startDate;
        /** Inclusive; null means the end of the data. */
        private LocalDate endDate;
        private double initialCapital;
        @Builder.Default
        private int tradingDaysPerYear = 252;
        /** Size entries from current equity instead of initial capital. */
        @Builder.Default
        private boolean dynamicSizing = true;
        @Builder.Default
        private boolean rebalanceWhileHolding = false;
        @Builder.Default
        private ValuationMode valuationMode = ValuationMode.CLOSE;
        @Builder.Default
        private EntrySizingPolicy entrySizingPolicy = EntrySizingPolicy.FRACTION_THEN_DOWNSIZE;
        @Builder.Default
        private double downsizeFactor = 0.98;
        @Builder.Default
        private int downsizeMaxIterations = 12;
        @Builder.Default
        private boolean logRejections = true;
        @Builder.Default
        private int minHistoryBars = 3;
        @Builder.Default
        private int tradeLogBufferSize = 10;
        @Builder.Default
        private int borrowLogBufferSize = 30;
        @Builder.Default
        private int equityLogBufferSize = 30;
    }

    /**
     * Counters collected during a run.
     */
    @Value
    @Builder
    public static class RunStatistics {
        int tradingDates;
        int executedOrders;
        int rejectedOrders;
        /** Dates on which an instrument's desired sign differed from the held sign. */
        int signalChanges;
        /** Non-flat desires that sized to zero units. */
        int zeroQuantitySignals;
        int forcedCovers;
        int downsizedOrders;
    }

    /**
     * Result of a backtest run.
     */
    @Data
    @Builder
    public static class BacktestResult {
        private PortfolioLedger ledger;
        private List<Instrument> instruments;
        private Map<String, InstrumentSpec> specs;
        /** Trader id per active symbol, in registration order. */
        private Map<String, String> traderIds;
        private List<LocalDate> commonDates;
        private List<String> excludedSymbols;
        private List<RejectionLogEntry> rejectionLog;
        private RunStatistics statistics;
        private ValuationMode valuationMode;
        private double initialCapital;
        private double finalEquity;
        private BigDecimal totalReturn;
        private BigDecimal maxDrawdown;
        private BigDecimal sharpeRatio;
        private BigDecimal winRate;
    }
}
