package com.quantbacktest.portfolio.domain;

import com.quantbacktest.portfolio.domain.AccountingIssue.IssueCode;
import com.quantbacktest.portfolio.domain.AccountingIssue.Severity;
import com.quantbacktest.portfolio.domain.BacktestEngine.BacktestResult;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Post-run audit of a {@link BacktestResult}.
 *
 * <p>Rebuilds cash and equity for a sample of dates from the ledger's own
 * trade and borrow logs, cross-checks trader fills against ledger trades,
 * and checks cost totals, the flat/average-price invariant and short
 * holding deadlines. The tester never mutates the result.
 */
@Slf4j
@Getter
@Builder
public class AccountingTester {

    @Builder.Default
    private final int equityCheckSamples = 10;
    @Builder.Default
    private final double absoluteTolerance = 1e-6;
    @Builder.Default
    private final double relativeTolerance = 1e-8;
    /** Stop at the first error. */
    @Builder.Default
    private final boolean failFast = false;

    public static AccountingTester withDefaults() {
        return AccountingTester.builder().build();
    }

    public AccountingReport verify(BacktestResult result) {
        PortfolioLedger ledger = result.getLedger();
        ledger.flushAll();

        Issues issues = new Issues(failFast);
        List<SymbolReconciliation> symbols = new ArrayList<>();

        checkTraders(result, issues, symbols);
        int samples = 0;
        if (!issues.stopped) {
            samples = checkEquityCurve(result, issues);
        }
        if (!issues.stopped) {
            checkCosts(ledger, issues);
        }
        if (!issues.stopped) {
            checkPositions(result, issues);
        }

        boolean pass = issues.list.stream().noneMatch(AccountingIssue::isError);
        AccountingReport report = new AccountingReport(pass, List.copyOf(issues.list), List.copyOf(symbols), samples);
        if (pass) {
            log.info("Accounting verification passed: {} samples, {} warnings", samples, report.warningCount());
        } else {
            log.warn("Accounting verification failed: {} errors, {} warnings",
                    report.errorCount(), report.warningCount());
        }
        return report;
    }

    // ---------------------------------------------------------------------
    // Trader vs ledger
    // ---------------------------------------------------------------------

    private void checkTraders(BacktestResult result, Issues issues, List<SymbolReconciliation> symbols) {
        PortfolioLedger ledger = result.getLedger();
        for (Instrument instrument : result.getInstruments()) {
            String symbol = instrument.getSymbol();
            Trader trader = instrument.getTrader();

            List<TraderTradeLogEntry> fills = trader.getTradeLog();
            List<TradeLogEntry> trades = ledger.getTradeLog().stream()
                    .filter(t -> t.getSymbol().equals(symbol))
                    .collect(Collectors.toList());
            Set<LocalDate> rejectionDates = result.getRejectionLog().stream()
                    .filter(r -> r.getSymbol().equals(symbol))
                    .map(RejectionLogEntry::getTime)
                    .collect(Collectors.toCollection(TreeSet::new));

            Set<LocalDate> fillDates = fills.stream().map(TraderTradeLogEntry::getTime)
                    .collect(Collectors.toCollection(TreeSet::new));
            Set<LocalDate> tradeDates = trades.stream().map(TradeLogEntry::getTime)
                    .collect(Collectors.toCollection(TreeSet::new));

            int missingInLedger = 0;
            for (LocalDate date : fillDates) {
                if (tradeDates.contains(date)) {
                    continue;
                }
                if (rejectionDates.contains(date)) {
                    issues.add(Severity.WARNING, symbol, date, IssueCode.TRADER_FILL_WITHOUT_LEDGER_TRADE,
                            "engine rejected the order, see rejection log");
                } else {
                    missingInLedger++;
                    issues.add(Severity.ERROR, symbol, date, IssueCode.TRADER_FILL_WITHOUT_LEDGER_TRADE,
                            "no ledger trade on this date");
                    if (issues.stopped) {
                        return;
                    }
                }
            }

            int missingInTrader = 0;
            for (LocalDate date : tradeDates) {
                if (!fillDates.contains(date)) {
                    missingInTrader++;
                    issues.add(Severity.WARNING, symbol, date, IssueCode.LEDGER_TRADE_WITHOUT_TRADER_FILL,
                            "ledger executed but the trader logged no fill");
                }
            }

            int ledgerSign = ledger.getPosition(symbol).sign();
            int traderSign = Integer.signum(trader.getDesiredPosition());
            boolean finalMatch = ledgerSign == traderSign;
            if (!finalMatch) {
                issues.add(Severity.ERROR, symbol, null, IssueCode.FINAL_POSITION_MISMATCH,
                        String.format("ledger=%d trader=%d", ledgerSign, traderSign));
            }

            symbols.add(SymbolReconciliation.builder()
                    .symbol(symbol)
                    .traderId(result.getTraderIds().getOrDefault(symbol, ""))
                    .traderFills(fills.size())
                    .ledgerTrades(trades.size())
                    .rejections(rejectionDates.size())
                    .missingInLedger(missingInLedger)
                    .missingInTrader(missingInTrader)
                    .finalPositionMatch(finalMatch)
                    .build());
            if (issues.stopped) {
                return;
            }
        }
    }

    // ---------------------------------------------------------------------
    // Equity curve
    // ---------------------------------------------------------------------

    private int checkEquityCurve(BacktestResult result, Issues issues) {
        List<EquityCurvePoint> curve = result.getLedger().getEquityCurve();
        if (curve.isEmpty()) {
            issues.add(Severity.ERROR, AccountingIssue.PORTFOLIO, null, IssueCode.EQUITY_CURVE_EMPTY,
                    "equity curve is empty");
            return 0;
        }

        for (int i = 1; i < curve.size(); i++) {
            if (!curve.get(i).getDate().isAfter(curve.get(i - 1).getDate())) {
                issues.add(Severity.ERROR, AccountingIssue.PORTFOLIO, curve.get(i).getDate(),
                        IssueCode.EQUITY_CURVE_NON_MONOTONIC, "dates are not strictly increasing");
                break;
            }
        }
        for (EquityCurvePoint point : curve) {
            if (!Double.isFinite(point.getEquity()) || !Double.isFinite(point.getCash())) {
                issues.add(Severity.ERROR, AccountingIssue.PORTFOLIO, point.getDate(),
                        IssueCode.EQUITY_CURVE_NON_FINITE, "equity or cash is NaN or infinite");
                break;
            }
        }
        if (issues.stopped) {
            return 0;
        }

        int checked = 0;
        for (int k : sampleIndexes(curve.size(), equityCheckSamples)) {
            EquityCurvePoint point = curve.get(k);
            Map<String, Double> prices = valuationPrices(result, point.getDate());
            double[] rebuilt = reconstruct(result, point.getDate(), prices);
            checked++;

            double equityTolerance = tolerance(point.getEquity());
            double equityError = Math.abs(point.getEquity() - rebuilt[1]);
            if (!(equityError <= equityTolerance)) {
                issues.add(Severity.ERROR, AccountingIssue.PORTFOLIO, point.getDate(), IssueCode.EQUITY_MISMATCH,
                        String.format("curve=%.6g rebuilt=%.6g err=%.6g tol=%.6g",
                                point.getEquity(), rebuilt[1], equityError, equityTolerance));
            }
            double cashTolerance = tolerance(point.getCash());
            double cashError = Math.abs(point.getCash() - rebuilt[0]);
            if (!(cashError <= cashTolerance)) {
                issues.add(Severity.ERROR, AccountingIssue.PORTFOLIO, point.getDate(), IssueCode.CASH_MISMATCH,
                        String.format("curve=%.6g rebuilt=%.6g err=%.6g tol=%.6g",
                                point.getCash(), rebuilt[0], cashError, cashTolerance));
            }
            if (issues.stopped) {
                break;
            }
        }
        return checked;
    }

    /**
     * Evenly spaced, distinct row indexes including the first and the last row.
     */
    static List<Integer> sampleIndexes(int rows, int samples) {
        List<Integer> indexes = new ArrayList<>();
        if (rows <= 0) {
            return indexes;
        }
        int count = Math.max(2, Math.min(rows, samples));
        Set<Integer> unique = new TreeSet<>();
        for (int i = 0; i < count; i++) {
            double position = count == 1 ? 0 : (double) i * (rows - 1) / (count - 1);
            unique.add((int) Math.round(position));
        }
        indexes.addAll(unique);
        return indexes;
    }

    private double tolerance(double reference) {
        return Math.max(absoluteTolerance, relativeTolerance * Math.max(1.0, Math.abs(reference)));
    }

    /**
     * Prices the engine valued the portfolio at on {@code date}.
     */
    private Map<String, Double> valuationPrices(BacktestResult result, LocalDate date) {
        List<LocalDate> dates = result.getCommonDates();
        int k = dates.indexOf(date);
        LocalDate next = k >= 0 && k + 1 < dates.size() ? dates.get(k + 1) : null;
        boolean nextOpen = result.getValuationMode() == ValuationMode.NEXT_OPEN && next != null;

        Map<String, Double> prices = new TreeMap<>();
        for (Instrument instrument : result.getInstruments()) {
            BarFeed feed = instrument.getFeed();
            int t = feed.indexOf(nextOpen ? next : date);
            if (t < 0) {
                continue;
            }
            double price = nextOpen ? feed.get(t).getOpen() : feed.get(t).getClose();
            if (Double.isFinite(price) && price > 0) {
                prices.put(instrument.getSymbol(), price);
            }
        }
        return prices;
    }

    /**
     * Replay trades and borrow charges dated on or before {@code date}.
     *
     * @return {cash, equity}
     */
    private double[] reconstruct(BacktestResult result, LocalDate date, Map<String, Double> prices) {
        PortfolioLedger ledger = result.getLedger();
        Map<String, InstrumentSpec> specs = result.getSpecs();

        double cash = result.getInitialCapital();
        Map<String, Double> quantities = new TreeMap<>();
        Map<String, Double> lastTradePrices = new TreeMap<>();
        for (TradeLogEntry trade : ledger.getTradeLog()) {
            if (trade.getTime().isAfter(date)) {
                break;
            }
            cash += trade.cashChange(multiplier(specs, trade.getSymbol()));
            quantities.merge(trade.getSymbol(), trade.getQuantityDelta(), Double::sum);
            lastTradePrices.put(trade.getSymbol(), trade.getPrice());
        }
        for (BorrowLogEntry row : ledger.getBorrowLog()) {
            if (row.getTime().isAfter(date)) {
                break;
            }
            cash -= row.getCost();
        }

        double equity = cash;
        for (Map.Entry<String, Double> entry : quantities.entrySet()) {
            double quantity = entry.getValue();
            if (quantity == 0.0) {
                continue;
            }
            Double price = prices.get(entry.getKey());
            if (price == null) {
                price = lastTradePrices.get(entry.getKey());
            }
            equity += quantity * price * multiplier(specs, entry.getKey());
        }
        return new double[]{cash, equity};
    }

    private static double multiplier(Map<String, InstrumentSpec> specs, String symbol) {
        InstrumentSpec spec = specs.get(symbol);
        return spec != null ? spec.getMultiplier() : 1.0;
    }

    // ---------------------------------------------------------------------
    // Costs
    // ---------------------------------------------------------------------

    private void checkCosts(PortfolioLedger ledger, Issues issues) {
        List<TradeLogEntry> trades = ledger.getTradeLog();
        List<BorrowLogEntry> borrows = ledger.getBorrowLog();

        double fees = trades.stream().mapToDouble(TradeLogEntry::getFee).sum();
        double taxes = trades.stream().mapToDouble(TradeLogEntry::getTax).sum();
        double borrow = borrows.stream().mapToDouble(BorrowLogEntry::getCost).sum();

        compareTotal(issues, Severity.ERROR, IssueCode.FEE_TOTAL_MISMATCH, "fees", "", fees, ledger.getFeesPaid());
        compareTotal(issues, Severity.ERROR, IssueCode.TAX_TOTAL_MISMATCH, "taxes", "", taxes, ledger.getTaxesPaid());
        compareTotal(issues, Severity.ERROR, IssueCode.BORROW_TOTAL_MISMATCH, "borrow", "", borrow,
                ledger.getBorrowPaid());
        if (issues.stopped) {
            return;
        }

        Map<String, Double> feesByTrader = new TreeMap<>();
        Map<String, Double> taxesByTrader = new TreeMap<>();
        for (TradeLogEntry trade : trades) {
            if (!trade.getTraderId().isEmpty()) {
                feesByTrader.merge(trade.getTraderId(), trade.getFee(), Double::sum);
                taxesByTrader.merge(trade.getTraderId(), trade.getTax(), Double::sum);
            }
        }
        Map<String, Double> borrowByTrader = new TreeMap<>();
        for (BorrowLogEntry row : borrows) {
            if (!row.getTraderId().isEmpty()) {
                borrowByTrader.merge(row.getTraderId(), row.getCost(), Double::sum);
            }
        }

        compareByTrader(issues, IssueCode.FEE_BY_TRADER_MISMATCH, "fees", feesByTrader, ledger.getFeesByTrader());
        compareByTrader(issues, IssueCode.TAX_BY_TRADER_MISMATCH, "taxes", taxesByTrader, ledger.getTaxesByTrader());
        compareByTrader(issues, IssueCode.BORROW_BY_TRADER_MISMATCH, "borrow", borrowByTrader,
                ledger.getBorrowByTrader());
    }

    private void compareByTrader(Issues issues, IssueCode code, String label, Map<String, Double> fromLogs,
                                 Map<String, Double> fromLedger) {
        Set<String> traderIds = new TreeSet<>(fromLogs.keySet());
        traderIds.addAll(fromLedger.keySet());
        for (String traderId : traderIds) {
            compareTotal(issues, Severity.WARNING, code, label, traderId,
                    fromLogs.getOrDefault(traderId, 0.0), fromLedger.getOrDefault(traderId, 0.0));
        }
    }

    private void compareTotal(Issues issues, Severity severity, IssueCode code, String label, String traderId,
                              double fromLogs, double fromLedger) {
        double tolerance = Math.max(absoluteTolerance, Math.abs(fromLedger) * 1e-9);
        if (Math.abs(fromLogs - fromLedger) > tolerance) {
            String owner = traderId.isEmpty() ? "" : " trader=" + traderId;
            issues.add(severity, AccountingIssue.PORTFOLIO, null, code,
                    String.format("sum of log %s=%.6g vs ledger total=%.6g%s", label, fromLogs, fromLedger, owner));
        }
    }

    // ---------------------------------------------------------------------
    // Positions
    // ---------------------------------------------------------------------

    private void checkPositions(BacktestResult result, Issues issues) {
        PortfolioLedger ledger = result.getLedger();
        Map<String, InstrumentSpec> specs = result.getSpecs();

        for (Position position : ledger.getPositions().values()) {
            if (position.isFlat() != Double.isNaN(position.getAvgPrice())) {
                issues.add(Severity.ERROR, position.getSymbol(), null, IssueCode.AVG_PRICE_INVARIANT,
                        String.format("quantity=%s avgPrice=%s", position.getQuantity(), position.getAvgPrice()));
            }
        }

        Map<String, Position> replay = new TreeMap<>();
        Map<String, LocalDate> shortOpenedOn = new TreeMap<>();
        for (TradeLogEntry trade : ledger.getTradeLog()) {
            String symbol = trade.getSymbol();
            Position position = replay.computeIfAbsent(symbol, Position::new);
            double before = position.getQuantity();
            position.applyTrade(trade.getQuantityDelta(), trade.getPrice(), multiplier(specs, symbol));
            double after = position.getQuantity();

            if (position.isFlat() != Double.isNaN(position.getAvgPrice())) {
                issues.add(Severity.ERROR, symbol, trade.getTime(), IssueCode.AVG_PRICE_INVARIANT,
                        String.format("replayed quantity=%s avgPrice=%s", after, position.getAvgPrice()));
            }

            if (after < 0 && before >= 0) {
                shortOpenedOn.put(symbol, trade.getTime());
            } else if (after >= 0 && before < 0) {
                checkShortHold(issues, specs.get(symbol), symbol, shortOpenedOn.remove(symbol), trade.getTime());
            }
            if (issues.stopped) {
                return;
            }
        }

        List<LocalDate> dates = result.getCommonDates();
        LocalDate lastDate = dates.isEmpty() ? null : dates.get(dates.size() - 1);
        for (Map.Entry<String, LocalDate> open : shortOpenedOn.entrySet()) {
            checkShortHold(issues, specs.get(open.getKey()), open.getKey(), open.getValue(), lastDate);
        }
    }

    private void checkShortHold(Issues issues, InstrumentSpec spec, String symbol, LocalDate openedOn,
                                LocalDate closedOn) {
        if (spec == null || !spec.hasShortDeadline() || openedOn == null || closedOn == null) {
            return;
        }
        long held = ChronoUnit.DAYS.between(openedOn, closedOn);
        if (held > spec.getShortMaxHoldDays()) {
            issues.add(Severity.ERROR, symbol, closedOn, IssueCode.SHORT_HOLD_EXCEEDED,
                    String.format("short opened %s held %d days, limit %d", openedOn, held,
                            spec.getShortMaxHoldDays()));
        }
    }

    private static final class Issues {
        final List<AccountingIssue> list = new ArrayList<>();
        final boolean failFast;
        boolean stopped;

        Issues(boolean failFast) {
            this.failFast = failFast;
        }

        void add(Severity severity, String symbol, LocalDate time, IssueCode code, String detail) {
            list.add(AccountingIssue.builder()
                    .severity(severity)
                    .symbol(symbol)
                    .time(time)
                    .code(code)
                    .detail(detail)
                    .build());
            if (severity == Severity.ERROR) {
                log.debug("Accounting error {} on {} {}: {}", code, symbol, time, detail);
                if (failFast) {
                    stopped = true;
                }
            }
        }
    }
}
