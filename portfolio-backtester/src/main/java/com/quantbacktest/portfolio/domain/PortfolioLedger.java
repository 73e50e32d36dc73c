package com.quantbacktest.portfolio.domain;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Shared-cash portfolio account.
 *
 * <p>The ledger is the only owner of cash, positions and cumulative costs.
 * Every mutation goes through {@link #executeTrade} or {@link #applyBorrowCost}
 * and leaves a row in an append-only log, so the account can be replayed
 * from its logs alone. Maps are sorted by symbol to keep iteration, and
 * therefore the logs, deterministic.
 */
@Slf4j
public class PortfolioLedger {

    static final double QUANTITY_EPSILON = 1e-12;
    static final double CASH_TOLERANCE = 1e-9;

    @Getter
    private final double initialCapital;
    @Getter
    private double cash;
    @Getter
    private double reservedMargin;
    @Getter
    private double feesPaid;
    @Getter
    private double taxesPaid;
    @Getter
    private double borrowPaid;

    private final Map<String, Position> positions = new TreeMap<>();
    private final Map<String, Double> lastPrices = new TreeMap<>();
    /** Trader that last filled each symbol; borrow rows are attributed to it. */
    private final Map<String, String> ownerBySymbol = new TreeMap<>();

    private final Map<String, Double> feesByTrader = new TreeMap<>();
    private final Map<String, Double> taxesByTrader = new TreeMap<>();
    private final Map<String, Double> borrowByTrader = new TreeMap<>();

    private final BufferedLog<TradeLogEntry> tradeLog;
    private final BufferedLog<BorrowLogEntry> borrowLog;
    private final BufferedLog<EquityCurvePoint> equityCurve;

    public PortfolioLedger(double initialCapital) {
        this(initialCapital, 10, 30, 30);
    }

    public PortfolioLedger(double initialCapital, int tradeBufferSize, int borrowBufferSize, int equityBufferSize) {
        this.initialCapital = initialCapital;
        this.cash = initialCapital;
        this.tradeLog = new BufferedLog<>(tradeBufferSize);
        this.borrowLog = new BufferedLog<>(borrowBufferSize);
        this.equityCurve = new BufferedLog<>(equityBufferSize);
    }

    /**
     * Existing position for {@code symbol}, or a new flat one.
     */
    public Position getPosition(String symbol) {
        return positions.computeIfAbsent(symbol, Position::new);
    }

    public Map<String, Position> getPositions() {
        return Collections.unmodifiableMap(positions);
    }

    public Map<String, Double> getLastPrices() {
        return Collections.unmodifiableMap(lastPrices);
    }

    public void updateLastPrices(Map<String, Double> prices) {
        if (prices == null) {
            return;
        }
        prices.forEach((symbol, price) -> {
            if (price != null && Double.isFinite(price) && price > 0) {
                lastPrices.put(symbol, price);
            }
        });
    }

    public double availableCash() {
        return cash - reservedMargin;
    }

    // ---------------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------------

    public ExecutionResult setTargetQuantity(LocalDate date, String symbol, double targetQuantity, double price,
                                             InstrumentSpec spec, Map<String, InstrumentSpec> allSpecs,
                                             String traderId) {
        return setTargetQuantity(date, symbol, targetQuantity, price, spec, allSpecs, traderId, "");
    }

    /**
     * Trade the difference between {@code targetQuantity} and the current quantity.
     */
    public ExecutionResult setTargetQuantity(LocalDate date, String symbol, double targetQuantity, double price,
                                             InstrumentSpec spec, Map<String, InstrumentSpec> allSpecs,
                                             String traderId, String reason) {
        Position position = getPosition(symbol);
        double quantityDelta = targetQuantity - position.getQuantity();
        if (Math.abs(quantityDelta) < QUANTITY_EPSILON) {
            return ExecutionResult.NO_CHANGE;
        }
        return executeTrade(date, symbol, quantityDelta, price, spec, allSpecs, traderId, reason);
    }

    /**
     * Execute a fill of {@code quantityDelta} at {@code price}.
     *
     * <p>Rejected without any state change when the price is not a positive
     * finite number, when the result would be short on an instrument that
     * forbids shorting, or when the cash left after the trade could not cover
     * the margin of the whole book with the new quantity in place. A fill that
     * only reduces an open position (same side or flat, smaller size) skips the
     * cash check and may leave cash negative.
     */
    public ExecutionResult executeTrade(LocalDate date, String symbol, double quantityDelta, double price,
                                        InstrumentSpec spec, Map<String, InstrumentSpec> allSpecs,
                                        String traderId, String reason) {
        if (!Double.isFinite(price) || price <= 0) {
            log.debug("Rejected {} {} on {}: invalid price {}", symbol, quantityDelta, date, price);
            return ExecutionResult.REJECTED_INVALID_PRICE;
        }

        Position position = getPosition(symbol);
        Position.TradeProjection projection = position.simulateTrade(quantityDelta, price);
        double newQuantity = projection.getQuantity();

        if (newQuantity < 0 && !spec.isAllowShort()) {
            log.debug("Rejected {} {} on {}: shorting not allowed", symbol, quantityDelta, date);
            return ExecutionResult.REJECTED_SHORT_NOT_ALLOWED;
        }

        double multiplier = spec.getMultiplier();
        TradeSide side = TradeSide.of(quantityDelta);
        double notionalAbs = Math.abs(quantityDelta * price * multiplier);
        double fee = spec.fee(notionalAbs);
        double tax = spec.tax(date, side, notionalAbs);
        double newCash = cash - (quantityDelta * price * multiplier) - fee - tax;

        double projectedMargin = projectedMargin(symbol, newQuantity, price, spec, allSpecs);
        if (!isReduction(position.getQuantity(), newQuantity) && newCash - projectedMargin < -CASH_TOLERANCE) {
            log.debug("Rejected {} {} on {}: cash {} after trade cannot cover margin {}",
                    symbol, quantityDelta, date, newCash, projectedMargin);
            return ExecutionResult.REJECTED_INSUFFICIENT_CASH;
        }

        position.applyTrade(quantityDelta, price, multiplier);
        cash = newCash;
        feesPaid += fee;
        taxesPaid += tax;
        String owner = traderId != null ? traderId : "";
        if (!owner.isEmpty()) {
            feesByTrader.merge(owner, fee, Double::sum);
            taxesByTrader.merge(owner, tax, Double::sum);
        }
        lastPrices.put(symbol, price);
        ownerBySymbol.put(symbol, owner);

        tradeLog.append(TradeLogEntry.builder()
                .time(date)
                .symbol(symbol)
                .traderId(owner)
                .side(side)
                .quantityDelta(quantityDelta)
                .quantityAfter(position.getQuantity())
                .price(price)
                .notional(notionalAbs)
                .fee(fee)
                .tax(tax)
                .reason(reason != null ? reason : "")
                .build());
        return ExecutionResult.EXECUTED;
    }

    static boolean isReduction(double oldQuantity, double newQuantity) {
        if (oldQuantity == 0.0) {
            return false;
        }
        boolean sameSideOrFlat = newQuantity == 0.0 || Math.signum(newQuantity) == Math.signum(oldQuantity);
        return sameSideOrFlat && Math.abs(newQuantity) <= Math.abs(oldQuantity);
    }

    /**
     * Margin of every held position at last known prices, with {@code symbol}
     * replaced by the candidate quantity at the candidate price. The candidate
     * leg is always charged through {@code candidateSpec}.
     */
    private double projectedMargin(String symbol, double candidateQuantity, double candidatePrice,
                                   InstrumentSpec candidateSpec, Map<String, InstrumentSpec> allSpecs) {
        double margin = 0.0;
        boolean candidateSeen = false;
        for (Map.Entry<String, Position> entry : positions.entrySet()) {
            String key = entry.getKey();
            double quantity = entry.getValue().getQuantity();
            double price = markPrice(entry.getValue(), null);
            if (key.equals(symbol)) {
                quantity = candidateQuantity;
                price = candidatePrice;
                candidateSeen = true;
            }
            if (quantity == 0.0) {
                continue;
            }
            InstrumentSpec spec = key.equals(symbol) ? candidateSpec : (allSpecs != null ? allSpecs.get(key) : null);
            if (spec != null) {
                margin += spec.requiredMargin(quantity, price);
            }
        }
        if (!candidateSeen && candidateQuantity != 0.0) {
            margin += candidateSpec.requiredMargin(candidateQuantity, candidatePrice);
        }
        return margin;
    }

    // ---------------------------------------------------------------------
    // Financing and valuation
    // ---------------------------------------------------------------------

    /**
     * Charge one day of borrow cost on every short whose instrument has a positive borrow rate.
     */
    public void applyBorrowCost(LocalDate date, Map<String, Double> prices, Map<String, InstrumentSpec> allSpecs,
                                int tradingDaysPerYear) {
        if (allSpecs == null || allSpecs.isEmpty()) {
            return;
        }
        int days = tradingDaysPerYear > 0 ? tradingDaysPerYear : 252;

        double total = 0.0;
        for (Position position : positions.values()) {
            if (position.getQuantity() >= 0) {
                continue;
            }
            InstrumentSpec spec = allSpecs.get(position.getSymbol());
            if (spec == null || spec.getBorrowRateAnnual() <= 0) {
                continue;
            }
            double price = markPrice(position, prices);
            double notionalAbs = Math.abs(position.notional(price, spec.getMultiplier()));
            double dailyRate = spec.getBorrowRateAnnual() / days;
            double cost = notionalAbs * dailyRate;
            if (cost <= 0) {
                continue;
            }
            String owner = ownerOf(position.getSymbol());
            borrowLog.append(BorrowLogEntry.builder()
                    .time(date)
                    .symbol(position.getSymbol())
                    .traderId(owner)
                    .notional(notionalAbs)
                    .dailyRate(dailyRate)
                    .cost(cost)
                    .build());
            if (!owner.isEmpty()) {
                borrowByTrader.merge(owner, cost, Double::sum);
            }
            total += cost;
        }

        if (total > 0) {
            cash -= total;
            borrowPaid += total;
        }
    }

    /**
     * Refresh marks and reserved margin, then append one valuation sample.
     */
    public EquityCurvePoint appendEquityCurve(LocalDate date, Map<String, Double> prices,
                                              Map<String, InstrumentSpec> allSpecs) {
        updateLastPrices(prices);
        updateReservedMargin(prices, allSpecs);

        double equity = computeEquity(prices, allSpecs);
        double[] exposures = exposures(prices, allSpecs);

        EquityCurvePoint point = EquityCurvePoint.builder()
                .date(date)
                .equity(equity)
                .cash(cash)
                .reservedMargin(reservedMargin)
                .grossExposure(exposures[0])
                .netExposure(exposures[1])
                .build();
        equityCurve.append(point);
        return point;
    }

    public void updateReservedMargin(Map<String, Double> prices, Map<String, InstrumentSpec> allSpecs) {
        double margin = 0.0;
        if (allSpecs != null) {
            for (Position position : positions.values()) {
                if (position.isFlat()) {
                    continue;
                }
                InstrumentSpec spec = allSpecs.get(position.getSymbol());
                if (spec != null) {
                    margin += spec.requiredMargin(position.getQuantity(), markPrice(position, prices));
                }
            }
        }
        reservedMargin = margin;
    }

    /**
     * Cash plus every open position marked at {@code prices}, falling back to
     * the last known price and then to the average price.
     */
    public double computeEquity(Map<String, Double> prices, Map<String, InstrumentSpec> allSpecs) {
        double equity = cash;
        for (Position position : positions.values()) {
            if (position.isFlat()) {
                continue;
            }
            equity += position.notional(markPrice(position, prices), multiplierOf(position.getSymbol(), allSpecs));
        }
        return equity;
    }

    /**
     * @return {gross, net} exposure
     */
    public double[] exposures(Map<String, Double> prices, Map<String, InstrumentSpec> allSpecs) {
        double gross = 0.0;
        double net = 0.0;
        for (Position position : positions.values()) {
            if (position.isFlat()) {
                continue;
            }
            double notional = position.notional(markPrice(position, prices), multiplierOf(position.getSymbol(), allSpecs));
            gross += Math.abs(notional);
            net += notional;
        }
        return new double[]{gross, net};
    }

    private double markPrice(Position position, Map<String, Double> prices) {
        String symbol = position.getSymbol();
        if (prices != null) {
            Double price = prices.get(symbol);
            if (price != null && Double.isFinite(price) && price > 0) {
                return price;
            }
        }
        Double last = lastPrices.get(symbol);
        if (last != null) {
            return last;
        }
        return position.getAvgPrice();
    }

    private static double multiplierOf(String symbol, Map<String, InstrumentSpec> allSpecs) {
        if (allSpecs == null) {
            return 1.0;
        }
        InstrumentSpec spec = allSpecs.get(symbol);
        return spec != null ? spec.getMultiplier() : 1.0;
    }

    private String ownerOf(String symbol) {
        return ownerBySymbol.getOrDefault(symbol, "");
    }

    // ---------------------------------------------------------------------
    // Logs and reports
    // ---------------------------------------------------------------------

    public List<TradeLogEntry> getTradeLog() {
        return tradeLog.entries();
    }

    public List<BorrowLogEntry> getBorrowLog() {
        return borrowLog.entries();
    }

    public List<EquityCurvePoint> getEquityCurve() {
        return equityCurve.entries();
    }

    public Map<String, Double> getFeesByTrader() {
        return Collections.unmodifiableMap(feesByTrader);
    }

    public Map<String, Double> getTaxesByTrader() {
        return Collections.unmodifiableMap(taxesByTrader);
    }

    public Map<String, Double> getBorrowByTrader() {
        return Collections.unmodifiableMap(borrowByTrader);
    }

    public void flushAll() {
        tradeLog.flush();
        borrowLog.flush();
        equityCurve.flush();
    }

    /**
     * Snapshot of the account. With a non-empty {@code traderId} the positions,
     * costs and PnL are restricted to that trader; cash and equity stay portfolio-wide.
     */
    public LedgerSummary summarize(Map<String, Double> prices, Map<String, InstrumentSpec> allSpecs, String traderId) {
        flushAll();
        boolean filtered = traderId != null && !traderId.isEmpty();

        List<LedgerSummary.PositionSnapshot> snapshots = new ArrayList<>();
        for (Position position : positions.values()) {
            String owner = ownerOf(position.getSymbol());
            if (filtered && !owner.equals(traderId)) {
                continue;
            }
            double multiplier = multiplierOf(position.getSymbol(), allSpecs);
            double price = markPrice(position, prices);
            snapshots.add(LedgerSummary.PositionSnapshot.builder()
                    .symbol(position.getSymbol())
                    .traderId(owner)
                    .quantity(position.getQuantity())
                    .avgPrice(position.getAvgPrice())
                    .lastPrice(price)
                    .multiplier(multiplier)
                    .notional(position.isFlat() ? 0.0 : position.notional(price, multiplier))
                    .realizedPnL(position.getRealizedPnL())
                    .unrealizedPnL(position.unrealizedPnL(price, multiplier))
                    .build());
        }

        double fees = 0.0;
        double taxes = 0.0;
        for (TradeLogEntry trade : tradeLog.entries()) {
            if (!filtered || trade.getTraderId().equals(traderId)) {
                fees += trade.getFee();
                taxes += trade.getTax();
            }
        }
        double borrow = 0.0;
        for (BorrowLogEntry row : borrowLog.entries()) {
            if (!filtered || row.getTraderId().equals(traderId)) {
                borrow += row.getCost();
            }
        }

        double realized = snapshots.stream().mapToDouble(LedgerSummary.PositionSnapshot::getRealizedPnL).sum();
        double unrealized = snapshots.stream().mapToDouble(LedgerSummary.PositionSnapshot::getUnrealizedPnL).sum();

        return LedgerSummary.builder()
                .traderId(filtered ? traderId : "")
                .equity(computeEquity(prices, allSpecs))
                .cash(cash)
                .reservedMargin(reservedMargin)
                .positions(snapshots)
                .fees(fees)
                .taxes(taxes)
                .borrow(borrow)
                .contributionPnL(realized + unrealized - fees - taxes - borrow)
                .build();
    }
}
