package com.quantbacktest.portfolio.domain;

import com.quantbacktest.portfolio.domain.cost.CostModel;
import com.quantbacktest.portfolio.domain.cost.FeeModel;
import com.quantbacktest.portfolio.domain.cost.MarginModel;
import com.quantbacktest.portfolio.domain.cost.NoTaxModel;
import com.quantbacktest.portfolio.domain.cost.RateFeeModel;
import com.quantbacktest.portfolio.domain.cost.SimpleMarginModel;
import com.quantbacktest.portfolio.domain.cost.TaxModel;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Per-instrument trading rules and cost models.
 *
 * <p>Instruments whose asset type starts with {@code KRX} enforce the Korean
 * 90 calendar-day short-cover rule unless the builder sets the rule explicitly.
 */
@Value
public class InstrumentSpec implements CostModel {

    public static final int KRX_SHORT_MAX_HOLD_DAYS = 90;

    String symbol;
    String name;
    String assetType;
    String currency;
    double multiplier;
    boolean allowShort;
    /** Target notional cap as a fraction of the sizing equity. */
    double maxNotionalFraction;
    double borrowRateAnnual;
    FeeModel feeModel;
    TaxModel taxModel;
    MarginModel marginModel;
    boolean enforceShortMaxHold;
    /** Calendar days a short may stay open; 0 means no limit. */
    int shortMaxHoldDays;

    @Builder(toBuilder = true)
    private InstrumentSpec(String symbol, String name, String assetType, String currency,
                           Double multiplier, Boolean allowShort, Double maxNotionalFraction,
                           Double borrowRateAnnual, FeeModel feeModel, TaxModel taxModel,
                           MarginModel marginModel, Boolean enforceShortMaxHold, Integer shortMaxHoldDays) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Instrument symbol is required");
        }
        this.symbol = symbol;
        this.name = name != null ? name : "";
        this.assetType = resolveAssetType(assetType, this.name);
        this.currency = currency != null ? currency : "KRW";
        this.multiplier = multiplier != null && multiplier > 0 ? multiplier : 1.0;
        this.allowShort = allowShort == null || allowShort;
        this.maxNotionalFraction = maxNotionalFraction != null ? Math.max(0.0, maxNotionalFraction) : 1.0;
        this.borrowRateAnnual = borrowRateAnnual != null ? Math.max(0.0, borrowRateAnnual) : 0.04;
        this.feeModel = feeModel != null ? feeModel : RateFeeModel.ZERO;
        this.taxModel = taxModel != null ? taxModel : NoTaxModel.INSTANCE;
        this.marginModel = marginModel != null ? marginModel : SimpleMarginModel.DEFAULT;

        boolean krx = this.assetType.toUpperCase(Locale.ROOT).startsWith("KRX");
        this.enforceShortMaxHold = enforceShortMaxHold != null ? enforceShortMaxHold : krx;
        int days = shortMaxHoldDays != null ? shortMaxHoldDays : (krx ? KRX_SHORT_MAX_HOLD_DAYS : 0);
        this.shortMaxHoldDays = Math.max(0, days);
    }

    private static String resolveAssetType(String assetType, String name) {
        if (assetType != null && !assetType.isBlank()) {
            return assetType;
        }
        // older configurations passed the asset tag ("KRX_STOCK") as the name
        if (name.toUpperCase(Locale.ROOT).startsWith("KRX")) {
            return name.toUpperCase(Locale.ROOT);
        }
        return "UNKNOWN";
    }

    /**
     * True when a short-cover deadline applies to this instrument.
     */
    public boolean hasShortDeadline() {
        return enforceShortMaxHold && shortMaxHoldDays > 0;
    }

    @Override
    public double fee(double notionalAbs) {
        return feeModel.fee(notionalAbs);
    }

    @Override
    public double tax(LocalDate date, TradeSide side, double notionalAbs) {
        return taxModel.tax(date, side, notionalAbs);
    }

    @Override
    public double margin(double quantity, double price, double multiplier) {
        return marginModel.margin(quantity, price, multiplier);
    }

    public double requiredMargin(double quantity, double price) {
        return margin(quantity, price, multiplier);
    }
}
