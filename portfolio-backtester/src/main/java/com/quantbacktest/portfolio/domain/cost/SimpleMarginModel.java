package com.quantbacktest.portfolio.domain.cost;

import lombok.Value;

/**
 * Minimal margin model. Longs reserve {@code longRate} of notional (zero by default),
 * shorts reserve the initial short rate.
 */
@Value
public class SimpleMarginModel implements MarginModel {

    public static final SimpleMarginModel DEFAULT = new SimpleMarginModel(0.0, 0.50, 0.30);
    public static final SimpleMarginModel NONE = new SimpleMarginModel(0.0, 0.0, 0.0);

    double longRate;
    double shortInitialRate;
    // Not used for the reservation itself; kept for maintenance-call reporting.
    double shortMaintenanceRate;

    public SimpleMarginModel(double longRate, double shortInitialRate, double shortMaintenanceRate) {
        this.longRate = Math.max(0.0, longRate);
        this.shortInitialRate = Math.max(0.0, shortInitialRate);
        this.shortMaintenanceRate = Math.max(0.0, shortMaintenanceRate);
    }

    @Override
    public double margin(double quantity, double price, double multiplier) {
        if (!Double.isFinite(quantity) || !Double.isFinite(price) || !Double.isFinite(multiplier)) {
            return 0.0;
        }
        double notionalAbs = Math.abs(quantity * price * multiplier);
        return quantity >= 0 ? notionalAbs * longRate : notionalAbs * shortInitialRate;
    }
}
