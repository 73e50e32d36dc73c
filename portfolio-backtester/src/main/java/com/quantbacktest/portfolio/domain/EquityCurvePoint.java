package com.quantbacktest.portfolio.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Portfolio valuation sample.
 */
@Value
@Builder
public class EquityCurvePoint {

    LocalDate date;
    double equity;
    double cash;
    double reservedMargin;
    double grossExposure;
    double netExposure;
}
