package com.quantbacktest.portfolio.domain;

import lombok.Value;

import java.time.LocalDate;

@Value
public class TraderCurvePoint {
    LocalDate date;
    double equity;
    int position;
}
