package com.ospicorp.indicatormetrics.indicator.model;

import java.time.LocalDate;

/**
 * Derived comparison metrics for one series. Every field except {@code current} and
 * {@code currentDate} is {@code null} when its reference point is unavailable. Values are not
 * rounded.
 */
public record MetricsRecord(
    double current,
    LocalDate currentDate,
    Double previous,
    LocalDate previousDate,
    Double yearAgo,
    LocalDate yearAgoDate,
    Double momChange,
    Double momPct,
    Double yoyChange,
    Double yoyPct
) {}
