package com.ospicorp.indicatormetrics.indicator.model;

/**
 * Upstream provider families. Each one ships a differently shaped payload and gets its own
 * reference-point rules in {@code MetricsCalculator}.
 */
public enum ProviderKind {
  /** Ordered numeric observations for a named instrument (FRED). */
  SERIES_API,
  /** Unordered {@code {date, value}} records per country and indicator (World Bank). */
  POINT_LIST_API
}
