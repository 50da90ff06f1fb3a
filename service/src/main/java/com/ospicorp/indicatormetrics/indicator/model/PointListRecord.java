package com.ospicorp.indicatormetrics.indicator.model;

/**
 * One World Bank record. {@code date} is kept as the provider's period string ("2023",
 * "2023M05", "2023Q2"); {@code value} is {@code null} when the provider has no observation.
 */
public record PointListRecord(String date, Double value) {}
