package com.ospicorp.indicatormetrics.indicator.model;

/**
 * Static catalog entry describing where one (country, indicator) pair comes from.
 *
 * @param seriesId FRED series id or World Bank indicator code
 * @param providerCountry World Bank country code; {@code null} for series-api entries
 */
public record IndicatorDescriptor(
    String country,
    IndicatorType indicator,
    ProviderKind provider,
    String seriesId,
    String providerCountry,
    String label
) {}
