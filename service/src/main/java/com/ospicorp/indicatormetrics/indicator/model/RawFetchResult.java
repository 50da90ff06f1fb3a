package com.ospicorp.indicatormetrics.indicator.model;

/**
 * Provider-shaped payload as returned by an {@code IndicatorProvider}. An empty result means
 * "no data" and is never the same thing as a zero observation.
 */
public interface RawFetchResult {

  ProviderKind kind();

  boolean isEmpty();
}
