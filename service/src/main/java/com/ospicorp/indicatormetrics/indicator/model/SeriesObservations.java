package com.ospicorp.indicatormetrics.indicator.model;

import java.util.List;

/** Dense numeric observations in time order, most recent last. */
public record SeriesObservations(List<DataPoint> observations) implements RawFetchResult {

  public static final SeriesObservations EMPTY = new SeriesObservations(List.of());

  public SeriesObservations {
    observations = List.copyOf(observations);
  }

  @Override
  public ProviderKind kind() {
    return ProviderKind.SERIES_API;
  }

  @Override
  public boolean isEmpty() {
    return observations.isEmpty();
  }
}
