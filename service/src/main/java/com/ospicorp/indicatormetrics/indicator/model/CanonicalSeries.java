package com.ospicorp.indicatormetrics.indicator.model;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Provider-agnostic series, most recent first. Points never carry a {@code null} value and no two
 * points share a date.
 *
 * @param shape provider kind the series was built from; selects the reference-point rules
 * @param leadMissing {@code true} when the provider's most recent record had no value (point-list
 *     input only)
 */
public record CanonicalSeries(ProviderKind shape, List<DataPoint> points, boolean leadMissing) {

  public CanonicalSeries {
    Objects.requireNonNull(shape, "shape");
    points = List.copyOf(points);
    Set<LocalDate> dates = new HashSet<>();
    for (DataPoint point : points) {
      if (point.date() == null) {
        throw new IllegalArgumentException("point without date");
      }
      if (point.value() == null || !Double.isFinite(point.value())) {
        throw new IllegalArgumentException("non-finite value at " + point.date());
      }
      if (!dates.add(point.date())) {
        throw new IllegalArgumentException("duplicate date " + point.date());
      }
    }
  }

  public static CanonicalSeries empty(ProviderKind shape) {
    return new CanonicalSeries(shape, List.of(), false);
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  public int size() {
    return points.size();
  }

  public DataPoint get(int index) {
    return points.get(index);
  }
}
