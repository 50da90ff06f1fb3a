package com.ospicorp.indicatormetrics.indicator.service;

import com.ospicorp.indicatormetrics.indicator.model.CanonicalSeries;
import com.ospicorp.indicatormetrics.indicator.model.DataPoint;
import com.ospicorp.indicatormetrics.indicator.model.MetricsRecord;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Derives current/previous/year-ago values and their deltas from a canonical series.
 *
 * <p>Reference points are picked by one of two rules depending on the series shape:
 * <ul>
 *   <li>series-api: positional. Previous is index 1, year ago is index 11 (needs 12 points).</li>
 *   <li>point-list-api: null skipping. Current is strictly the provider's first record, previous
 *   is the next record with a value, year ago is the first record with a value dated at least one
 *   year before current.</li>
 * </ul>
 * A zero reference value yields a percentage change of exactly {@code 0}.
 */
public final class MetricsCalculator {
  static final int YEAR_AGO_INDEX = 11;

  private MetricsCalculator() {
  }

  public static Optional<MetricsRecord> compute(CanonicalSeries series) {
    if (series == null || series.isEmpty() || series.leadMissing()) {
      return Optional.empty();
    }
    ReferencePoints refs = switch (series.shape()) {
      case SERIES_API -> positional(series);
      case POINT_LIST_API -> nullSkipping(series);
    };

    double current = refs.current().value();
    Double previous = valueOf(refs.previous());
    Double yearAgo = valueOf(refs.yearAgo());

    return Optional.of(new MetricsRecord(
        current,
        refs.current().date(),
        previous,
        dateOf(refs.previous()),
        yearAgo,
        dateOf(refs.yearAgo()),
        change(current, previous),
        pct(current, previous),
        change(current, yearAgo),
        pct(current, yearAgo)));
  }

  private static ReferencePoints positional(CanonicalSeries series) {
    DataPoint previous = series.size() > 1 ? series.get(1) : null;
    DataPoint yearAgo = series.size() > YEAR_AGO_INDEX ? series.get(YEAR_AGO_INDEX) : null;
    return new ReferencePoints(series.get(0), previous, yearAgo);
  }

  private static ReferencePoints nullSkipping(CanonicalSeries series) {
    DataPoint current = series.get(0);
    DataPoint previous = series.size() > 1 ? series.get(1) : null;
    LocalDate threshold = current.date().minusYears(1);
    DataPoint yearAgo = null;
    for (int i = 1; i < series.size(); i++) {
      var p = series.get(i);
      if (!p.date().isAfter(threshold)) {
        yearAgo = p;
        break;
      }
    }
    return new ReferencePoints(current, previous, yearAgo);
  }

  private static Double change(double current, Double reference) {
    return reference == null ? null : current - reference;
  }

  private static Double pct(double current, Double reference) {
    if (reference == null) {
      return null;
    }
    if (reference == 0d) {
      return 0d;
    }
    return ((current - reference) / reference) * 100d;
  }

  private static Double valueOf(DataPoint point) {
    return point == null ? null : point.value();
  }

  private static LocalDate dateOf(DataPoint point) {
    return point == null ? null : point.date();
  }

  private record ReferencePoints(DataPoint current, DataPoint previous, DataPoint yearAgo) {}
}
