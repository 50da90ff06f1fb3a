package com.ospicorp.indicatormetrics.indicator.service;

import com.ospicorp.indicatormetrics.indicator.model.CanonicalSeries;
import com.ospicorp.indicatormetrics.indicator.model.DataPoint;
import com.ospicorp.indicatormetrics.indicator.model.PointListRecord;
import com.ospicorp.indicatormetrics.indicator.model.PointListRecords;
import com.ospicorp.indicatormetrics.indicator.model.ProviderKind;
import com.ospicorp.indicatormetrics.indicator.model.RawFetchResult;
import com.ospicorp.indicatormetrics.indicator.model.SeriesObservations;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns either provider shape into a most-recent-first {@link CanonicalSeries}. */
public final class Normalizer {
  private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

  private Normalizer() {
  }

  public static CanonicalSeries normalize(RawFetchResult raw) {
    Objects.requireNonNull(raw, "raw");
    return switch (raw.kind()) {
      case SERIES_API -> fromSeries((SeriesObservations) raw);
      case POINT_LIST_API -> fromPointList((PointListRecords) raw);
    };
  }

  // Series-API input is dense and oldest first: reverse, keep everything.
  private static CanonicalSeries fromSeries(SeriesObservations raw) {
    List<DataPoint> in = raw.observations();
    List<DataPoint> out = new ArrayList<>(in.size());
    Set<LocalDate> seen = new HashSet<>();
    for (int i = in.size() - 1; i >= 0; --i) {
      var p = in.get(i);
      if (p.date() != null && isUsable(p.value()) && seen.add(p.date())) {
        out.add(p);
      }
    }
    return new CanonicalSeries(ProviderKind.SERIES_API, out, false);
  }

  // Point-list input keeps provider order. A lead record without a usable value is flagged: it is
  // still the current observation.
  private static CanonicalSeries fromPointList(PointListRecords raw) {
    List<PointListRecord> in = raw.records();
    if (in.isEmpty()) {
      return CanonicalSeries.empty(ProviderKind.POINT_LIST_API);
    }
    List<DataPoint> out = new ArrayList<>(in.size());
    Set<LocalDate> seen = new HashSet<>();
    boolean leadMissing = false;
    for (int i = 0; i < in.size(); i++) {
      PointListRecord record = in.get(i);
      Optional<LocalDate> date = PeriodParser.parse(record.date());
      if (date.isEmpty() && isUsable(record.value())) {
        log.warn("Dropping point-list record {} with unreadable period '{}'{}", i, record.date(),
            i == 0 ? "; current value is unavailable" : "");
      }
      boolean usable = isUsable(record.value()) && date.isPresent();
      if (i == 0 && !usable) {
        leadMissing = true;
      }
      if (usable && seen.add(date.get())) {
        out.add(new DataPoint(date.get(), record.value()));
      }
    }
    return new CanonicalSeries(ProviderKind.POINT_LIST_API, out, leadMissing);
  }

  private static boolean isUsable(Double value) {
    return value != null && Double.isFinite(value);
  }
}
