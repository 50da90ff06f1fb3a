package com.ospicorp.indicatormetrics.indicator.model;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/** Inclusive observation window requested from a provider. */
public record DateRange(LocalDate start, LocalDate end) {

  public DateRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start must be before or equal to end");
    }
  }

  /** Window ending today and reaching back {@code years} × 365 days. */
  public static DateRange lastYears(int years, Clock clock) {
    if (years < 1) {
      throw new IllegalArgumentException("years must be positive");
    }
    LocalDate end = LocalDate.now(clock);
    return new DateRange(end.minusDays(years * 365L), end);
  }
}
