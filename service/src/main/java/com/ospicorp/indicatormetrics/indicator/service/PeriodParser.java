package com.ospicorp.indicatormetrics.indicator.service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps provider period strings to the first day of the period: {@code 2023}, {@code 2023-05},
 * {@code 2023M05}, {@code 2023Q2} and ISO dates.
 */
public final class PeriodParser {
  private static final Pattern YEAR = Pattern.compile("^(\\d{4})$");
  private static final Pattern MONTH = Pattern.compile("^(\\d{4})(?:-|M)(\\d{1,2})$");
  private static final Pattern QUARTER = Pattern.compile("^(\\d{4})Q([1-4])$");

  private PeriodParser() {
  }

  public static Optional<LocalDate> parse(String period) {
    if (period == null) {
      return Optional.empty();
    }
    String value = period.trim();
    try {
      Matcher m = YEAR.matcher(value);
      if (m.matches()) {
        return Optional.of(LocalDate.of(Integer.parseInt(m.group(1)), 1, 1));
      }
      m = MONTH.matcher(value);
      if (m.matches()) {
        return Optional.of(
            LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), 1));
      }
      m = QUARTER.matcher(value);
      if (m.matches()) {
        int quarter = Integer.parseInt(m.group(2));
        return Optional.of(LocalDate.of(Integer.parseInt(m.group(1)), (quarter - 1) * 3 + 1, 1));
      }
      return Optional.of(LocalDate.parse(value));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }
}
