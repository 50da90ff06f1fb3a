package com.ospicorp.indicatormetrics.indicator.model;

import java.util.Locale;

public enum IndicatorType {
  CPI("CPI"),
  PPI("PPI"),
  INTEREST_RATE("Interest Rate"),
  UNEMPLOYMENT("Unemployment"),
  GDP_GROWTH("GDP Growth");

  private final String displayName;

  IndicatorType(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * Accepts the enum name in any case, with dashes, spaces or underscores as separators
   * ({@code interest-rate}, {@code Interest Rate}, {@code INTEREST_RATE}).
   */
  public static IndicatorType parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("indicator must be provided");
    }
    String normalized = value.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
    return IndicatorType.valueOf(normalized);
  }
}
