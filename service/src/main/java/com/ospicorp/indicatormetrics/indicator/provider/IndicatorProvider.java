package com.ospicorp.indicatormetrics.indicator.provider;

import com.ospicorp.indicatormetrics.indicator.model.DateRange;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorDescriptor;
import com.ospicorp.indicatormetrics.indicator.model.ProviderKind;
import com.ospicorp.indicatormetrics.indicator.model.RawFetchResult;

/** Upstream adapter for one {@link ProviderKind}. */
public interface IndicatorProvider {

  ProviderKind kind();

  /**
   * Fetches the raw series for a catalog entry.
   *
   * <p>Implementations never throw for upstream trouble (missing credentials, timeouts, bad
   * status, malformed body); they return an empty result instead.
   */
  RawFetchResult fetch(IndicatorDescriptor descriptor, DateRange range);

  /** The window {@link #fetch} sends upstream for {@code range}. */
  default String requestWindow(DateRange range) {
    return range.start() + ".." + range.end();
  }
}
