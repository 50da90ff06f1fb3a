package com.ospicorp.indicatormetrics.indicator.cache;

import com.ospicorp.indicatormetrics.indicator.model.IndicatorDescriptor;
import com.ospicorp.indicatormetrics.indicator.model.ProviderKind;

/**
 * Request identity of one upstream fetch. {@code window} is the period window the provider
 * actually asks for, so requests that end up as the same upstream call share an entry.
 */
public record CacheKey(ProviderKind provider, String seriesId, String window) {

  public static CacheKey of(IndicatorDescriptor descriptor, String window) {
    String id = descriptor.providerCountry() == null
        ? descriptor.seriesId()
        : descriptor.providerCountry() + "/" + descriptor.seriesId();
    return new CacheKey(descriptor.provider(), id, window);
  }
}
