package com.ospicorp.indicatormetrics.indicator.catalog;

import com.ospicorp.indicatormetrics.indicator.model.CountryIndicators;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorDescriptor;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorType;
import com.ospicorp.indicatormetrics.indicator.model.ProviderKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Immutable (country, indicator) → descriptor mapping built once at startup. Country lookups are
 * case-insensitive and listings keep the configured order.
 */
public class IndicatorCatalog {
  private static final Logger log = LoggerFactory.getLogger(IndicatorCatalog.class);

  private final Map<String, Map<IndicatorType, IndicatorDescriptor>> byCountry;

  public IndicatorCatalog(List<IndicatorCatalogProperties.Entry> entries) {
    Map<String, Map<IndicatorType, IndicatorDescriptor>> countries = new LinkedHashMap<>();
    for (var entry : entries) {
      IndicatorDescriptor descriptor = toDescriptor(entry);
      var indicators = countries.computeIfAbsent(key(descriptor.country()),
          k -> new EnumMap<>(IndicatorType.class));
      if (indicators.containsKey(descriptor.indicator())) {
        throw new IllegalStateException("Duplicate catalog entry for " + descriptor.country()
            + "/" + descriptor.indicator());
      }
      indicators.put(descriptor.indicator(), descriptor);
    }
    Map<String, Map<IndicatorType, IndicatorDescriptor>> frozen = new LinkedHashMap<>();
    countries.forEach((country, indicators) ->
        frozen.put(country, Collections.unmodifiableMap(indicators)));
    this.byCountry = Collections.unmodifiableMap(frozen);
    log.info("Loaded indicator catalog with {} entries for {} countries", entries.size(),
        byCountry.size());
  }

  public Optional<IndicatorDescriptor> find(String country, IndicatorType indicator) {
    var indicators = byCountry.get(key(country));
    return indicators == null ? Optional.empty() : Optional.ofNullable(indicators.get(indicator));
  }

  public Optional<List<IndicatorDescriptor>> forCountry(String country) {
    var indicators = byCountry.get(key(country));
    return indicators == null ? Optional.empty() : Optional.of(List.copyOf(indicators.values()));
  }

  public List<String> countries() {
    List<String> countries = new ArrayList<>(byCountry.size());
    for (var indicators : byCountry.values()) {
      countries.add(indicators.values().iterator().next().country());
    }
    return countries;
  }

  public List<CountryIndicators> listing() {
    List<CountryIndicators> listing = new ArrayList<>(byCountry.size());
    for (var indicators : byCountry.values()) {
      List<IndicatorDescriptor> descriptors = List.copyOf(indicators.values());
      listing.add(new CountryIndicators(descriptors.get(0).country(), descriptors));
    }
    return listing;
  }

  private static IndicatorDescriptor toDescriptor(IndicatorCatalogProperties.Entry entry) {
    if (!StringUtils.hasText(entry.getCountry())) {
      throw new IllegalStateException("Catalog entry without country");
    }
    if (entry.getIndicator() == null || entry.getProvider() == null) {
      throw new IllegalStateException("Catalog entry for " + entry.getCountry()
          + " must define indicator and provider");
    }
    if (!StringUtils.hasText(entry.getSeriesId())) {
      throw new IllegalStateException("Catalog entry " + entry.getCountry() + "/"
          + entry.getIndicator() + " must define series-id");
    }
    if (entry.getProvider() == ProviderKind.POINT_LIST_API
        && !StringUtils.hasText(entry.getProviderCountry())) {
      throw new IllegalStateException("Catalog entry " + entry.getCountry() + "/"
          + entry.getIndicator() + " must define provider-country for " + entry.getProvider());
    }
    String label = StringUtils.hasText(entry.getLabel())
        ? entry.getLabel()
        : entry.getIndicator().displayName();
    return new IndicatorDescriptor(entry.getCountry().trim(), entry.getIndicator(),
        entry.getProvider(), entry.getSeriesId().trim(), entry.getProviderCountry(), label);
  }

  private static String key(String country) {
    return country == null ? "" : country.trim().toLowerCase(Locale.ROOT);
  }
}
