package com.ospicorp.indicatormetrics.indicator.service;

import com.ospicorp.indicatormetrics.indicator.cache.CacheKey;
import com.ospicorp.indicatormetrics.indicator.cache.FetchCache;
import com.ospicorp.indicatormetrics.indicator.catalog.IndicatorCatalog;
import com.ospicorp.indicatormetrics.indicator.model.CanonicalSeries;
import com.ospicorp.indicatormetrics.indicator.model.CountryIndicators;
import com.ospicorp.indicatormetrics.indicator.model.DateRange;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorDescriptor;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorMetrics;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorType;
import com.ospicorp.indicatormetrics.indicator.model.MetricsRecord;
import com.ospicorp.indicatormetrics.indicator.model.ProviderKind;
import com.ospicorp.indicatormetrics.indicator.model.RawFetchResult;
import com.ospicorp.indicatormetrics.indicator.provider.IndicatorProvider;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Runs fetch → normalize → compute → classify for catalog entries. Every (country, indicator)
 * pair is computed on its own: a failure turns that pair into an unavailable entry and leaves the
 * rest of a batch untouched.
 */
@Service
public class IndicatorMetricsService {
  private static final Logger log = LoggerFactory.getLogger(IndicatorMetricsService.class);
  public static final int MIN_YEARS = 1;
  public static final int MAX_YEARS = 10;

  private final IndicatorCatalog catalog;
  private final Map<ProviderKind, IndicatorProvider> providers;
  private final FetchCache cache;
  private final Executor executor;
  private final Clock clock;
  private final Duration batchTimeout;

  public IndicatorMetricsService(IndicatorCatalog catalog, List<IndicatorProvider> providers,
      FetchCache cache, @Qualifier("indicatorExecutor") Executor executor, Clock clock,
      @Value("${indicators.executor.batch-timeout:PT30S}") Duration batchTimeout) {
    this.catalog = catalog;
    this.providers = indexProviders(providers);
    this.cache = cache;
    this.executor = executor;
    this.clock = clock;
    this.batchTimeout = batchTimeout;
    for (CountryIndicators country : catalog.listing()) {
      for (IndicatorDescriptor descriptor : country.indicators()) {
        if (!this.providers.containsKey(descriptor.provider())) {
          throw new IllegalStateException("No provider registered for " + descriptor.provider()
              + " (needed by " + descriptor.country() + "/" + descriptor.indicator() + ")");
        }
      }
    }
  }

  public List<CountryIndicators> catalog() {
    return catalog.listing();
  }

  public IndicatorMetrics metricsFor(String country, IndicatorType indicator, int years) {
    IndicatorDescriptor descriptor = catalog.find(country, indicator)
        .orElseThrow(() -> new NoSuchElementException(
            "No indicator " + indicator + " configured for country " + country));
    return computeSafely(descriptor, range(years));
  }

  public List<IndicatorMetrics> metricsForCountry(String country, int years) {
    List<IndicatorDescriptor> descriptors = catalog.forCountry(country)
        .orElseThrow(() -> new NoSuchElementException("Country not found: " + country));
    return computeAll(descriptors, range(years));
  }

  /**
   * One indicator across countries. Countries without that indicator are skipped; an empty or
   * null country list means every catalog country.
   */
  public List<IndicatorMetrics> compare(IndicatorType indicator, List<String> countries,
      int years) {
    List<String> requested = (countries == null || countries.isEmpty())
        ? catalog.countries()
        : countries;
    List<IndicatorDescriptor> descriptors = new ArrayList<>();
    for (String country : requested) {
      if (!StringUtils.hasText(country)) {
        continue;
      }
      if (catalog.forCountry(country).isEmpty()) {
        throw new NoSuchElementException("Country not found: " + country);
      }
      catalog.find(country, indicator).ifPresent(descriptors::add);
    }
    return computeAll(descriptors, range(years));
  }

  /** Computes one pair. Provider failures already degrade to "no data" below this point. */
  IndicatorMetrics compute(IndicatorDescriptor descriptor, DateRange range) {
    IndicatorProvider provider = providers.get(descriptor.provider());
    RawFetchResult raw = cache.getOrFetch(CacheKey.of(descriptor, provider.requestWindow(range)),
        () -> provider.fetch(descriptor, range));
    if (raw.isEmpty()) {
      log.debug("No upstream data for {}/{}", descriptor.country(), descriptor.indicator());
      return IndicatorMetrics.unavailable(descriptor);
    }
    CanonicalSeries series = Normalizer.normalize(raw);
    Optional<MetricsRecord> metrics = MetricsCalculator.compute(series);
    if (metrics.isEmpty()) {
      log.debug("No metrics for {}/{} ({} points, lead missing: {})", descriptor.country(),
          descriptor.indicator(), series.size(), series.leadMissing());
      return IndicatorMetrics.unavailable(descriptor);
    }
    MetricsRecord m = metrics.get();
    return new IndicatorMetrics(descriptor.country(), descriptor.indicator(), descriptor.label(),
        descriptor.provider(), true, m,
        ChangeFormatter.classify(m.momChange()),
        ChangeFormatter.classify(m.momPct()),
        ChangeFormatter.classify(m.yoyChange()),
        ChangeFormatter.classify(m.yoyPct()));
  }

  private IndicatorMetrics computeSafely(IndicatorDescriptor descriptor, DateRange range) {
    try {
      return compute(descriptor, range);
    } catch (RuntimeException ex) {
      log.warn("Computing {}/{} failed: {}", descriptor.country(), descriptor.indicator(),
          ex.getMessage(), ex);
      return IndicatorMetrics.unavailable(descriptor);
    }
  }

  private List<IndicatorMetrics> computeAll(List<IndicatorDescriptor> descriptors,
      DateRange range) {
    List<CompletableFuture<IndicatorMetrics>> futures = new ArrayList<>(descriptors.size());
    for (IndicatorDescriptor descriptor : descriptors) {
      try {
        futures.add(CompletableFuture.supplyAsync(() -> computeSafely(descriptor, range),
            executor));
      } catch (RejectedExecutionException ex) {
        log.warn("Executor rejected {}/{}: {}", descriptor.country(), descriptor.indicator(),
            ex.getMessage());
        futures.add(CompletableFuture.completedFuture(IndicatorMetrics.unavailable(descriptor)));
      }
    }
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
          .get(batchTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      log.warn("Batch of {} indicators did not finish within {}", descriptors.size(),
          batchTimeout);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for {} indicators", descriptors.size());
    } catch (ExecutionException ex) {
      throw new IllegalStateException("Indicator batch failed", ex.getCause());
    }

    List<IndicatorMetrics> results = new ArrayList<>(descriptors.size());
    for (int i = 0; i < descriptors.size(); i++) {
      IndicatorDescriptor descriptor = descriptors.get(i);
      CompletableFuture<IndicatorMetrics> future = futures.get(i);
      if (future.isDone() && !future.isCompletedExceptionally()) {
        results.add(future.join());
      } else {
        future.cancel(false);
        results.add(IndicatorMetrics.unavailable(descriptor));
      }
    }
    return results;
  }

  private DateRange range(int years) {
    if (years < MIN_YEARS || years > MAX_YEARS) {
      throw new IllegalArgumentException(
          "years must be between " + MIN_YEARS + " and " + MAX_YEARS);
    }
    return DateRange.lastYears(years, clock);
  }

  private static Map<ProviderKind, IndicatorProvider> indexProviders(
      List<IndicatorProvider> providers) {
    Map<ProviderKind, IndicatorProvider> byKind = new EnumMap<>(ProviderKind.class);
    for (IndicatorProvider provider : providers) {
      IndicatorProvider previous = byKind.put(provider.kind(), provider);
      if (previous != null) {
        throw new IllegalStateException("Multiple providers registered for " + provider.kind());
      }
    }
    return byKind;
  }
}
