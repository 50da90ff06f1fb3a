package com.ospicorp.indicatormetrics.indicator.cache;

import com.ospicorp.indicatormetrics.indicator.model.RawFetchResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Memoizes raw provider results for a fixed TTL. Entries expire lazily when read; nothing sweeps
 * them in the background, the key space is bounded by the catalog.
 *
 * <p>Concurrent calls for the same missing key are not coalesced: each one fetches and the last
 * write wins.
 */
@Component
public class FetchCache {
  private static final Logger log = LoggerFactory.getLogger(FetchCache.class);

  private final Map<CacheKey, CachedFetch> entries = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Duration ttl;

  public FetchCache(Clock clock, @Value("${indicators.cache.ttl:PT1H}") Duration ttl) {
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("cache ttl must be positive");
    }
    this.clock = clock;
    this.ttl = ttl;
  }

  public RawFetchResult getOrFetch(CacheKey key, Supplier<RawFetchResult> fetch) {
    Objects.requireNonNull(key, "key");
    Instant now = clock.instant();
    CachedFetch cached = entries.get(key);
    if (cached != null && now.isBefore(cached.fetchedAt().plus(ttl))) {
      log.debug("Cache hit for {} (age {})", key, Duration.between(cached.fetchedAt(), now));
      return cached.result();
    }
    log.debug("Cache {} for {}", cached == null ? "miss" : "expired", key);
    evictExpired(now);
    RawFetchResult result = Objects.requireNonNull(fetch.get(), "fetch returned null");
    entries.put(key, new CachedFetch(result, clock.instant()));
    return result;
  }

  // Keys carry a date range ending today, so yesterday's keys are never read again.
  private void evictExpired(Instant now) {
    int before = entries.size();
    entries.values().removeIf(entry -> !now.isBefore(entry.fetchedAt().plus(ttl)));
    int evicted = before - entries.size();
    if (evicted > 0) {
      log.debug("Evicted {} expired cache entries", evicted);
    }
  }

  public int size() {
    return entries.size();
  }

  public void clear() {
    entries.clear();
  }

  public Duration ttl() {
    return ttl;
  }
}
