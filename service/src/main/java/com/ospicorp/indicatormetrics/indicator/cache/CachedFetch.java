package com.ospicorp.indicatormetrics.indicator.cache;

import com.ospicorp.indicatormetrics.indicator.model.RawFetchResult;
import java.time.Instant;

record CachedFetch(RawFetchResult result, Instant fetchedAt) {}
