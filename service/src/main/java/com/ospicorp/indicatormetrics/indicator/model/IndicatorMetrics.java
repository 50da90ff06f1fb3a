package com.ospicorp.indicatormetrics.indicator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Per (country, indicator) result handed to clients. {@code metrics} is null and every change is
 * UNKNOWN when the upstream had no usable data.
 */
@Schema(name = "IndicatorMetrics")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record IndicatorMetrics(
    String country,
    IndicatorType indicator,
    String label,
    ProviderKind provider,
    boolean available,
    MetricsRecord metrics,
    Change mom,
    Change momPct,
    Change yoy,
    Change yoyPct
) {

  public static IndicatorMetrics unavailable(IndicatorDescriptor descriptor) {
    return new IndicatorMetrics(descriptor.country(), descriptor.indicator(), descriptor.label(),
        descriptor.provider(), false, null, Change.UNKNOWN, Change.UNKNOWN, Change.UNKNOWN,
        Change.UNKNOWN);
  }
}
