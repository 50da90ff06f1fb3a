package com.ospicorp.indicatormetrics.indicator.model;

import java.util.List;

/** Records in provider order, which is most recent first for the World Bank API. */
public record PointListRecords(List<PointListRecord> records) implements RawFetchResult {

  public static final PointListRecords EMPTY = new PointListRecords(List.of());

  public PointListRecords {
    records = List.copyOf(records);
  }

  @Override
  public ProviderKind kind() {
    return ProviderKind.POINT_LIST_API;
  }

  @Override
  public boolean isEmpty() {
    return records.isEmpty();
  }
}
