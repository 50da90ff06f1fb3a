package com.ospicorp.indicatormetrics.indicator.model;

/** Direction of a delta plus its absolute size; {@code magnitude} is null for UNKNOWN. */
public record Change(ChangeDirection direction, Double magnitude) {

  public static final Change UNKNOWN = new Change(ChangeDirection.UNKNOWN, null);
}
