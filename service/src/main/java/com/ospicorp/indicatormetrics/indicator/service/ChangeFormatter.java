package com.ospicorp.indicatormetrics.indicator.service;

import com.ospicorp.indicatormetrics.indicator.model.Change;
import com.ospicorp.indicatormetrics.indicator.model.ChangeDirection;

public final class ChangeFormatter {
  private ChangeFormatter() {
  }

  public static Change classify(Double delta) {
    if (delta == null || delta.isNaN()) {
      return Change.UNKNOWN;
    }
    if (delta == 0d) {
      return new Change(ChangeDirection.FLAT, 0d);
    }
    return new Change(delta > 0 ? ChangeDirection.UP : ChangeDirection.DOWN, Math.abs(delta));
  }
}
