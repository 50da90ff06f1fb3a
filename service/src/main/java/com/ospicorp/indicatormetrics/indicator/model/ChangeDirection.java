package com.ospicorp.indicatormetrics.indicator.model;

public enum ChangeDirection {
  UP,
  DOWN,
  FLAT,
  UNKNOWN
}
