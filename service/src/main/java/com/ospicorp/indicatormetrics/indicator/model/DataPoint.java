package com.ospicorp.indicatormetrics.indicator.model;

import java.time.LocalDate;

public record DataPoint(LocalDate date, Double value) {}
