package com.ospicorp.indicatormetrics.indicator.model;

import java.util.List;

public record CountryIndicators(String country, List<IndicatorDescriptor> indicators) {}
