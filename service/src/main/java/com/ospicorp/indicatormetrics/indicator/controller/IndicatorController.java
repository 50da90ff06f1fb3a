package com.ospicorp.indicatormetrics.indicator.controller;

import com.ospicorp.indicatormetrics.indicator.model.CountryIndicators;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorMetrics;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorType;
import com.ospicorp.indicatormetrics.indicator.service.IndicatorMetricsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Validated
@Tag(name = "Indicators")
public class IndicatorController {
  private static final String COUNTRY_REGEX = "^[A-Za-z][A-Za-z .-]{0,63}$";
  private static final String ERROR_DOCS_BASE = "https://developers.company.com/docs/errors/";

  private final IndicatorMetricsService svc;

  public IndicatorController(IndicatorMetricsService svc) {
    this.svc = svc;
  }

  @GetMapping("/countries")
  @Operation(summary = "List catalog", description = "Countries with their configured indicators.")
  public List<CountryIndicators> countries() {
    return svc.catalog();
  }

  @GetMapping("/countries/{country}/metrics")
  @Operation(summary = "Country overview",
      description = "Metrics for every indicator configured for a country.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Metrics per indicator",
          content = @Content(mediaType = "application/json",
              array = @ArraySchema(schema = @Schema(implementation = IndicatorMetrics.class)))),
      @ApiResponse(responseCode = "400", description = "Bad request"),
      @ApiResponse(responseCode = "404", description = "Unknown country",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public List<IndicatorMetrics> countryMetrics(
      @PathVariable @Pattern(regexp = COUNTRY_REGEX)
      @Parameter(description = "Country or region", example = "US") String country,
      @RequestParam(defaultValue = "3")
      @Parameter(description = "Years of data to request", example = "3") int years) {
    validateYears(years);
    return svc.metricsForCountry(country, years);
  }

  @GetMapping("/countries/{country}/indicators/{indicator}/metrics")
  @Operation(summary = "Indicator metrics",
      description = "Current, previous and year-ago values with MoM/YoY changes.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Metrics",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = IndicatorMetrics.class))),
      @ApiResponse(responseCode = "400", description = "Bad request"),
      @ApiResponse(responseCode = "404", description = "Unknown country/indicator pair",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public IndicatorMetrics indicatorMetrics(
      @PathVariable @Pattern(regexp = COUNTRY_REGEX)
      @Parameter(description = "Country or region", example = "Europe") String country,
      @PathVariable @Parameter(description = "Indicator", example = "interest_rate") String indicator,
      @RequestParam(defaultValue = "3") int years) {
    IndicatorType type = parseIndicator(indicator);
    validateYears(years);
    return svc.metricsFor(country, type, years);
  }

  @GetMapping("/indicators/{indicator}/comparison")
  @Operation(summary = "Compare countries",
      description = "One indicator across countries; countries lacking it are left out.")
  public List<IndicatorMetrics> comparison(
      @PathVariable @Parameter(description = "Indicator", example = "cpi") String indicator,
      @RequestParam(name = "countries", required = false)
      @Parameter(description = "Comma separated countries, all when omitted",
          example = "US,India") String countries,
      @RequestParam(defaultValue = "3") int years) {
    IndicatorType type = parseIndicator(indicator);
    validateYears(years);
    return svc.compare(type, countriesMapper(countries), years);
  }

  private List<String> countriesMapper(String countries) {
    if (!StringUtils.hasText(countries)) {
      return List.of();
    }
    return List.of(countries.split(","))
        .stream()
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .distinct()
        .toList();
  }

  private static IndicatorType parseIndicator(String value) {
    try {
      return IndicatorType.parse(value);
    } catch (IllegalArgumentException ex) {
      throw invalidParameter(
          "Invalid indicator. Supported values: cpi,ppi,interest_rate,unemployment,gdp_growth.",
          2001);
    }
  }

  private static void validateYears(int years) {
    if (years < IndicatorMetricsService.MIN_YEARS || years > IndicatorMetricsService.MAX_YEARS) {
      throw invalidParameter("Invalid years parameter. Supported range: "
          + IndicatorMetricsService.MIN_YEARS + "-" + IndicatorMetricsService.MAX_YEARS + ".", 2002);
    }
  }

  private static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }
}
