package com.ospicorp.indicatormetrics.indicator.controller;

import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ospicorp.indicatormetrics.indicator.model.Change;
import com.ospicorp.indicatormetrics.indicator.model.ChangeDirection;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorMetrics;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorType;
import com.ospicorp.indicatormetrics.indicator.model.MetricsRecord;
import com.ospicorp.indicatormetrics.indicator.model.ProviderKind;
import com.ospicorp.indicatormetrics.indicator.service.IndicatorMetricsService;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class IndicatorControllerTest {

  @Autowired
  private TestRestTemplate rest;

  @MockBean
  private IndicatorMetricsService svc;

  private static IndicatorMetrics usCpi() {
    MetricsRecord record = new MetricsRecord(130d, LocalDate.of(2024, 6, 1), 127d,
        LocalDate.of(2024, 5, 1), 102d, LocalDate.of(2023, 7, 1), 3d, 3d / 127d * 100, 28d,
        28d / 102d * 100);
    return new IndicatorMetrics("US", IndicatorType.CPI, "CPI", ProviderKind.SERIES_API, true,
        record, new Change(ChangeDirection.UP, 3d),
        new Change(ChangeDirection.UP, 3d / 127d * 100),
        new Change(ChangeDirection.UP, 28d), new Change(ChangeDirection.UP, 28d / 102d * 100));
  }

  @Test
  void indicatorMetricsReturnsRecord() {
    when(svc.metricsFor("US", IndicatorType.CPI, 3)).thenReturn(usCpi());

    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/countries/US/indicators/cpi/metrics",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = requireNonNull(response.getBody());
    assertThat(body).containsEntry("country", "US")
        .containsEntry("indicator", "CPI")
        .containsEntry("available", true);
    @SuppressWarnings("unchecked")
    Map<String, Object> metrics = (Map<String, Object>) body.get("metrics");
    assertThat(metrics).containsEntry("current", 130.0).containsEntry("momChange", 3.0);
    @SuppressWarnings("unchecked")
    Map<String, Object> mom = (Map<String, Object>) body.get("mom");
    assertThat(mom).containsEntry("direction", "UP");
  }

  @Test
  void indicatorPathAcceptsDashedNames() {
    when(svc.metricsFor("Europe", IndicatorType.INTEREST_RATE, 5))
        .thenReturn(usCpi());

    ResponseEntity<Map<String, Object>> response = getJson(
        "/v1/countries/Europe/indicators/interest-rate/metrics?years=5");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    verify(svc).metricsFor("Europe", IndicatorType.INTEREST_RATE, 5);
  }

  @Test
  void unknownIndicatorIsRejectedWithErrorCode() {
    ResponseEntity<Map<String, Object>> response = getJson(
        "/v1/countries/US/indicators/gold/metrics");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    Map<String, Object> body = requireNonNull(response.getBody());
    assertThat(body).containsEntry("errorCode", 2001)
        .containsEntry("moreInfo", "https://developers.company.com/docs/errors/2001")
        .containsEntry("path", "/v1/countries/US/indicators/gold/metrics");
    verifyNoInteractions(svc);
  }

  @Test
  void yearsOutOfRangeIsRejectedWithErrorCode() {
    ResponseEntity<Map<String, Object>> response = getJson("/v1/countries/US/metrics?years=11");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(requireNonNull(response.getBody())).containsEntry("errorCode", 2002);
  }

  @Test
  void nonNumericYearsIsProblemDetail() {
    ResponseEntity<Map<String, Object>> response = getJson("/v1/countries/US/metrics?years=abc");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(requireNonNull(response.getHeaders().getContentType()).toString())
        .contains("application/problem+json");
  }

  @Test
  void unknownCountryIsNotFoundProblem() {
    when(svc.metricsForCountry("Mars", 3))
        .thenThrow(new NoSuchElementException("Country not found: Mars"));

    ResponseEntity<Map<String, Object>> response = getJson("/v1/countries/Mars/metrics");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(requireNonNull(response.getHeaders().getContentType()).toString())
        .contains("application/problem+json");
    Map<String, Object> body = requireNonNull(response.getBody());
    assertThat(body).containsKeys("type", "title", "status", "detail", "instance");
    assertThat(body.get("detail")).isEqualTo("Country not found: Mars");
  }

  @Test
  void comparisonSplitsCountryList() {
    when(svc.compare(IndicatorType.CPI, List.of("US", "India"), 3)).thenReturn(List.of(usCpi()));

    ResponseEntity<List<Map<String, Object>>> response = rest.exchange(
        "/v1/indicators/cpi/comparison?countries=US, India,US",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(requireNonNull(response.getBody())).hasSize(1);
    verify(svc).compare(IndicatorType.CPI, List.of("US", "India"), 3);
  }

  @Test
  void comparisonWithoutCountriesAsksForAll() {
    when(svc.compare(IndicatorType.GDP_GROWTH, List.of(), 2)).thenReturn(List.of());

    ResponseEntity<List> response = rest.getForEntity(
        "/v1/indicators/GDP_GROWTH/comparison?years=2", List.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    verify(svc).compare(IndicatorType.GDP_GROWTH, List.of(), 2);
  }

  private ResponseEntity<Map<String, Object>> getJson(String url) {
    return rest.exchange(url, HttpMethod.GET, null, new ParameterizedTypeReference<>() {});
  }
}
