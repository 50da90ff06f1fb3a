package com.ospicorp.indicatormetrics.indicator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.indicatormetrics.indicator.model.DataPoint;
import com.ospicorp.indicatormetrics.indicator.model.DateRange;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorDescriptor;
import com.ospicorp.indicatormetrics.indicator.model.ProviderKind;
import com.ospicorp.indicatormetrics.indicator.model.RawFetchResult;
import com.ospicorp.indicatormetrics.indicator.model.SeriesObservations;
import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * FRED series-observations adapter. Observations arrive oldest first; FRED marks a missing
 * observation with {@code "."}, which is dropped here so the series stays dense.
 */
@Service
public class FredSeriesProvider implements IndicatorProvider {
  private static final Logger log = LoggerFactory.getLogger(FredSeriesProvider.class);
  private static final String MISSING_VALUE = ".";

  private final RestTemplate restTemplate;
  private final String baseUrl;
  private final String apiKey;

  public FredSeriesProvider(RestTemplate restTemplate,
      @Value("${providers.fred.url:https://api.stlouisfed.org/fred}") String baseUrl,
      @Value("${providers.fred.api-key:}") String apiKey) {
    this.restTemplate = restTemplate;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.apiKey = apiKey;
    if (!StringUtils.hasText(apiKey)) {
      log.warn("providers.fred.api-key is not set; series-api indicators will report no data");
    }
  }

  @Override
  public ProviderKind kind() {
    return ProviderKind.SERIES_API;
  }

  @Override
  public RawFetchResult fetch(IndicatorDescriptor descriptor, DateRange range) {
    if (!StringUtils.hasText(apiKey)) {
      return SeriesObservations.EMPTY;
    }
    String seriesId = descriptor.seriesId();
    URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl + "/series/observations")
        .queryParam("series_id", seriesId)
        .queryParam("api_key", apiKey)
        .queryParam("file_type", "json")
        .queryParam("observation_start", range.start())
        .queryParam("observation_end", range.end())
        .build()
        .encode()
        .toUri();
    try {
      HttpHeaders headers = new HttpHeaders();
      headers.setAccept(List.of(MediaType.APPLICATION_JSON));
      ResponseEntity<JsonNode> response = restTemplate.exchange(uri, HttpMethod.GET,
          new HttpEntity<>(headers), JsonNode.class);
      if (response.getStatusCode().value() != 200) {
        log.warn("FRED returned status {} for {}", response.getStatusCode().value(), seriesId);
        return SeriesObservations.EMPTY;
      }
      SeriesObservations observations = parse(response.getBody());
      log.debug("FRED returned {} observations for {}", observations.observations().size(),
          seriesId);
      return observations;
    } catch (RestClientException | MalformedPayloadException ex) {
      log.warn("Error fetching FRED series {}: {}", seriesId, ex.getMessage());
      return SeriesObservations.EMPTY;
    }
  }

  private SeriesObservations parse(JsonNode body) {
    if (body == null || !body.path("observations").isArray()) {
      throw new MalformedPayloadException("missing observations array");
    }
    List<DataPoint> points = new ArrayList<>();
    for (JsonNode observation : body.path("observations")) {
      String date = observation.path("date").asText(null);
      String value = observation.path("value").asText(null);
      if (date == null || value == null) {
        throw new MalformedPayloadException("observation without date or value");
      }
      if (MISSING_VALUE.equals(value)) {
        continue;
      }
      try {
        double parsed = Double.parseDouble(value);
        if (Double.isFinite(parsed)) {
          points.add(new DataPoint(LocalDate.parse(date), parsed));
        }
      } catch (NumberFormatException | DateTimeParseException ex) {
        throw new MalformedPayloadException("unparseable observation " + date + "=" + value);
      }
    }
    return new SeriesObservations(points);
  }
}
