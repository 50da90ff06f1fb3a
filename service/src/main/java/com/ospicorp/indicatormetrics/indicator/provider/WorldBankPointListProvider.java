package com.ospicorp.indicatormetrics.indicator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.indicatormetrics.indicator.model.DateRange;
import com.ospicorp.indicatormetrics.indicator.model.IndicatorDescriptor;
import com.ospicorp.indicatormetrics.indicator.model.PointListRecord;
import com.ospicorp.indicatormetrics.indicator.model.PointListRecords;
import com.ospicorp.indicatormetrics.indicator.model.ProviderKind;
import com.ospicorp.indicatormetrics.indicator.model.RawFetchResult;
import java.net.URI;
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
 * World Bank indicator adapter. The API answers {@code [metadata, records]}; only the records
 * element is used, and only when it is a non-empty array. Error payloads also come back as 200
 * with a single message element, so they end up as "no data" too.
 */
@Service
public class WorldBankPointListProvider implements IndicatorProvider {
  private static final Logger log = LoggerFactory.getLogger(WorldBankPointListProvider.class);

  private final RestTemplate restTemplate;
  private final String baseUrl;
  private final int perPage;
  private final String dateWindow;

  public WorldBankPointListProvider(RestTemplate restTemplate,
      @Value("${providers.world-bank.url:https://api.worldbank.org/v2}") String baseUrl,
      @Value("${providers.world-bank.per-page:50}") int perPage,
      @Value("${providers.world-bank.date-window:}") String dateWindow) {
    if (perPage < 1) {
      throw new IllegalArgumentException("providers.world-bank.per-page must be positive");
    }
    this.restTemplate = restTemplate;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.perPage = perPage;
    this.dateWindow = dateWindow;
  }

  @Override
  public ProviderKind kind() {
    return ProviderKind.POINT_LIST_API;
  }

  @Override
  public RawFetchResult fetch(IndicatorDescriptor descriptor, DateRange range) {
    String country = descriptor.providerCountry();
    String indicator = descriptor.seriesId();
    URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
        .pathSegment("country", country, "indicator", indicator)
        .queryParam("format", "json")
        .queryParam("per_page", perPage)
        .queryParam("date", requestWindow(range))
        .build()
        .encode()
        .toUri();
    try {
      HttpHeaders headers = new HttpHeaders();
      headers.setAccept(List.of(MediaType.APPLICATION_JSON));
      ResponseEntity<JsonNode> response = restTemplate.exchange(uri, HttpMethod.GET,
          new HttpEntity<>(headers), JsonNode.class);
      if (response.getStatusCode().value() != 200) {
        log.warn("World Bank returned status {} for {}/{}", response.getStatusCode().value(),
            country, indicator);
        return PointListRecords.EMPTY;
      }
      PointListRecords records = parse(response.getBody());
      log.debug("World Bank returned {} records for {}/{}", records.records().size(), country,
          indicator);
      return records;
    } catch (RestClientException | MalformedPayloadException ex) {
      log.warn("World Bank API error for {}/{}: {}", country, indicator, ex.getMessage());
      return PointListRecords.EMPTY;
    }
  }

  /** The configured window when set, otherwise the years the range touches. */
  @Override
  public String requestWindow(DateRange range) {
    if (StringUtils.hasText(dateWindow)) {
      return dateWindow;
    }
    return range.start().getYear() + ":" + range.end().getYear();
  }

  private PointListRecords parse(JsonNode body) {
    if (body == null || !body.isArray() || body.size() < 2) {
      return PointListRecords.EMPTY;
    }
    JsonNode data = body.get(1);
    if (data == null || !data.isArray() || data.isEmpty()) {
      return PointListRecords.EMPTY;
    }
    List<PointListRecord> records = new ArrayList<>(data.size());
    for (JsonNode item : data) {
      String date = item.path("date").asText(null);
      if (!StringUtils.hasText(date)) {
        throw new MalformedPayloadException("record without date");
      }
      records.add(new PointListRecord(date, value(item.path("value"))));
    }
    return new PointListRecords(records);
  }

  private static Double value(JsonNode node) {
    if (node.isMissingNode() || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.asDouble();
    }
    if (node.isTextual()) {
      try {
        return Double.valueOf(node.asText());
      } catch (NumberFormatException ex) {
        throw new MalformedPayloadException("non-numeric value " + node.asText());
      }
    }
    throw new MalformedPayloadException("unexpected value node " + node.getNodeType());
  }
}
