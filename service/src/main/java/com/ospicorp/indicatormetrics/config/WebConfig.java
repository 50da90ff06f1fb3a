package com.ospicorp.indicatormetrics.config;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class WebConfig {

  /** Shared upstream client; every provider call is bounded by these timeouts. */
  @Bean
  RestTemplate restTemplate(RestTemplateBuilder builder,
      @Value("${providers.http.connect-timeout:PT5S}") Duration connectTimeout,
      @Value("${providers.http.read-timeout:PT10S}") Duration readTimeout) {
    return builder
        .setConnectTimeout(connectTimeout)
        .setReadTimeout(readTimeout)
        .build();
  }
}
