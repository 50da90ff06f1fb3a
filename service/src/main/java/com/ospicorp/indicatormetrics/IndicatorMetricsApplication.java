package com.ospicorp.indicatormetrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IndicatorMetricsApplication {

  public static void main(String[] args) {
    SpringApplication.run(IndicatorMetricsApplication.class, args);
  }
}
