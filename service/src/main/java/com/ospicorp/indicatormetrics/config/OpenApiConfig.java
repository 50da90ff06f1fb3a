package com.ospicorp.indicatormetrics.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Indicator Metrics API")
            .version("v1")
            .description("CPI, PPI, policy rates, unemployment and GDP growth with MoM/YoY "
                + "comparisons across countries")
            .contact(new Contact().name("Economic Data Team").email("api-support@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .externalDocs(new ExternalDocumentation()
            .description("Data sources")
            .url("https://fred.stlouisfed.org/docs/api/fred/"));
  }
}
