package com.ospicorp.outageanalytics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
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
            .title("Outage Analytics API")
            .version("v1")
            .description("Incident filtering, dashboards and weather correlation for the "
                + "distribution network")
            .contact(new Contact().name("Grid Operations Analytics").email("grid-analytics@example.com")))
        .servers(List.of(new Server().url("/")));
  }
}
