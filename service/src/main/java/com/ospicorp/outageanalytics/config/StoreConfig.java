package com.ospicorp.outageanalytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.outageanalytics.incident.query.QueryBuilder;
import com.ospicorp.outageanalytics.store.InfluxStoreClient;
import com.ospicorp.outageanalytics.time.TimeNormalizer;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

@Configuration
public class StoreConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  /** Shared by both store clients; a store that stops answering must not block a request forever. */
  @Bean
  RestTemplate storeRestTemplate(RestTemplateBuilder builder, OutageProperties properties) {
    return builder
        .setConnectTimeout(properties.getStore().getConnectTimeout())
        .setReadTimeout(properties.getStore().getReadTimeout())
        .build();
  }

  @Bean
  TimeNormalizer timeNormalizer(OutageProperties properties) {
    return new TimeNormalizer(ZoneId.of(properties.getZone()));
  }

  @Bean
  QueryBuilder queryBuilder(OutageProperties properties, TimeNormalizer timeNormalizer) {
    return new QueryBuilder(properties.getStore().getBucket(), timeNormalizer);
  }

  @Bean
  @Primary
  InfluxStoreClient incidentStoreClient(RestTemplate storeRestTemplate, ObjectMapper mapper,
      OutageProperties properties) {
    OutageProperties.Store store = properties.getStore();
    return new InfluxStoreClient(storeRestTemplate, mapper, store.getUrl(), store.getToken(),
        store.getOrg());
  }

  @Bean
  InfluxStoreClient weatherStoreClient(RestTemplate storeRestTemplate, ObjectMapper mapper,
      OutageProperties properties) {
    OutageProperties.Store store = properties.getStore();
    OutageProperties.Weather weather = properties.getWeather();
    return new InfluxStoreClient(storeRestTemplate, mapper, weather.resolveUrl(store),
        weather.resolveToken(store), weather.resolveOrg(store));
  }
}
