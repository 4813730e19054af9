package com.ospicorp.outageanalytics.store;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("incidentStore")
public class StoreHealthIndicator implements HealthIndicator {
  private final InfluxStoreClient client;

  public StoreHealthIndicator(@Qualifier("incidentStoreClient") InfluxStoreClient client) {
    this.client = client;
  }

  @Override
  public Health health() {
    try {
      String status = client.health();
      Health.Builder builder = "pass".equalsIgnoreCase(status) ? Health.up() : Health.down();
      return builder.withDetail("status", status).build();
    } catch (StoreException e) {
      return Health.down(e).build();
    }
  }
}
