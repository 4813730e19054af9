package com.ospicorp.outageanalytics.config;

import com.ospicorp.outageanalytics.store.InfluxStoreClient;
import com.ospicorp.outageanalytics.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Makes sure the incident bucket exists. Runs at startup and again after a purge; an
 * unreachable store is reported but never stops the application.
 */
@Component
public class StoreBootstrap implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(StoreBootstrap.class);

  private final InfluxStoreClient client;
  private final OutageProperties properties;

  public StoreBootstrap(@Qualifier("incidentStoreClient") InfluxStoreClient client,
      OutageProperties properties) {
    this.client = client;
    this.properties = properties;
  }

  @Override
  public void run(String... args) {
    if (!properties.getStore().isBootstrapEnabled()) {
      log.info("Bucket bootstrap disabled via property outage.store.bootstrap-enabled=false");
      return;
    }
    try {
      ensureBucket();
    } catch (StoreException e) {
      log.warn("Unable to verify bucket {}: {}", properties.getStore().getBucket(), e.getMessage());
    }
  }

  public void ensureBucket() {
    String bucket = properties.getStore().getBucket();
    if (client.bucketExists(bucket)) {
      log.info("Bucket '{}' already exists", bucket);
      return;
    }
    log.info("Bucket '{}' not found; creating it", bucket);
    client.createBucket(bucket);
  }
}
