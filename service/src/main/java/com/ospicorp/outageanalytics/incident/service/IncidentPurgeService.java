package com.ospicorp.outageanalytics.incident.service;

import com.ospicorp.outageanalytics.config.OutageProperties;
import com.ospicorp.outageanalytics.config.StoreBootstrap;
import com.ospicorp.outageanalytics.incident.query.QueryBuilder;
import com.ospicorp.outageanalytics.store.InfluxStoreClient;
import com.ospicorp.outageanalytics.store.StoreException;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Deletes every stored incident and recreates the bucket. Runs on the async executor; the
 * outcome is only logged. Reads issued while the purge runs may still see old rows.
 */
@Service
public class IncidentPurgeService {
  private static final Logger log = LoggerFactory.getLogger(IncidentPurgeService.class);
  static final Instant EPOCH = Instant.parse("1970-01-01T00:00:00Z");

  private final InfluxStoreClient client;
  private final StoreBootstrap bootstrap;
  private final OutageProperties properties;
  private final Clock clock;

  public IncidentPurgeService(@Qualifier("incidentStoreClient") InfluxStoreClient client,
      StoreBootstrap bootstrap, OutageProperties properties, Clock clock) {
    this.client = client;
    this.bootstrap = bootstrap;
    this.properties = properties;
    this.clock = clock;
  }

  @Async
  public CompletableFuture<Void> purgeAllAsync() {
    String bucket = properties.getStore().getBucket();
    log.info("Purging all '{}' points from bucket '{}'", QueryBuilder.MEASUREMENT, bucket);
    try {
      client.delete(bucket, EPOCH, clock.instant(),
          "_measurement=\"" + QueryBuilder.MEASUREMENT + "\"");
      bootstrap.ensureBucket();
      log.info("Purge of bucket '{}' completed", bucket);
    } catch (StoreException e) {
      log.error("Purge of bucket '{}' failed: {}", bucket, e.getMessage(), e);
    } catch (RuntimeException e) {
      log.error("Purge of bucket '{}' aborted unexpectedly", bucket, e);
    }
    return CompletableFuture.completedFuture(null);
  }
}
