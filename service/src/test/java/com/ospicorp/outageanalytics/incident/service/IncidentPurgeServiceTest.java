package com.ospicorp.outageanalytics.incident.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.ospicorp.outageanalytics.config.OutageProperties;
import com.ospicorp.outageanalytics.config.StoreBootstrap;
import com.ospicorp.outageanalytics.store.InfluxStoreClient;
import com.ospicorp.outageanalytics.store.StoreException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class IncidentPurgeServiceTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private InfluxStoreClient client;
  private StoreBootstrap bootstrap;
  private IncidentPurgeService service;

  @BeforeEach
  void setUp() {
    client = mock(InfluxStoreClient.class);
    bootstrap = mock(StoreBootstrap.class);
    service = new IncidentPurgeService(client, bootstrap, new OutageProperties(),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void deletesAllIncidentsThenRecreatesBucket() {
    assertThat(service.purgeAllAsync()).isCompleted();

    InOrder order = inOrder(client, bootstrap);
    order.verify(client).delete("incidencias", Instant.parse("1970-01-01T00:00:00Z"), NOW,
        "_measurement=\"incidencia_electrica\"");
    order.verify(bootstrap).ensureBucket();
  }

  @Test
  void failureIsLoggedNotPropagated() {
    doThrow(new StoreException("unreachable"))
        .when(client).delete(anyString(), any(), any(), eq("_measurement=\"incidencia_electrica\""));

    assertThat(service.purgeAllAsync()).isCompleted();
    verify(bootstrap, never()).ensureBucket();
  }

  @Test
  void unexpectedFailureStillCompletesTheFuture() {
    doThrow(new IllegalStateException("bucket id missing")).when(bootstrap).ensureBucket();

    assertThat(service.purgeAllAsync()).isCompleted().isNotCompletedExceptionally();
  }
}
