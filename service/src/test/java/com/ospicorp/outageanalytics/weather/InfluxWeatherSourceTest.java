package com.ospicorp.outageanalytics.weather;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ospicorp.outageanalytics.config.OutageProperties;
import com.ospicorp.outageanalytics.store.FluxRecord;
import com.ospicorp.outageanalytics.store.InfluxStoreClient;
import com.ospicorp.outageanalytics.store.StoreException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class InfluxWeatherSourceTest {

  private static final Instant START = Instant.parse("2024-01-10T05:00:00Z");
  private static final Instant STOP = Instant.parse("2024-01-10T13:00:00Z");

  private final InfluxStoreClient client = mock(InfluxStoreClient.class);
  private final OutageProperties properties = new OutageProperties();

  @Test
  void queriesHourlyMeansOfConfiguredFieldsForSite() {
    InfluxWeatherSource source = new InfluxWeatherSource(client, properties,
        new WeatherFields("windspeed", "", "relative_humidity"));
    when(client.query(anyString())).thenReturn(List.of(
        new FluxRecord(Map.of("_time", "2024-01-10T12:00:00Z", "_field", "windspeed",
            "_value", "42.5")),
        new FluxRecord(Map.of("_time", "2024-01-10T12:00:00Z", "_field", "windspeed",
            "_value", ""))));

    List<WeatherSample> samples = source.fetch("san_luis \"aero\"", START, STOP);

    assertThat(samples).containsExactly(
        new WeatherSample(Instant.parse("2024-01-10T12:00:00Z"), "windspeed", 42.5));
    ArgumentCaptor<String> flux = ArgumentCaptor.forClass(String.class);
    verify(client).query(flux.capture());
    assertThat(flux.getValue())
        .contains("from(bucket: \"weather\")")
        .contains("|> range(start: 2024-01-10T05:00:00Z, stop: 2024-01-10T13:00:00Z)")
        .contains("r._measurement == \"weather_hourly\"")
        .contains("r[\"site_tag\"] == \"san_luis \\\"aero\\\"\"")
        .contains("r._field == \"windspeed\" or r._field == \"relative_humidity\"")
        .contains("aggregateWindow(every: 1h, fn: mean, createEmpty: false)")
        .contains("keep(columns: [\"_time\", \"_field\", \"_value\"])")
        .doesNotContain("temperature");
  }

  @Test
  void noConfiguredFieldsMeansNoQuery() {
    InfluxWeatherSource source =
        new InfluxWeatherSource(client, properties, new WeatherFields(null, " ", ""));

    assertThat(source.fetch("site", START, STOP)).isEmpty();
    verifyNoInteractions(client);
  }

  @Test
  void storeFailureYieldsNoSamples() {
    InfluxWeatherSource source = new InfluxWeatherSource(client, properties,
        new WeatherFields("windspeed", "temperature", "relative_humidity"));
    when(client.query(anyString())).thenThrow(new StoreException("timeout"));

    assertThat(source.fetch("site", START, STOP)).isEmpty();
  }
}
