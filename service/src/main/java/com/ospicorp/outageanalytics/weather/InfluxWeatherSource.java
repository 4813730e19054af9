package com.ospicorp.outageanalytics.weather;

import com.ospicorp.outageanalytics.config.OutageProperties;
import com.ospicorp.outageanalytics.incident.query.QueryBuilder;
import com.ospicorp.outageanalytics.store.FluxRecord;
import com.ospicorp.outageanalytics.store.InfluxStoreClient;
import com.ospicorp.outageanalytics.store.StoreException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Reads hourly means of the configured weather fields from the weather bucket. */
@Component
public class InfluxWeatherSource implements WeatherSampleSource {
  private static final Logger log = LoggerFactory.getLogger(InfluxWeatherSource.class);

  private final InfluxStoreClient client;
  private final OutageProperties.Weather settings;
  private final WeatherFields fields;

  public InfluxWeatherSource(@Qualifier("weatherStoreClient") InfluxStoreClient client,
      OutageProperties properties, WeatherFields fields) {
    this.client = client;
    this.settings = properties.getWeather();
    this.fields = fields;
  }

  @Override
  public List<WeatherSample> fetch(String siteTag, Instant start, Instant stop) {
    List<String> requested = fields.enabled();
    if (requested.isEmpty()) {
      return List.of();
    }
    String flux = flux(siteTag, start, stop, requested);
    List<FluxRecord> records;
    try {
      records = client.query(flux);
    } catch (StoreException e) {
      log.error("Weather query for site {} failed, returning no samples: {}", siteTag,
          e.getMessage(), e);
      return List.of();
    }

    List<WeatherSample> samples = new ArrayList<>(records.size());
    for (FluxRecord record : records) {
      Instant time = record.getTime();
      Double value = record.getDouble("_value");
      String field = record.getString("_field");
      if (time != null && value != null && !field.isEmpty()) {
        samples.add(new WeatherSample(time, field, value));
      }
    }
    return samples;
  }

  String flux(String siteTag, Instant start, Instant stop, List<String> requested) {
    String fieldPredicate = requested.stream()
        .map(f -> "r._field == \"" + QueryBuilder.escape(f) + "\"")
        .collect(Collectors.joining(" or "));
    return String.join("\n  ",
        "from(bucket: \"" + QueryBuilder.escape(settings.getBucket()) + "\")",
        "|> range(start: " + InfluxStoreClient.rfc3339(start) + ", stop: "
            + InfluxStoreClient.rfc3339(stop) + ")",
        "|> filter(fn: (r) => r._measurement == \""
            + QueryBuilder.escape(settings.getMeasurement()) + "\")",
        "|> filter(fn: (r) => r[\"" + QueryBuilder.escape(settings.getSiteTagKey()) + "\"] == \""
            + QueryBuilder.escape(siteTag) + "\")",
        "|> filter(fn: (r) => " + fieldPredicate + ")",
        "|> aggregateWindow(every: 1h, fn: mean, createEmpty: false)",
        "|> keep(columns: [\"_time\", \"_field\", \"_value\"])");
  }
}
