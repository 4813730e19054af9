package com.ospicorp.outageanalytics.weather;

import com.ospicorp.outageanalytics.incident.model.Incident;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Predicate;
import java.util.stream.DoubleStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins incidents with the hourly weather of their district's site. Samples are fetched once
 * per district over a window covering all of its incidents plus the six hours before the
 * earliest start.
 */
public class WeatherCorrelator {
  private static final Logger log = LoggerFactory.getLogger(WeatherCorrelator.class);

  static final Duration PRE_EVENT_WINDOW = Duration.ofHours(6);
  private static final int MAX_EXAMPLES = 3;

  private final WeatherSampleSource source;
  private final WeatherFields fields;

  public WeatherCorrelator(WeatherSampleSource source, WeatherFields fields) {
    this.source = source;
    this.fields = fields;
  }

  /**
   * Returns one entry per incident, in input order.
   *
   * @throws CorrelationValidationException if any incident lacks district, start or end
   */
  public List<CorrelatedIncident> correlate(List<Incident> incidents, DistrictTagTable tags) {
    validate(incidents);

    Map<String, List<Integer>> byDistrict = new LinkedHashMap<>();
    for (int i = 0; i < incidents.size(); i++) {
      byDistrict.computeIfAbsent(incidents.get(i).district(), d -> new ArrayList<>()).add(i);
    }

    CorrelatedIncident[] results = new CorrelatedIncident[incidents.size()];
    byDistrict.forEach((district, indexes) -> {
      Optional<String> tag = tags.tagFor(district);
      if (tag.isEmpty()) {
        log.debug("No weather tag for district {}, {} incidents left uncorrelated", district,
            indexes.size());
        for (int index : indexes) {
          results[index] = new CorrelatedIncident(incidents.get(index), WeatherMetrics.EMPTY,
              WeatherStatus.NO_TAG);
        }
        return;
      }

      Instant from = null;
      Instant to = null;
      for (int index : indexes) {
        Incident incident = incidents.get(index);
        Instant start = incident.start().toInstant().minus(PRE_EVENT_WINDOW);
        Instant end = incident.end().toInstant();
        from = from == null || start.isBefore(from) ? start : from;
        to = to == null || end.isAfter(to) ? end : to;
      }

      List<WeatherSample> samples = source.fetch(tag.get(), from, to);
      log.debug("District {} (site {}): {} weather samples between {} and {}", district,
          tag.get(), samples.size(), from, to);
      WeatherStatus status = samples.isEmpty() ? WeatherStatus.NO_DATA : WeatherStatus.OK;
      for (int index : indexes) {
        Incident incident = incidents.get(index);
        results[index] = new CorrelatedIncident(incident, metricsFor(incident, samples), status);
      }
    });
    return List.of(results);
  }

  WeatherMetrics metricsFor(Incident incident, List<WeatherSample> samples) {
    if (samples.isEmpty()) {
      return WeatherMetrics.EMPTY;
    }
    Instant start = incident.start().toInstant();
    Instant end = incident.end().toInstant();
    Predicate<Instant> during = t -> !t.isBefore(start) && !t.isAfter(end);
    Instant preStart = start.minus(PRE_EVENT_WINDOW);
    Predicate<Instant> before = t -> !t.isBefore(preStart) && t.isBefore(start);

    return new WeatherMetrics(
        max(samples, fields.wind(), during),
        mean(samples, fields.wind(), during),
        mean(samples, fields.temperature(), during),
        mean(samples, fields.humidity(), during),
        mean(samples, fields.humidity(), before));
  }

  private static Double mean(List<WeatherSample> samples, String field, Predicate<Instant> window) {
    return boxed(values(samples, field, window).average());
  }

  private static Double max(List<WeatherSample> samples, String field, Predicate<Instant> window) {
    return boxed(values(samples, field, window).max());
  }

  private static DoubleStream values(List<WeatherSample> samples, String field,
      Predicate<Instant> window) {
    if (field == null) {
      return DoubleStream.empty();
    }
    return samples.stream()
        .filter(s -> field.equals(s.field()) && window.test(s.time()))
        .mapToDouble(WeatherSample::value);
  }

  private static Double boxed(OptionalDouble value) {
    return value.isPresent() ? value.getAsDouble() : null;
  }

  private static void validate(List<Incident> incidents) {
    List<String> missingFields = new ArrayList<>();
    List<Map<String, Object>> examples = new ArrayList<>();
    for (int i = 0; i < incidents.size(); i++) {
      Incident incident = incidents.get(i);
      List<String> missing = new ArrayList<>();
      if (incident.district() == null || incident.district().isBlank()) {
        missing.add("district");
      }
      if (incident.start() == null) {
        missing.add("start");
      }
      if (incident.end() == null) {
        missing.add("end");
      }
      if (missing.isEmpty()) {
        continue;
      }
      for (String field : missing) {
        if (!missingFields.contains(field)) {
          missingFields.add(field);
        }
      }
      if (examples.size() < MAX_EXAMPLES) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("district", incident.district());
        record.put("start", incident.start());
        record.put("end", incident.end());
        Map<String, Object> example = new LinkedHashMap<>();
        example.put("index", i);
        example.put("missing", missing);
        example.put("example", record);
        examples.add(example);
      }
    }
    if (!missingFields.isEmpty()) {
      throw new CorrelationValidationException(missingFields, examples);
    }
  }
}
