package com.ospicorp.outageanalytics.incident.repository;

import static com.ospicorp.outageanalytics.incident.query.QueryBuilder.*;

import com.ospicorp.outageanalytics.incident.model.Incident;
import com.ospicorp.outageanalytics.incident.model.VoltageLevel;
import com.ospicorp.outageanalytics.incident.query.QueryBuilder;
import com.ospicorp.outageanalytics.incident.query.QuerySpec;
import com.ospicorp.outageanalytics.store.FluxRecord;
import com.ospicorp.outageanalytics.store.InfluxStoreClient;
import com.ospicorp.outageanalytics.store.StoreException;
import com.ospicorp.outageanalytics.time.TimeNormalizer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Reads incidents and filter options from the store. Store failures are logged and turned
 * into empty results so that a missing store never breaks the calling request.
 */
@Repository
public class IncidentRepository {
  private static final Logger log = LoggerFactory.getLogger(IncidentRepository.class);

  private final InfluxStoreClient client;
  private final QueryBuilder queryBuilder;
  private final TimeNormalizer timeNormalizer;

  public IncidentRepository(@Qualifier("incidentStoreClient") InfluxStoreClient client,
      QueryBuilder queryBuilder, TimeNormalizer timeNormalizer) {
    this.client = client;
    this.queryBuilder = queryBuilder;
    this.timeNormalizer = timeNormalizer;
  }

  public List<Incident> fetch(QuerySpec spec) {
    List<Incident> incidents = new ArrayList<>();
    for (FluxRecord record : run("incident query", spec)) {
      incidents.add(toIncident(record));
    }
    return incidents;
  }

  public List<String> listDistricts() {
    return distinctStrings("district lookup", queryBuilder.districtsQuery());
  }

  public List<String> listCauses() {
    return distinctStrings("cause lookup", queryBuilder.causesQuery());
  }

  public List<LocalDate> listAvailableDates() {
    TreeSet<LocalDate> dates = new TreeSet<>();
    for (FluxRecord record : run("date lookup", queryBuilder.datesQuery())) {
      Instant time = record.getTime();
      if (time != null) {
        dates.add(timeNormalizer.toLocal(time).toLocalDate());
      }
    }
    return new ArrayList<>(dates);
  }

  private List<String> distinctStrings(String operation, QuerySpec spec) {
    TreeSet<String> values = new TreeSet<>();
    for (FluxRecord record : run(operation, spec)) {
      String value = record.getString("_value");
      if (!value.isBlank()) {
        values.add(value);
      }
    }
    return new ArrayList<>(values);
  }

  private List<FluxRecord> run(String operation, QuerySpec spec) {
    try {
      return client.query(spec.flux());
    } catch (StoreException e) {
      log.error("Store {} failed, returning no rows: {}", operation, e.getMessage(), e);
      return List.of();
    }
  }

  private Incident toIncident(FluxRecord record) {
    Instant startTime = record.getTime();
    if (startTime == null) {
      // unreadable stored dates fall back to the sentinel and sort last
      startTime = timeNormalizer.parseFlexibleDateTime(
          record.getString(FIELD_START_DATE), record.getString(FIELD_START_TIME));
      log.warn("Incident row without timestamp, start taken from stored fields: {}", record);
    }
    ZonedDateTime start = timeNormalizer.toLocal(startTime);
    ZonedDateTime end = timeNormalizer
        .parseLocalDateTime(record.getString(FIELD_END_DATE), record.getString(FIELD_END_TIME))
        .map(timeNormalizer::toLocal)
        .orElse(null);

    return new Incident(
        numberOf(record),
        start,
        end,
        blankToNull(record.getString(TAG_DISTRICT)),
        VoltageLevel.fromTag(record.getString(TAG_VOLTAGE)),
        record.getString(FIELD_CAUSE),
        record.getString(FIELD_LOCALITY),
        record.getString(FIELD_DISTRIBUTOR),
        record.getString(FIELD_INSTALLATION),
        record.getLong(FIELD_SUBSTATIONS, 0),
        record.getLong(FIELD_CUSTOMERS, 0),
        Objects.requireNonNullElse(record.getDouble(FIELD_POWER), 0d),
        record.getLong(FIELD_COMPLAINTS, 0));
  }

  private static String numberOf(FluxRecord record) {
    String raw = record.getString(FIELD_NUMBER).trim();
    return raw.endsWith(".0") ? raw.substring(0, raw.length() - 2) : raw;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
