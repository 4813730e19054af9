package com.ospicorp.outageanalytics.incident.query;

import com.ospicorp.outageanalytics.incident.model.FilterCriteria;
import com.ospicorp.outageanalytics.time.TimeNormalizer;
import com.ospicorp.outageanalytics.time.UtcRange;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the Flux scripts used to read incidents. Tag filters are applied before the pivot so
 * the store can use its index; field filters have to wait until fields are columns.
 */
public class QueryBuilder {
  public static final String MEASUREMENT = "incidencia_electrica";
  public static final String DEFAULT_LOOKBACK = "-5y";

  public static final String TAG_DISTRICT = "distrito";
  public static final String TAG_VOLTAGE = "nivel_tension";
  public static final String FIELD_NUMBER = "nro_incidencia";
  public static final String FIELD_CAUSE = "descripcion_de_la_causa";
  public static final String FIELD_START_DATE = "fecha_inicio_fecha";
  public static final String FIELD_START_TIME = "hora_inicio";
  public static final String FIELD_END_DATE = "fecha_fin_fecha";
  public static final String FIELD_END_TIME = "hora_fin";
  public static final String FIELD_LOCALITY = "localidad";
  public static final String FIELD_DISTRIBUTOR = "distribuidor";
  public static final String FIELD_INSTALLATION = "instalacion";
  public static final String FIELD_SUBSTATIONS = "ct_involucrados";
  public static final String FIELD_CUSTOMERS = "nises_involucrados";
  public static final String FIELD_POWER = "potencia_involucrada";
  public static final String FIELD_COMPLAINTS = "cantidad_de_reclamos";

  private final String bucket;
  private final TimeNormalizer timeNormalizer;

  public QueryBuilder(String bucket, TimeNormalizer timeNormalizer) {
    this.bucket = Objects.requireNonNull(bucket, "bucket");
    this.timeNormalizer = Objects.requireNonNull(timeNormalizer, "timeNormalizer");
  }

  public QuerySpec build(FilterCriteria criteria) {
    List<String> parts = new ArrayList<>();
    parts.add("from(bucket: \"" + escape(bucket) + "\")");

    Instant start = null;
    Instant stop = null;
    if (criteria.hasDateRange()) {
      UtcRange range = timeNormalizer.toUtcRangeExclusive(criteria.startDate(), criteria.endDate());
      start = range.start();
      stop = range.end();
      parts.add("|> range(start: " + literal(start) + ", stop: " + literal(stop) + ")");
    } else {
      parts.add("|> range(start: " + DEFAULT_LOOKBACK + ")");
    }
    parts.add("|> filter(fn: (r) => r._measurement == \"" + MEASUREMENT + "\")");

    if (criteria.district() != null) {
      parts.add(equalsFilter(TAG_DISTRICT, criteria.district()));
    }
    if (criteria.voltage() != null) {
      parts.add(equalsFilter(TAG_VOLTAGE, criteria.voltage().name()));
    }
    parts.add("|> pivot(rowKey: [\"_time\"], columnKey: [\"_field\"], valueColumn: \"_value\")");
    if (criteria.cause() != null) {
      parts.add(equalsFilter(FIELD_CAUSE, criteria.cause()));
    }
    parts.add("|> group()");
    parts.add("|> sort(columns: [\"_time\"], desc: true)");

    return new QuerySpec(String.join("\n  ", parts), start, stop);
  }

  public QuerySpec districtsQuery() {
    String flux = "import \"influxdata/influxdb/schema\"\n"
        + "schema.tagValues(bucket: \"" + escape(bucket) + "\", tag: \"" + TAG_DISTRICT + "\", "
        + "predicate: (r) => r._measurement == \"" + MEASUREMENT + "\", "
        + "start: " + DEFAULT_LOOKBACK + ")";
    return new QuerySpec(flux, null, null);
  }

  public QuerySpec causesQuery() {
    return distinctFieldQuery(FIELD_CAUSE);
  }

  /** One row per stored incident, carrying only its timestamp. */
  public QuerySpec datesQuery() {
    String flux = String.join("\n  ",
        "from(bucket: \"" + escape(bucket) + "\")",
        "|> range(start: " + DEFAULT_LOOKBACK + ")",
        "|> filter(fn: (r) => r._measurement == \"" + MEASUREMENT + "\" and r._field == \""
            + FIELD_NUMBER + "\")",
        "|> keep(columns: [\"_time\"])");
    return new QuerySpec(flux, null, null);
  }

  private QuerySpec distinctFieldQuery(String field) {
    String flux = String.join("\n  ",
        "from(bucket: \"" + escape(bucket) + "\")",
        "|> range(start: " + DEFAULT_LOOKBACK + ")",
        "|> filter(fn: (r) => r._measurement == \"" + MEASUREMENT + "\" and r._field == \""
            + field + "\")",
        "|> group()",
        "|> distinct(column: \"_value\")",
        "|> keep(columns: [\"_value\"])");
    return new QuerySpec(flux, null, null);
  }

  private static String equalsFilter(String column, String value) {
    return "|> filter(fn: (r) => r[\"" + column + "\"] == \"" + escape(value) + "\")";
  }

  /**
   * Escapes a value for use inside a double-quoted Flux string literal: backslash first, then
   * the double quote, then the interpolation opener.
   */
  public static String escape(String value) {
    return value.replace("\\", "\\\\")
        .replace("\"", "\\\"")
        .replace("${", "\\${");
  }

  static String literal(Instant instant) {
    return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
  }
}
