package com.ospicorp.outageanalytics.weather;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a district name to the tag value that identifies its weather site. Keys are matched
 * exactly as they appear in incident records.
 */
public final class DistrictTagTable {
  static final String DISTRICT_COLUMN = "distrito";
  static final String TAG_COLUMN = "weather_tag";

  private final Map<String, String> tags;

  private DistrictTagTable(Map<String, String> tags) {
    this.tags = Map.copyOf(tags);
  }

  public static DistrictTagTable of(Map<String, String> tags) {
    return new DistrictTagTable(tags);
  }

  /**
   * Reads a CSV with a {@code distrito} and a {@code weather_tag} column (header case is
   * ignored). Rows where either value is blank are skipped.
   *
   * @throws DistrictTagTableException if the file is missing, unreadable or lacks a column
   */
  public static DistrictTagTable load(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new DistrictTagTableException("District tag table not found: " + path);
    }
    CsvMapper mapper = new CsvMapper();
    mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        MappingIterator<String[]> rows = mapper.readerFor(String[].class).readValues(reader)) {
      if (!rows.hasNext()) {
        throw missingColumns(path);
      }
      String[] header = rows.next();
      int districtIdx = indexOf(header, DISTRICT_COLUMN);
      int tagIdx = indexOf(header, TAG_COLUMN);
      if (districtIdx < 0 || tagIdx < 0) {
        throw missingColumns(path);
      }

      Map<String, String> tags = new LinkedHashMap<>();
      while (rows.hasNext()) {
        String[] row = rows.next();
        String district = cell(row, districtIdx);
        String tag = cell(row, tagIdx);
        if (!district.isEmpty() && !tag.isEmpty()) {
          tags.put(district, tag);
        }
      }
      return new DistrictTagTable(tags);
    } catch (IOException e) {
      throw new DistrictTagTableException("Unable to read district tag table " + path, e);
    }
  }

  public Optional<String> tagFor(String district) {
    return district == null ? Optional.empty() : Optional.ofNullable(tags.get(district.trim()));
  }

  public int size() {
    return tags.size();
  }

  private static int indexOf(String[] header, String column) {
    for (int i = 0; i < header.length; i++) {
      if (header[i] != null && column.equals(header[i].trim().toLowerCase(Locale.ROOT))) {
        return i;
      }
    }
    return -1;
  }

  private static String cell(String[] row, int index) {
    return index < row.length && row[index] != null ? row[index].trim() : "";
  }

  private static DistrictTagTableException missingColumns(Path path) {
    return new DistrictTagTableException("District tag table " + path + " must have columns '"
        + DISTRICT_COLUMN + "' and '" + TAG_COLUMN + "'");
  }
}
