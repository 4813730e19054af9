package com.ospicorp.outageanalytics.store;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the CSV body returned by the store's query endpoint with annotations disabled and
 * headers enabled. Each result table starts with its own header row and tables are separated
 * by a blank line, so tables with different columns can follow one another. The body is read
 * as one CSV stream, so quoted cells may contain blank lines.
 */
public final class FluxCsvParser {
  private final CsvMapper mapper = new CsvMapper();

  public FluxCsvParser() {
    mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
  }

  public List<FluxRecord> parse(String body) {
    List<FluxRecord> records = new ArrayList<>();
    if (body == null || body.isBlank()) {
      return records;
    }
    try (MappingIterator<String[]> rows = mapper.readerFor(String[].class).readValues(body)) {
      String[] header = null;
      while (rows.hasNext()) {
        String[] row = rows.next();
        if (isBlank(row)) {
          header = null;
          continue;
        }
        if (header == null || isHeader(row)) {
          header = row;
          continue;
        }
        if (isErrorTable(header)) {
          throw new StoreException("Store reported query error: " + String.join(",", row));
        }
        records.add(new FluxRecord(toMap(header, row)));
      }
    } catch (IOException e) {
      throw new StoreException("Unreadable query response", e);
    }
    return records;
  }

  private static boolean isBlank(String[] row) {
    for (String cell : row) {
      if (cell != null && !cell.isBlank()) {
        return false;
      }
    }
    return true;
  }

  private static boolean isHeader(String[] row) {
    return row.length > 2 && "result".equals(row[1]) && "table".equals(row[2]);
  }

  private static boolean isErrorTable(String[] header) {
    return header.length >= 2 && "error".equals(header[1]) && "reference".equals(
        header.length > 2 ? header[2] : "");
  }

  private static Map<String, String> toMap(String[] header, String[] row) {
    Map<String, String> values = new LinkedHashMap<>();
    for (int i = 0; i < header.length; i++) {
      String column = header[i];
      if (column == null || column.isEmpty()) {
        continue;
      }
      values.put(column, i < row.length ? row[i] : "");
    }
    return values;
  }
}
