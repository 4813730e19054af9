package com.ospicorp.outageanalytics.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class FluxCsvParserTest {

  private final FluxCsvParser parser = new FluxCsvParser();

  @Test
  void readsRowsOfEveryTable() {
    String body = ",result,table,_time,distrito,potencia_involucrada\r\n"
        + ",_result,0,2024-01-10T11:30:00Z,Capital,1.5\r\n"
        + ",_result,0,2024-01-10T12:00:00Z,Merlo,\r\n"
        + "\r\n"
        + ",result,table,_value\r\n"
        + ",_result,1,Viento\r\n";

    List<FluxRecord> records = parser.parse(body);

    assertEquals(3, records.size());
    assertEquals(Instant.parse("2024-01-10T11:30:00Z"), records.get(0).getTime());
    assertEquals("Capital", records.get(0).getString("distrito"));
    assertEquals(1.5, records.get(0).getDouble("potencia_involucrada"));
    assertThat(records.get(1).getDouble("potencia_involucrada")).isNull();
    assertEquals("Viento", records.get(2).getString("_value"));
    assertThat(records.get(2).values()).doesNotContainKey("");
  }

  @Test
  void quotedCellMayContainBlankLines() {
    String body = ",result,table,_time,descripcion_de_la_causa\r\n"
        + ",_result,0,2024-01-10T11:30:00Z,\"Rama sobre linea\r\n\r\nver informe\"\r\n"
        + ",_result,0,2024-01-10T12:00:00Z,Viento\r\n";

    List<FluxRecord> records = parser.parse(body);

    assertEquals(2, records.size());
    assertThat(records.get(0).getString("descripcion_de_la_causa"))
        .startsWith("Rama sobre linea")
        .endsWith("ver informe");
    assertEquals("Viento", records.get(1).getString("descripcion_de_la_causa"));
  }

  @Test
  void emptyBodyHasNoRows() {
    assertThat(parser.parse("")).isEmpty();
    assertThat(parser.parse(null)).isEmpty();
  }

  @Test
  void errorTableRaises() {
    String body = ",error,reference\n,failed to compile query,897\n";

    assertThatThrownBy(() -> parser.parse(body))
        .isInstanceOf(StoreException.class)
        .hasMessageContaining("failed to compile query");
  }

  @Test
  void numericAccessorsTolerateFloatsAndGarbage() {
    FluxRecord record = parser.parse(",a,b,c\n,12.0,x,\n").get(0);

    assertEquals(12L, record.getLong("a", -1));
    assertEquals(-1L, record.getLong("b", -1));
    assertEquals(-1L, record.getLong("c", -1));
    assertEquals("", record.getString("missing"));
  }
}
