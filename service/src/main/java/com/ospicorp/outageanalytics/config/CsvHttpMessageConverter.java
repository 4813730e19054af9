package com.ospicorp.outageanalytics.config;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.Collection;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes a collection of flat records as {@code text/csv}, one row per element, with the header
 * taken from the first element's type.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Collection<?>> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");
  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> rows, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    Object sample = rows.stream().filter(row -> row != null).findFirst().orElse(null);
    if (sample == null) {
      return;
    }
    CsvSchema schema = mapper.schemaFor(sample.getClass()).withHeader();
    SequenceWriter writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Object row : rows) {
      if (row != null) {
        writer.write(row);
      }
    }
    writer.flush();
  }
}
