package com.ospicorp.outageanalytics.weather;

import java.util.ArrayList;
import java.util.List;
import org.springframework.util.StringUtils;

/** Store field names for each weather variable; a null name disables that variable. */
public record WeatherFields(String wind, String temperature, String humidity) {

  public WeatherFields {
    wind = StringUtils.hasText(wind) ? wind.trim() : null;
    temperature = StringUtils.hasText(temperature) ? temperature.trim() : null;
    humidity = StringUtils.hasText(humidity) ? humidity.trim() : null;
  }

  public List<String> enabled() {
    List<String> fields = new ArrayList<>(3);
    if (wind != null) {
      fields.add(wind);
    }
    if (temperature != null) {
      fields.add(temperature);
    }
    if (humidity != null) {
      fields.add(humidity);
    }
    return fields;
  }
}
