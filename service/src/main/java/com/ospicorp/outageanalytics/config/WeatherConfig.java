package com.ospicorp.outageanalytics.config;

import com.ospicorp.outageanalytics.weather.WeatherCorrelator;
import com.ospicorp.outageanalytics.weather.WeatherFields;
import com.ospicorp.outageanalytics.weather.WeatherSampleSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WeatherConfig {

  @Bean
  WeatherFields weatherFields(OutageProperties properties) {
    OutageProperties.Weather weather = properties.getWeather();
    return new WeatherFields(weather.getWindField(), weather.getTemperatureField(),
        weather.getHumidityField());
  }

  @Bean
  WeatherCorrelator weatherCorrelator(WeatherSampleSource source, WeatherFields fields) {
    return new WeatherCorrelator(source, fields);
  }
}
