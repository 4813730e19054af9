package com.ospicorp.outageanalytics.weather;

import static com.ospicorp.outageanalytics.IncidentFixtures.incident;
import static com.ospicorp.outageanalytics.IncidentFixtures.local;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.outageanalytics.IncidentFixtures;
import com.ospicorp.outageanalytics.incident.controller.FilterParameters;
import com.ospicorp.outageanalytics.incident.model.VoltageLevel;
import com.ospicorp.outageanalytics.time.TimeNormalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(WeatherController.class)
@Import(FilterParameters.class)
class WeatherControllerTest {

  @TestConfiguration
  static class Zone {
    @Bean
    TimeNormalizer timeNormalizer() {
      return new TimeNormalizer(IncidentFixtures.ZONE);
    }
  }

  @Autowired
  private MockMvc mvc;

  @MockBean
  private WeatherService weatherService;

  @Test
  void returnsMetricsAndStatusPerIncident() throws Exception {
    var incident = incident(local(2024, 1, 10, 8, 0), local(2024, 1, 10, 10, 0),
        VoltageLevel.MT, "Viento");
    when(weatherService.correlate(any())).thenReturn(List.of(
        new CorrelatedIncident(incident, new WeatherMetrics(50d, 35d, 31.5, 40d, 70d),
            WeatherStatus.OK),
        new CorrelatedIncident(incident, WeatherMetrics.EMPTY, WeatherStatus.NO_TAG)));

    mvc.perform(get("/v1/weather/correlation").param("start_date", "2024-01-10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].status").value("ok"))
        .andExpect(jsonPath("$[0].weather.wind_max").value(50.0))
        .andExpect(jsonPath("$[0].weather.humidity_prev_6h").value(70.0))
        .andExpect(jsonPath("$[0].incident.district").value("Capital"))
        .andExpect(jsonPath("$[1].status").value("sin_tag"))
        .andExpect(jsonPath("$[1].weather.wind_max").isEmpty());
  }

  @Test
  void validationFailureListsMissingFields() throws Exception {
    Map<String, Object> example = new LinkedHashMap<>();
    example.put("index", 3);
    example.put("missing", List.of("end"));
    when(weatherService.correlate(any())).thenThrow(
        new CorrelationValidationException(List.of("end"), List.of(example)));

    mvc.perform(get("/v1/weather/correlation"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.missingFields[0]").value("end"))
        .andExpect(jsonPath("$.examples[0].index").value(3))
        .andExpect(jsonPath("$.status").value(400));
  }

  @Test
  void missingTagTableIsReported() throws Exception {
    when(weatherService.correlate(any()))
        .thenThrow(new DistrictTagTableException("District tag table not found: x.csv"));

    mvc.perform(get("/v1/weather/correlation"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("District tag table not found: x.csv"));
  }
}
