package com.ospicorp.outageanalytics.weather;

import com.ospicorp.outageanalytics.incident.controller.FilterParameters;
import com.ospicorp.outageanalytics.incident.model.FilterCriteria;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/weather")
@Tag(name = "Weather")
public class WeatherController {
  private final WeatherService weatherService;
  private final FilterParameters filterParameters;

  public WeatherController(WeatherService weatherService, FilterParameters filterParameters) {
    this.weatherService = weatherService;
    this.filterParameters = filterParameters;
  }

  @GetMapping("/correlation")
  @Operation(summary = "Weather correlation",
      description = "Filtered incidents with the wind, temperature and humidity observed at "
          + "their district's weather site.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Correlated incidents",
          content = @Content(mediaType = "application/json",
              array = @ArraySchema(schema = @Schema(implementation = CorrelatedIncident.class)))),
      @ApiResponse(responseCode = "400",
          description = "Bad filters, incidents missing district/start/end, or unusable tag table",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public List<CorrelatedIncident> correlation(
      @RequestParam(name = "start_date", required = false) String startDate,
      @RequestParam(name = "end_date", required = false) String endDate,
      @RequestParam(required = false) String district,
      @RequestParam(required = false) String cause,
      @RequestParam(required = false) String voltage) {
    FilterCriteria criteria =
        filterParameters.toCriteria(startDate, endDate, district, cause, voltage);
    return weatherService.correlate(criteria);
  }
}
