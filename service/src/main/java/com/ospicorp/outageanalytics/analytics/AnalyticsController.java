package com.ospicorp.outageanalytics.analytics;

import com.ospicorp.outageanalytics.incident.controller.FilterParameters;
import com.ospicorp.outageanalytics.incident.model.FilterCriteria;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/analytics")
@Tag(name = "Analytics")
public class AnalyticsController {
  private final AnalyticsService analyticsService;
  private final FilterParameters filterParameters;

  public AnalyticsController(AnalyticsService analyticsService,
      FilterParameters filterParameters) {
    this.analyticsService = analyticsService;
    this.filterParameters = filterParameters;
  }

  @GetMapping("/dashboard")
  @Operation(summary = "Dashboard",
      description = "Total duration, daily series, cause Pareto, weekday/hour heatmap and "
          + "duration histogram for the filtered incidents.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Dashboard",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = DashboardResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public DashboardResponse dashboard(
      @RequestParam(required = false)
          @Parameter(description = "count or duration_minutes", example = "count") String metric,
      @RequestParam(name = "start_date", required = false) String startDate,
      @RequestParam(name = "end_date", required = false) String endDate,
      @RequestParam(required = false) String district,
      @RequestParam(required = false) String cause,
      @RequestParam(required = false) String voltage) {
    Metric selected = Metric.parse(metric);
    FilterCriteria criteria =
        filterParameters.toCriteria(startDate, endDate, district, cause, voltage);
    return analyticsService.dashboard(criteria, selected);
  }
}
