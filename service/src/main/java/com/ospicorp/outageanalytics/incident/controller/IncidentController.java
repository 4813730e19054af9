package com.ospicorp.outageanalytics.incident.controller;

import com.ospicorp.outageanalytics.config.CsvHttpMessageConverter;
import com.ospicorp.outageanalytics.incident.InvalidFilterException;
import com.ospicorp.outageanalytics.incident.model.FilterCriteria;
import com.ospicorp.outageanalytics.incident.model.FilterOptions;
import com.ospicorp.outageanalytics.incident.model.IncidentRow;
import com.ospicorp.outageanalytics.incident.service.IncidentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/incidents")
@Tag(name = "Incidents")
public class IncidentController {
  private final IncidentService incidentService;
  private final FilterParameters filterParameters;

  public IncidentController(IncidentService incidentService, FilterParameters filterParameters) {
    this.incidentService = incidentService;
    this.filterParameters = filterParameters;
  }

  @GetMapping
  @Operation(summary = "List incidents",
      description = "Incidents matching the filters, newest first, as JSON or CSV.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Incident rows",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = IncidentRow.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<IncidentRow>> list(
      @RequestParam(name = "start_date", required = false)
          @Parameter(description = "First local day, DD-MM-YYYY or YYYY-MM-DD", example = "10-01-2024") String startDate,
      @RequestParam(name = "end_date", required = false)
          @Parameter(description = "Last local day (inclusive); requires start_date") String endDate,
      @RequestParam(required = false) @Parameter(description = "District, exact match") String district,
      @RequestParam(required = false) @Parameter(description = "Cause, exact match") String cause,
      @RequestParam(required = false) @Parameter(description = "Voltage level", example = "MT") String voltage,
      @RequestParam(required = false) @Parameter(description = "json or csv") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    FilterCriteria criteria =
        filterParameters.toCriteria(startDate, endDate, district, cause, voltage);
    List<IncidentRow> rows = incidentService.find(criteria).stream()
        .map(IncidentRow::of)
        .toList();

    ResponseEntity.BodyBuilder builder = ResponseEntity.ok().contentType(contentType);
    if (contentType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
      builder.header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=incidencias.csv");
    }
    return builder.body(rows);
  }

  @GetMapping("/filters")
  @Operation(summary = "Filter options",
      description = "Known districts, causes and the local days that have incidents.")
  public FilterOptions filters() {
    return incidentService.filterOptions();
  }

  static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw InvalidFilterException.unknownFormat(format);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isWildcardType() || mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
