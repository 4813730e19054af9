package com.ospicorp.outageanalytics.config;

import com.ospicorp.outageanalytics.incident.InvalidFilterException;
import com.ospicorp.outageanalytics.weather.CorrelationValidationException;
import com.ospicorp.outageanalytics.weather.DistrictTagTableException;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler(InvalidFilterException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidFilter(InvalidFilterException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", ex.getMessage());
    body.put("errorCode", ex.errorCode());
    body.put("moreInfo", ex.moreInfo());
    body.put("path", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(CorrelationValidationException.class)
  public ResponseEntity<ProblemDetail> handleCorrelationValidation(
      CorrelationValidationException ex, HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, ex, request);
    ProblemDetail detail = response.getBody();
    if (detail != null) {
      detail.setProperty("missingFields", ex.missingFields());
      detail.setProperty("examples", ex.examples());
    }
    return response;
  }

  @ExceptionHandler({DistrictTagTableException.class, MissingServletRequestParameterException.class,
      MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create("https://docs.outage-analytics.dev/problems/"
        + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }
    String uri = RequestLoggingFilter.requestUriWithQuery(request);
    String clientIp = RequestLoggingFilter.clientIp(request);

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          request.getMethod(), uri, clientIp, status.value(), errorMessage, ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          request.getMethod(), uri, clientIp, status.value(), errorMessage);
    }
  }
}
