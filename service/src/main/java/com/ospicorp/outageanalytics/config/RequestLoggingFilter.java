package com.ospicorp.outageanalytics.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs one line per request and tags every log statement made while serving it with a
 * {@code requestId} MDC entry, so a dashboard request can be followed through its store calls.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
  static final String REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long startTime = System.currentTimeMillis();
    MDC.put(REQUEST_ID, UUID.randomUUID().toString().substring(0, 8));
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} from {} failed: {}",
          request.getMethod(),
          requestUriWithQuery(request),
          clientIp(request),
          ex.getMessage(),
          ex);
      throw ex;
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      if (request.getRequestURI().startsWith("/actuator")) {
        log.debug("HTTP {} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
            response.getStatus(), duration);
      } else {
        log.info("HTTP {} {} from {} -> {} ({} ms)",
            request.getMethod(),
            requestUriWithQuery(request),
            clientIp(request),
            response.getStatus(),
            duration);
      }
      MDC.remove(REQUEST_ID);
    }
  }

  static String requestUriWithQuery(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }

  static String clientIp(HttpServletRequest request) {
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (forwardedHeader != null && !forwardedHeader.isBlank()) {
      return forwardedHeader.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }
}
