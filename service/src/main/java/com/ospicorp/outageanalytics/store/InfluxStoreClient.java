package com.ospicorp.outageanalytics.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Thin client for the InfluxDB v2 HTTP API: Flux queries, predicate deletes and bucket
 * management. Every method throws {@link StoreException} on failure; callers decide whether to
 * degrade or propagate.
 */
public class InfluxStoreClient {
  private static final Logger log = LoggerFactory.getLogger(InfluxStoreClient.class);
  private static final MediaType TEXT_CSV = MediaType.valueOf("application/csv");

  private final RestTemplate restTemplate;
  private final ObjectMapper mapper;
  private final FluxCsvParser parser = new FluxCsvParser();
  private final String baseUrl;
  private final String token;
  private final String org;

  public InfluxStoreClient(RestTemplate restTemplate, ObjectMapper mapper, String baseUrl,
      String token, String org) {
    this.restTemplate = restTemplate;
    this.mapper = mapper;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.token = token;
    this.org = org;
  }

  public List<FluxRecord> query(String flux) {
    Map<String, Object> dialect = new LinkedHashMap<>();
    dialect.put("header", true);
    dialect.put("delimiter", ",");
    dialect.put("annotations", List.of());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("query", flux);
    body.put("type", "flux");
    body.put("dialect", dialect);

    String url = UriComponentsBuilder.fromHttpUrl(baseUrl + "/api/v2/query")
        .queryParam("org", org)
        .toUriString();

    HttpHeaders headers = jsonHeaders();
    headers.setAccept(List.of(TEXT_CSV));
    log.debug("Flux query: {}", flux);
    try {
      ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.POST,
          new HttpEntity<>(write(body), headers), String.class);
      return parser.parse(response.getBody());
    } catch (RestClientException e) {
      throw new StoreException("Query request failed: " + e.getMessage(), e);
    }
  }

  public void delete(String bucket, Instant start, Instant stop, String predicate) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("start", rfc3339(start));
    body.put("stop", rfc3339(stop));
    body.put("predicate", predicate);

    String url = UriComponentsBuilder.fromHttpUrl(baseUrl + "/api/v2/delete")
        .queryParam("org", org)
        .queryParam("bucket", bucket)
        .toUriString();
    try {
      restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(write(body), jsonHeaders()),
          Void.class);
    } catch (RestClientException e) {
      throw new StoreException("Delete request failed: " + e.getMessage(), e);
    }
  }

  public boolean bucketExists(String bucket) {
    String url = UriComponentsBuilder.fromHttpUrl(baseUrl + "/api/v2/buckets")
        .queryParam("org", org)
        .queryParam("name", bucket)
        .toUriString();
    JsonNode buckets = get(url).path("buckets");
    return buckets.isArray() && buckets.size() > 0;
  }

  public void createBucket(String bucket) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("orgID", resolveOrgId());
    body.put("name", bucket);
    body.put("retentionRules", List.of());
    try {
      restTemplate.exchange(baseUrl + "/api/v2/buckets", HttpMethod.POST,
          new HttpEntity<>(write(body), jsonHeaders()), Void.class);
    } catch (RestClientException e) {
      throw new StoreException("Bucket creation failed for " + bucket + ": " + e.getMessage(), e);
    }
  }

  /** Returns the status reported by the store's health endpoint, e.g. {@code pass}. */
  public String health() {
    return get(baseUrl + "/health").path("status").asText("unknown");
  }

  private String resolveOrgId() {
    String url = UriComponentsBuilder.fromHttpUrl(baseUrl + "/api/v2/orgs")
        .queryParam("org", org)
        .toUriString();
    JsonNode orgs = get(url).path("orgs");
    if (!orgs.isArray() || orgs.isEmpty()) {
      throw new StoreException("Organization not found: " + org);
    }
    return orgs.get(0).path("id").asText();
  }

  private JsonNode get(String url) {
    try {
      ResponseEntity<JsonNode> response = restTemplate.exchange(url, HttpMethod.GET,
          new HttpEntity<>(jsonHeaders()), JsonNode.class);
      JsonNode body = response.getBody();
      return body == null ? mapper.createObjectNode() : body;
    } catch (RestClientException e) {
      throw new StoreException("Request to " + url + " failed: " + e.getMessage(), e);
    }
  }

  private HttpHeaders jsonHeaders() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.set(HttpHeaders.AUTHORIZATION, "Token " + token);
    return headers;
  }

  private String write(Object body) {
    try {
      return mapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new StoreException("Unable to serialize request body", e);
    }
  }

  public static String rfc3339(Instant instant) {
    return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
  }
}
