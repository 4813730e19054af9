package com.ospicorp.outageanalytics.config;

import java.time.Duration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the incident and weather stores, the local time zone and the district to
 * weather-site table. Bound from the {@code outage.*} namespace.
 */
@ConfigurationProperties(prefix = "outage")
@Validated
public class OutageProperties {

  @NotBlank
  private String zone = "America/Argentina/San_Luis";
  @NotBlank
  private String districtTagsPath = "config/distrito_tags.csv";
  @Valid
  private final Store store = new Store();
  @Valid
  private final Weather weather = new Weather();

  public String getZone() {
    return zone;
  }

  public void setZone(String zone) {
    this.zone = zone;
  }

  public String getDistrictTagsPath() {
    return districtTagsPath;
  }

  public void setDistrictTagsPath(String districtTagsPath) {
    this.districtTagsPath = districtTagsPath;
  }

  public Store getStore() {
    return store;
  }

  public Weather getWeather() {
    return weather;
  }

  public static class Store {
    @NotBlank
    private String url = "http://localhost:8086";
    private String token = "";
    private String org = "";
    @NotBlank
    private String bucket = "incidencias";
    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);
    @NotNull
    private Duration readTimeout = Duration.ofSeconds(60);
    private boolean bootstrapEnabled = true;

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getToken() {
      return token;
    }

    public void setToken(String token) {
      this.token = token;
    }

    public String getOrg() {
      return org;
    }

    public void setOrg(String org) {
      this.org = org;
    }

    public String getBucket() {
      return bucket;
    }

    public void setBucket(String bucket) {
      this.bucket = bucket;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
      return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
    }

    public boolean isBootstrapEnabled() {
      return bootstrapEnabled;
    }

    public void setBootstrapEnabled(boolean bootstrapEnabled) {
      this.bootstrapEnabled = bootstrapEnabled;
    }
  }

  /**
   * Weather store connection. Blank url, token or org fall back to the incident store.
   */
  public static class Weather {
    private String url = "";
    private String token = "";
    private String org = "";
    @NotBlank
    private String bucket = "weather";
    @NotBlank
    private String measurement = "weather_hourly";
    private String windField = "windspeed";
    private String humidityField = "relative_humidity";
    private String temperatureField = "temperature";
    private String siteTagKey = "site_tag";

    public String resolveUrl(Store fallback) {
      return StringUtils.hasText(url) ? url : fallback.getUrl();
    }

    public String resolveToken(Store fallback) {
      return StringUtils.hasText(token) ? token : fallback.getToken();
    }

    public String resolveOrg(Store fallback) {
      return StringUtils.hasText(org) ? org : fallback.getOrg();
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getToken() {
      return token;
    }

    public void setToken(String token) {
      this.token = token;
    }

    public String getOrg() {
      return org;
    }

    public void setOrg(String org) {
      this.org = org;
    }

    public String getBucket() {
      return bucket;
    }

    public void setBucket(String bucket) {
      this.bucket = bucket;
    }

    public String getMeasurement() {
      return measurement;
    }

    public void setMeasurement(String measurement) {
      this.measurement = measurement;
    }

    public String getWindField() {
      return windField;
    }

    public void setWindField(String windField) {
      this.windField = windField;
    }

    public String getHumidityField() {
      return humidityField;
    }

    public void setHumidityField(String humidityField) {
      this.humidityField = humidityField;
    }

    public String getTemperatureField() {
      return temperatureField;
    }

    public void setTemperatureField(String temperatureField) {
      this.temperatureField = temperatureField;
    }

    public String getSiteTagKey() {
      return siteTagKey;
    }

    public void setSiteTagKey(String siteTagKey) {
      this.siteTagKey = siteTagKey;
    }
  }
}
