package com.tofes.analyzer.config;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the logbook analyzer.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code analyzer.*} prefix.
 */
@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerProperties {
  private final AircraftDb aircraftDb = new AircraftDb();
  private String pilotName = "";
  private BigDecimal crossCountryThresholdNm = new BigDecimal("27");
  private Map<String, String> columns = new LinkedHashMap<>();

  public AircraftDb getAircraftDb() {
    return aircraftDb;
  }

  public String getPilotName() {
    return pilotName;
  }

  public void setPilotName(String pilotName) {
    this.pilotName = pilotName;
  }

  public BigDecimal getCrossCountryThresholdNm() {
    return crossCountryThresholdNm;
  }

  public void setCrossCountryThresholdNm(BigDecimal crossCountryThresholdNm) {
    this.crossCountryThresholdNm = crossCountryThresholdNm;
  }

  /** Default explicit column mapping (field name to header name or 0-based index). */
  public Map<String, String> getColumns() {
    return columns;
  }

  public void setColumns(Map<String, String> columns) {
    this.columns = columns;
  }

  /** Aircraft reference DB settings used by the optional group lookup override. */
  public static class AircraftDb {
    private boolean enabled = false;
    private String path = "";
    private int cacheSize = 5000;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public int getCacheSize() {
      return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
      this.cacheSize = cacheSize;
    }
  }
}
