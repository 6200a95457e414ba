package com.tofes.analyzer.aircraft;

import com.tofes.analyzer.config.AnalyzerProperties;
import java.nio.file.Path;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the optional aircraft reference DB.
 *
 * <p>When enabled, group lookups consult a read-only SQLite file before the built-in type table.
 */
@Configuration
public class AircraftDbConfig {

  /**
   * Creates the aircraft group repository when {@code analyzer.aircraft-db.enabled=true}.
   *
   * @param properties analyzer configuration properties
   * @return repository backed by the local SQLite file
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "analyzer.aircraft-db", name = "enabled", havingValue = "true")
  public SqliteAircraftGroupRepository aircraftGroupRepository(AnalyzerProperties properties) {
    String path = properties.getAircraftDb().getPath();
    if (path == null || path.isBlank()) {
      throw new IllegalStateException("analyzer.aircraft-db.enabled=true but analyzer.aircraft-db.path is empty");
    }
    return new SqliteAircraftGroupRepository(Path.of(path), properties.getAircraftDb().getCacheSize());
  }
}
