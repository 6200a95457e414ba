package com.tofes.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entrypoint for the logbook analyzer.
 *
 * <p>The analyzer maps logbook columns, classifies flights under the CAAI crediting rules and
 * returns the values of the flight hours summary form (tofes shaot).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AnalyzerApplication {
  /**
   * Starts the analyzer application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(AnalyzerApplication.class, args);
  }
}
