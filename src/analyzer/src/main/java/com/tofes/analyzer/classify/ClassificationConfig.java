package com.tofes.analyzer.classify;

import com.tofes.analyzer.config.AnalyzerProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the classification engine from {@code analyzer.*} properties. */
@Configuration
public class ClassificationConfig {

  /** Distance source used when no other bean is registered: only recorded distances count. */
  @Bean
  @ConditionalOnMissingBean
  public DistanceProvider distanceProvider() {
    return DistanceProvider.none();
  }

  @Bean
  public ClassificationEngine classificationEngine(
      AnalyzerProperties properties, DistanceProvider distanceProvider) {
    return new ClassificationEngine(properties.getCrossCountryThresholdNm(), distanceProvider);
  }
}
