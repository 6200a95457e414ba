package com.tofes.analyzer.classify;

import java.math.BigDecimal;
import java.util.Optional;

/** Supplies route distances for flights whose logbook row carries none. */
@FunctionalInterface
public interface DistanceProvider {
  /**
   * Returns the distance between two airports.
   *
   * @param from departure airport code
   * @param to arrival airport code
   * @return distance in nautical miles, empty when unknown
   */
  Optional<BigDecimal> distanceNm(String from, String to);

  static DistanceProvider none() {
    return (from, to) -> Optional.empty();
  }
}
