package com.tofes.analyzer.aircraft;

import java.util.Optional;

/** Repository contract for aircraft group reference data keyed by type code. */
public interface AircraftGroupRepository {
  /**
   * Returns the reference profile for a type code.
   *
   * @param typeCode normalized aircraft type code (case-insensitive)
   * @return matching profile when found
   */
  Optional<AircraftProfile> findByTypeCode(String typeCode);
}
