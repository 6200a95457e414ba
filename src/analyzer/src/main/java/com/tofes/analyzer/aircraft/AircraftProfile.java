package com.tofes.analyzer.aircraft;

/**
 * Resolved reference data for one aircraft type.
 *
 * @param typeCode normalized type code
 * @param group CAAI group
 * @param complex retractable gear and variable pitch propeller
 */
public record AircraftProfile(String typeCode, AircraftGroup group, boolean complex) {

  public static AircraftProfile unresolved(String typeCode) {
    return new AircraftProfile(typeCode, AircraftGroup.UNRESOLVED, false);
  }

  public boolean isResolved() {
    return group != AircraftGroup.UNRESOLVED;
  }
}
