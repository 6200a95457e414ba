package com.tofes.analyzer.aircraft;

/** Resolves the CAAI profile of the aircraft a flight was logged on. */
@FunctionalInterface
public interface AircraftGroupLookup {
  /**
   * Looks up an aircraft.
   *
   * @param aircraftType type code as logged
   * @param engineType engine metadata as logged, may be empty
   * @param aircraftClass class metadata as logged, may be empty
   * @return profile, with group {@link AircraftGroup#UNRESOLVED} when nothing matched
   */
  AircraftProfile lookup(String aircraftType, String engineType, String aircraftClass);
}
