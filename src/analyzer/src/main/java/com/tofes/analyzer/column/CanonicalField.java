package com.tofes.analyzer.column;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of logbook fields understood by the analyzer.
 *
 * <p>Declaration order is the order in which header aliases are detected, so more specific fields
 * claim their headers before generic ones.
 */
public enum CanonicalField {
  DATE("Date", Kind.DATE),
  FROM("From Airport", Kind.TEXT),
  TO("To Airport", Kind.TEXT),
  REGISTRATION("Registration", Kind.TEXT),
  AIRCRAFT_TYPE("Aircraft Type", Kind.TEXT),
  TOTAL_TIME("Total Time", Kind.DURATION),
  PIC("PIC", Kind.DURATION),
  SIC("SIC", Kind.DURATION),
  NIGHT("Night", Kind.DURATION),
  CROSS_COUNTRY("Cross Country", Kind.DURATION),
  ACTUAL_INSTRUMENT("Actual Instrument", Kind.DURATION),
  SIMULATED_INSTRUMENT("Simulated Instrument", Kind.DURATION),
  DUAL_RECEIVED("Dual Received", Kind.DURATION),
  DUAL_GIVEN("Dual Given", Kind.DURATION),
  SOLO("Solo", Kind.DURATION),
  MULTI_PILOT("Multi-Pilot", Kind.DURATION),
  SIMULATOR("Simulator", Kind.DURATION),
  DAY_LANDINGS("Day Landings", Kind.COUNT),
  NIGHT_LANDINGS("Night Landings", Kind.COUNT),
  INSTRUCTOR("Instructor", Kind.TEXT),
  REMARKS("Remarks", Kind.TEXT),
  ENGINE_TYPE("Engine Type", Kind.TEXT),
  CLASS("Class", Kind.TEXT),
  DISTANCE("Distance (NM)", Kind.DISTANCE);

  /** Value grammar a field is parsed with. */
  public enum Kind {
    TEXT,
    DATE,
    DURATION,
    COUNT,
    DISTANCE
  }

  private static final Set<CanonicalField> REQUIRED =
      EnumSet.of(DATE, FROM, TO, REGISTRATION, AIRCRAFT_TYPE, TOTAL_TIME);

  private static final Set<CanonicalField> RECOMMENDED = EnumSet.of(ENGINE_TYPE, CLASS, DISTANCE);

  private final String displayName;
  private final Kind kind;

  CanonicalField(String displayName, Kind kind) {
    this.displayName = displayName;
    this.kind = kind;
  }

  public String displayName() {
    return displayName;
  }

  public Kind kind() {
    return kind;
  }

  public boolean isRequired() {
    return REQUIRED.contains(this);
  }

  public boolean isRecommended() {
    return RECOMMENDED.contains(this);
  }

  public static Set<CanonicalField> required() {
    return EnumSet.copyOf(REQUIRED);
  }

  public static Set<CanonicalField> durations() {
    EnumSet<CanonicalField> fields = EnumSet.noneOf(CanonicalField.class);
    for (CanonicalField field : values()) {
      if (field.kind == Kind.DURATION) {
        fields.add(field);
      }
    }
    return fields;
  }
}
