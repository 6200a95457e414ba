package com.tofes.analyzer.aircraft;

import java.util.Locale;
import java.util.Optional;

/** CAAI aircraft groups as printed on the summary form. */
public enum AircraftGroup {
  /** Single-engine piston. */
  A("א"),
  /** Multi-engine piston. */
  B("ב"),
  /** Multi-engine jet or turboprop. */
  C("ג"),
  /** Single-engine turboprop. */
  D("ד"),
  UNRESOLVED("");

  private final String formLetter;

  AircraftGroup(String formLetter) {
    this.formLetter = formLetter;
  }

  public String formLetter() {
    return formLetter;
  }

  public boolean isSingleEngine() {
    return this == A || this == D;
  }

  public boolean isMultiEngine() {
    return this == B || this == C;
  }

  /**
   * Parses a group from its Latin code or Hebrew form letter.
   *
   * @param value text such as {@code "B"} or {@code "ב"}
   * @return matching group, empty when the value names none of A-D
   */
  public static Optional<AircraftGroup> fromCode(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String code = value.trim().toUpperCase(Locale.ROOT);
    for (AircraftGroup group : values()) {
      if (group != UNRESOLVED && (group.name().equals(code) || group.formLetter.equals(code))) {
        return Optional.of(group);
      }
    }
    return Optional.empty();
  }
}
