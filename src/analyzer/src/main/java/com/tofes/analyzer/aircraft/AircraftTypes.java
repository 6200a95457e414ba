package com.tofes.analyzer.aircraft;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Built-in aircraft type reference table and training device detection. */
public final class AircraftTypes {
  private static final Map<String, String> VARIANTS = Map.of(
      "C172R", "C172",
      "C172K", "C172",
      "C172S", "C172",
      "P28A-161", "PA28",
      "P28A-181", "PA28",
      "P28A", "PA28");

  private static final Map<String, AircraftProfile> BUILT_IN = Map.ofEntries(
      entry("C152", AircraftGroup.A, false),
      entry("C172", AircraftGroup.A, false),
      entry("PA28", AircraftGroup.A, false),
      entry("SR20", AircraftGroup.A, false),
      entry("DA40", AircraftGroup.A, false),
      entry("PA44", AircraftGroup.B, true),
      entry("BE76", AircraftGroup.B, true),
      entry("A319", AircraftGroup.C, false),
      entry("A320", AircraftGroup.C, false),
      entry("H25B", AircraftGroup.C, false),
      entry("PC12", AircraftGroup.D, false),
      entry("TBM9", AircraftGroup.D, false),
      entry("C208", AircraftGroup.D, false));

  private static final List<String> DEVICE_TYPE_MARKERS = List.of("SIM", "FTD", "FFS");
  private static final List<String> DEVICE_REGISTRATION_MARKERS = List.of("FRASCA", "FLIGHT SAFETY", "CAE");

  // Devices named after their maker stand in for the aircraft they replicate.
  private static final Map<String, String> DEVICE_BASE_TYPES = Map.of(
      "FRASCA", "C172",
      "FLIGHT SAFETY", "H25B");

  private AircraftTypes() {}

  /**
   * Normalizes a logged type code: upper-case, trimmed, known variants folded onto their family.
   *
   * @param aircraftType type as logged
   * @return normalized code, empty for blank input
   */
  public static String normalize(String aircraftType) {
    if (aircraftType == null) {
      return "";
    }
    String type = aircraftType.trim().toUpperCase(Locale.ROOT);
    return VARIANTS.getOrDefault(type, type);
  }

  /** Looks up the built-in table, matching the normalized code exactly. */
  public static Optional<AircraftProfile> builtIn(String typeCode) {
    return Optional.ofNullable(BUILT_IN.get(normalize(typeCode)));
  }

  /**
   * Detects training devices from the logged type and registration.
   *
   * @param aircraftType type as logged, e.g. {@code A320 FFS}
   * @param registration registration as logged, e.g. {@code FRASCA 142}
   * @return whether the entry is a simulator, FTD or FFS session
   */
  public static boolean isTrainingDevice(String aircraftType, String registration) {
    String type = upper(aircraftType);
    String reg = upper(registration);
    if (DEVICE_TYPE_MARKERS.stream().anyMatch(type::contains)) {
      return true;
    }
    if (DEVICE_REGISTRATION_MARKERS.stream().anyMatch(reg::contains)) {
      return true;
    }
    String[] words = reg.trim().split("\\s+");
    return words.length > 0 && words[0].equals("ATP");
  }

  /**
   * Maps a training device session back onto the aircraft type it replicates.
   *
   * @param aircraftType device type as logged
   * @param registration device registration as logged
   * @return base aircraft type code, or the stripped device type when no base is known
   */
  public static String deviceBaseType(String aircraftType, String registration) {
    String reg = upper(registration);
    for (Map.Entry<String, String> maker : DEVICE_BASE_TYPES.entrySet()) {
      if (reg.contains(maker.getKey()) || upper(aircraftType).contains(maker.getKey())) {
        return maker.getValue();
      }
    }
    String stripped = upper(aircraftType);
    for (String marker : DEVICE_TYPE_MARKERS) {
      stripped = stripped.replace(" " + marker, "").replace(marker, "");
    }
    return normalize(stripped);
  }

  private static String upper(String value) {
    return value == null ? "" : value.toUpperCase(Locale.ROOT);
  }

  private static Map.Entry<String, AircraftProfile> entry(String code, AircraftGroup group, boolean complex) {
    return Map.entry(code, new AircraftProfile(code, group, complex));
  }
}
