package com.tofes.analyzer.column;

import java.text.Normalizer;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Static header alias dictionary (English and Hebrew) for logbook exports.
 *
 * <p>Aliases are listed in priority order: the first alias that matches a header wins.
 */
public final class HeaderAliases {
  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final Map<CanonicalField, List<String>> ALIASES = buildAliases();

  private HeaderAliases() {}

  /**
   * Returns the aliases for a field, in priority order.
   *
   * @param field canonical field
   * @return immutable alias list (never {@code null})
   */
  public static List<String> aliasesOf(CanonicalField field) {
    return ALIASES.getOrDefault(field, List.of());
  }

  /**
   * Normalizes a header for matching: NFKC compatibility folding (full-width digits, Hebrew
   * presentation forms), lower-case, punctuation replaced by spaces, whitespace collapsed.
   *
   * @param header raw header text
   * @return normalized text, empty for {@code null}
   */
  public static String normalize(String header) {
    if (header == null) {
      return "";
    }
    String folded = Normalizer.normalize(header, Normalizer.Form.NFKC);
    String lowered = folded.trim().toLowerCase(Locale.ROOT);
    String cleaned = NON_WORD.matcher(lowered).replaceAll(" ");
    return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
  }

  /**
   * Finds the canonical field named by a mapping key: enum name, display name, or any alias.
   *
   * @param name user-supplied field name
   * @return matching field when known
   */
  public static Optional<CanonicalField> fieldNamed(String name) {
    String normalized = normalize(name);
    if (normalized.isEmpty()) {
      return Optional.empty();
    }
    for (CanonicalField field : CanonicalField.values()) {
      if (normalize(field.name()).equals(normalized)
          || normalize(field.displayName()).equals(normalized)) {
        return Optional.of(field);
      }
    }
    for (CanonicalField field : CanonicalField.values()) {
      for (String alias : aliasesOf(field)) {
        if (normalize(alias).equals(normalized)) {
          return Optional.of(field);
        }
      }
    }
    return Optional.empty();
  }

  private static Map<CanonicalField, List<String>> buildAliases() {
    Map<CanonicalField, List<String>> aliases = new EnumMap<>(CanonicalField.class);
    aliases.put(CanonicalField.DATE, List.of(
        "date", "flight date", "flt date", "flight_date", "dep date", "departure date",
        "תאריך"));
    aliases.put(CanonicalField.FROM, List.of(
        "from", "departure", "dep", "origin", "route from", "dep airport", "departure airport",
        "depart", "מ-", "ממקום"));
    aliases.put(CanonicalField.TO, List.of(
        "to", "arrival", "arr", "dest", "destination", "route to", "arr airport",
        "arrival airport", "ל-", "למקום"));
    aliases.put(CanonicalField.REGISTRATION, List.of(
        "registration", "reg", "tail", "tail number", "tail no", "aircraft id", "ident",
        "aircraft ident", "a/c reg", "tail #", "n-number", "רישום", "סימן קריאה"));
    aliases.put(CanonicalField.AIRCRAFT_TYPE, List.of(
        "aircraft type", "type", "type code", "a/c type", "make/model", "aircraft", "ac type",
        "airplane type", "דגם כלי טיס", "דגם", "סוג מטוס"));
    aliases.put(CanonicalField.TOTAL_TIME, List.of(
        "total time", "total", "total flight time", "duration", "flight time", "block time",
        "total duration", "ttl time", "total hrs", "flight hours", "סה\"כ זמן", "זמן טיסה",
        "סה\"כ"));
    aliases.put(CanonicalField.PIC, List.of(
        "pic", "pilot in command", "p1", "pic time", "pic hours", "command", "טייס אחראי",
        "מפקד"));
    aliases.put(CanonicalField.SIC, List.of(
        "sic", "second in command", "co-pilot", "copilot", "p2", "sic time", "sic hours",
        "first officer", "טייס משנה"));
    aliases.put(CanonicalField.NIGHT, List.of(
        "night", "night time", "night hours", "nite", "לילה"));
    aliases.put(CanonicalField.CROSS_COUNTRY, List.of(
        "cross country", "xc", "x-country", "cc", "cross-country", "xcountry", "xc time",
        "חוצה ארץ"));
    aliases.put(CanonicalField.ACTUAL_INSTRUMENT, List.of(
        "actual instrument", "actual inst", "actual ifr", "act inst", "actual imc", "imc",
        "מכשירים בפועל"));
    aliases.put(CanonicalField.SIMULATED_INSTRUMENT, List.of(
        "simulated instrument", "sim inst", "hood", "sim ifr", "simulated inst",
        "sim instrument", "מכשירים מדומה"));
    aliases.put(CanonicalField.DUAL_RECEIVED, List.of(
        "dual received", "dual recv", "dual", "instruction received", "dual rcvd",
        "training received", "הדרכה שהתקבלה"));
    aliases.put(CanonicalField.DUAL_GIVEN, List.of(
        "dual given", "instruction given", "cfi time", "instructor time", "dual gvn",
        "training given", "הדרכה שניתנה"));
    aliases.put(CanonicalField.SOLO, List.of(
        "solo", "solo time", "solo hours", "סולו"));
    aliases.put(CanonicalField.MULTI_PILOT, List.of(
        "multi-pilot", "multi pilot", "multipilot", "multi crew", "multi-crew", "multicrew",
        "mp", "רב טייס"));
    aliases.put(CanonicalField.SIMULATOR, List.of(
        "simulator", "sim", "ftd", "ffs", "sim time", "training device", "flight sim",
        "סימולטור"));
    aliases.put(CanonicalField.DAY_LANDINGS, List.of(
        "day landings", "day ldg", "ldg day", "day land", "landings day", "day ldgs",
        "נחיתות יום"));
    aliases.put(CanonicalField.NIGHT_LANDINGS, List.of(
        "night landings", "night ldg", "ldg night", "night land", "landings night",
        "night ldgs", "נחיתות לילה"));
    aliases.put(CanonicalField.INSTRUCTOR, List.of(
        "instructor", "cfi name", "instructor name", "flight instructor", "מדריך"));
    aliases.put(CanonicalField.REMARKS, List.of(
        "remarks", "comments", "notes", "remark", "הערות"));
    aliases.put(CanonicalField.ENGINE_TYPE, List.of(
        "engine type", "engine", "eng type", "powerplant", "סוג מנוע"));
    aliases.put(CanonicalField.CLASS, List.of(
        "class", "aircraft class", "a/c class", "סיווג"));
    aliases.put(CanonicalField.DISTANCE, List.of(
        "distance", "distance (nm)", "dist", "nm", "distance nm", "nautical miles", "מרחק"));
    return Collections.unmodifiableMap(aliases);
  }
}
