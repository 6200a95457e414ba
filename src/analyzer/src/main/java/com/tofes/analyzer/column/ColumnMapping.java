package com.tofes.analyzer.column;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit mapping from canonical fields to source columns.
 *
 * <p>Holds at most one locator per field. Field names in the textual form that match no known
 * field are kept as {@link #unknownFieldNames()} so the resolver can report them.
 */
public final class ColumnMapping {
  private static final ColumnMapping EMPTY = new ColumnMapping(Map.of(), List.of());

  private final Map<CanonicalField, ColumnLocator> locators;
  private final List<String> unknownFieldNames;

  private ColumnMapping(Map<CanonicalField, ColumnLocator> locators, List<String> unknownFieldNames) {
    Map<CanonicalField, ColumnLocator> copy = new EnumMap<>(CanonicalField.class);
    copy.putAll(locators);
    this.locators = Collections.unmodifiableMap(copy);
    this.unknownFieldNames = List.copyOf(unknownFieldNames);
  }

  public static ColumnMapping empty() {
    return EMPTY;
  }

  public static ColumnMapping of(Map<CanonicalField, ColumnLocator> locators) {
    return new ColumnMapping(locators, List.of());
  }

  /**
   * Builds a mapping from its textual form, {@code field name -> header name or index}.
   *
   * @param entries raw entries, for example {@code "Total Time" -> "Block Hours"}
   * @return parsed mapping; {@code null} or empty input gives the empty mapping
   */
  public static ColumnMapping fromText(Map<String, String> entries) {
    if (entries == null || entries.isEmpty()) {
      return EMPTY;
    }
    Map<CanonicalField, ColumnLocator> locators = new EnumMap<>(CanonicalField.class);
    List<String> unknown = new ArrayList<>();
    entries.forEach((fieldName, locator) -> {
      Optional<CanonicalField> field = HeaderAliases.fieldNamed(fieldName);
      if (field.isEmpty() || locator == null || locator.isBlank()) {
        unknown.add(fieldName);
        return;
      }
      locators.put(field.get(), ColumnLocator.parse(locator));
    });
    return new ColumnMapping(locators, unknown);
  }

  public Optional<ColumnLocator> locatorFor(CanonicalField field) {
    return Optional.ofNullable(locators.get(field));
  }

  public Map<CanonicalField, ColumnLocator> locators() {
    return locators;
  }

  public List<String> unknownFieldNames() {
    return unknownFieldNames;
  }

  public boolean isEmpty() {
    return locators.isEmpty() && unknownFieldNames.isEmpty();
  }
}
