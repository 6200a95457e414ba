package com.tofes.analyzer.column;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of column resolution: the usable mapping plus its deficiency report.
 *
 * @param columns canonical field to 0-based source column index
 * @param unresolvedRequired required fields with no source column
 * @param unresolvedRecommended recommended fields with no source column
 * @param unmappedHeaders non-blank source headers that map to no field
 * @param warnings explicit-mapping problems (unknown field names, headers not found)
 */
public record ColumnResolution(
    Map<CanonicalField, Integer> columns,
    Set<CanonicalField> unresolvedRequired,
    Set<CanonicalField> unresolvedRecommended,
    List<String> unmappedHeaders,
    List<String> warnings) {

  public ColumnResolution {
    Map<CanonicalField, Integer> columnsCopy = new EnumMap<>(CanonicalField.class);
    columnsCopy.putAll(columns);
    columns = Collections.unmodifiableMap(columnsCopy);
    unresolvedRequired = Collections.unmodifiableSet(copyOf(unresolvedRequired));
    unresolvedRecommended = Collections.unmodifiableSet(copyOf(unresolvedRecommended));
    unmappedHeaders = List.copyOf(unmappedHeaders);
    warnings = List.copyOf(warnings);
  }

  public Optional<Integer> indexOf(CanonicalField field) {
    return Optional.ofNullable(columns.get(field));
  }

  public boolean isMapped(CanonicalField field) {
    return columns.containsKey(field);
  }

  /** True when at least one required field resolved, so records can be produced at all. */
  public boolean isUsable() {
    return unresolvedRequired.size() < CanonicalField.required().size();
  }

  private static Set<CanonicalField> copyOf(Set<CanonicalField> fields) {
    return fields.isEmpty() ? EnumSet.noneOf(CanonicalField.class) : EnumSet.copyOf(fields);
  }
}
