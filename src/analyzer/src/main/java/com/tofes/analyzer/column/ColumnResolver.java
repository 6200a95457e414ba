package com.tofes.analyzer.column;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Maps raw logbook headers to {@link CanonicalField}s.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>explicit mapping entries (by header name or index)</li>
 *   <li>exact alias match on normalized headers</li>
 *   <li>containment alias match for fields still unmapped (aliases of 3+ characters)</li>
 * </ol>
 *
 * <p>Each source column feeds at most one field. Missing required fields are reported, never
 * defaulted.
 */
@Component
public class ColumnResolver {
  private static final int MIN_CONTAINMENT_LENGTH = 3;

  /**
   * Resolves headers using aliases only.
   *
   * @param rawHeaders ordered source headers
   * @return resolution with deficiency report
   */
  public ColumnResolution resolve(List<String> rawHeaders) {
    return resolve(rawHeaders, ColumnMapping.empty());
  }

  /**
   * Resolves headers, letting explicit entries take precedence over alias detection.
   *
   * @param rawHeaders ordered source headers
   * @param explicitMapping explicit entries, may be {@code null}
   * @return resolution with deficiency report
   */
  public ColumnResolution resolve(List<String> rawHeaders, ColumnMapping explicitMapping) {
    List<String> headers = rawHeaders == null ? List.of() : rawHeaders;
    ColumnMapping explicit = explicitMapping == null ? ColumnMapping.empty() : explicitMapping;
    List<String> normalized = headers.stream().map(HeaderAliases::normalize).toList();

    Map<CanonicalField, Integer> columns = new EnumMap<>(CanonicalField.class);
    Set<Integer> used = new HashSet<>();
    List<String> warnings = new ArrayList<>();

    for (String unknown : explicit.unknownFieldNames()) {
      warnings.add("Unknown field in column mapping: '" + unknown + "'");
    }

    explicit.locators().forEach((field, locator) -> {
      Optional<Integer> index = locate(locator, normalized);
      if (index.isEmpty()) {
        warnings.add("Column " + locator + " for " + field.displayName() + " not found in headers");
        return;
      }
      columns.put(field, index.get());
      used.add(index.get());
    });

    matchExact(normalized, columns, used);
    matchContained(normalized, columns, used);

    Set<CanonicalField> unresolvedRequired = EnumSet.noneOf(CanonicalField.class);
    Set<CanonicalField> unresolvedRecommended = EnumSet.noneOf(CanonicalField.class);
    for (CanonicalField field : CanonicalField.values()) {
      if (columns.containsKey(field)) {
        continue;
      }
      if (field.isRequired()) {
        unresolvedRequired.add(field);
      } else if (field.isRecommended()) {
        unresolvedRecommended.add(field);
      }
    }

    List<String> unmappedHeaders = new ArrayList<>();
    for (int i = 0; i < headers.size(); i++) {
      String header = headers.get(i);
      if (!used.contains(i) && header != null && !header.isBlank()) {
        unmappedHeaders.add(header.trim());
      }
    }

    return new ColumnResolution(
        columns, unresolvedRequired, unresolvedRecommended, unmappedHeaders, warnings);
  }

  private static Optional<Integer> locate(ColumnLocator locator, List<String> normalized) {
    if (locator.isPositional()) {
      return Optional.of(locator.index());
    }
    String wanted = HeaderAliases.normalize(locator.name());
    if (wanted.isEmpty()) {
      return Optional.empty();
    }
    for (int i = 0; i < normalized.size(); i++) {
      if (normalized.get(i).equals(wanted)) {
        return Optional.of(i);
      }
    }
    for (int i = 0; i < normalized.size(); i++) {
      if (normalized.get(i).contains(wanted)) {
        return Optional.of(i);
      }
    }
    return Optional.empty();
  }

  private static void matchExact(
      List<String> normalized, Map<CanonicalField, Integer> columns, Set<Integer> used) {
    for (CanonicalField field : CanonicalField.values()) {
      if (columns.containsKey(field)) {
        continue;
      }
      for (String alias : HeaderAliases.aliasesOf(field)) {
        String wanted = HeaderAliases.normalize(alias);
        int index = firstUnused(normalized, used, header -> header.equals(wanted));
        if (index >= 0) {
          columns.put(field, index);
          used.add(index);
          break;
        }
      }
    }
  }

  private static void matchContained(
      List<String> normalized, Map<CanonicalField, Integer> columns, Set<Integer> used) {
    for (CanonicalField field : CanonicalField.values()) {
      if (columns.containsKey(field)) {
        continue;
      }
      for (String alias : HeaderAliases.aliasesOf(field)) {
        String wanted = HeaderAliases.normalize(alias);
        if (wanted.length() < MIN_CONTAINMENT_LENGTH) {
          continue;
        }
        int index = firstUnused(normalized, used, header ->
            header.contains(wanted)
                || (header.length() >= MIN_CONTAINMENT_LENGTH && wanted.contains(header)));
        if (index >= 0) {
          columns.put(field, index);
          used.add(index);
          break;
        }
      }
    }
  }

  private static int firstUnused(
      List<String> normalized, Set<Integer> used, Predicate<String> matches) {
    for (int i = 0; i < normalized.size(); i++) {
      if (used.contains(i) || normalized.get(i).isEmpty()) {
        continue;
      }
      if (matches.test(normalized.get(i))) {
        return i;
      }
    }
    return -1;
  }
}
