package com.tofes.analyzer.service;

import com.tofes.analyzer.column.CanonicalField;
import java.util.List;
import java.util.Set;

/**
 * Raised when no required column could be resolved, so no record can be produced at all.
 *
 * <p>Mapped to HTTP 422 by the API exception handler.
 */
public class UnusableMappingException extends RuntimeException {
  private final List<String> headers;

  /**
   * Creates the exception.
   *
   * @param headers source headers that were offered
   * @param missing required fields that could not be resolved
   */
  public UnusableMappingException(List<String> headers, Set<CanonicalField> missing) {
    super("No required column could be resolved (missing: "
        + missing.stream().map(CanonicalField::displayName).toList() + ")");
    this.headers = List.copyOf(headers);
  }

  public List<String> getHeaders() {
    return headers;
  }
}
