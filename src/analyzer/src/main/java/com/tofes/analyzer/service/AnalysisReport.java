package com.tofes.analyzer.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tofes.analyzer.column.ColumnResolution;
import com.tofes.analyzer.form.FormValues;
import java.util.List;

/**
 * Outcome of one analysis run: the best-effort form values plus every problem met on the way.
 *
 * @param pilotName configured pilot name for the form header
 * @param columns column resolution with its deficiency report
 * @param rowsRead non-blank data rows seen
 * @param rowErrors rejected rows
 * @param advisories classification clamp notes
 * @param flights per-flight classification
 * @param form finalized form values
 */
public record AnalysisReport(
    String pilotName,
    ColumnResolution columns,
    int rowsRead,
    List<RowError> rowErrors,
    List<String> advisories,
    List<FlightAnnotation> flights,
    FormValues form) {

  public AnalysisReport {
    rowErrors = List.copyOf(rowErrors);
    advisories = List.copyOf(advisories);
    flights = List.copyOf(flights);
  }

  @JsonProperty("rowsRejected")
  public int rowsRejected() {
    return rowErrors.size();
  }

  /** True when the form may be incomplete: missing columns, rejected rows or unresolved aircraft. */
  public boolean isDegraded() {
    return !columns.unresolvedRequired().isEmpty()
        || !rowErrors.isEmpty()
        || !form.unresolvedAircraftTypes().isEmpty();
  }
}
