package com.tofes.analyzer.service;

import com.tofes.analyzer.logbook.NormalizationException;

/**
 * A rejected source row.
 *
 * @param rowNumber 1-based source row number
 * @param field display name of the offending field
 * @param value offending raw value
 * @param message reason, including row and field
 */
public record RowError(int rowNumber, String field, String value, String message) {

  public static RowError from(NormalizationException ex) {
    return new RowError(ex.getRowNumber(), ex.getField().displayName(), ex.getValue(), ex.getMessage());
  }
}
