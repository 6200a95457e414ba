package com.tofes.analyzer.logbook;

import com.tofes.analyzer.column.CanonicalField;

/**
 * Raised when a row's cell violates the accepted grammar for its field.
 *
 * <p>The row is rejected and reported; the batch continues with the next row.
 */
public class NormalizationException extends RuntimeException {
  private final int rowNumber;
  private final CanonicalField field;
  private final String value;

  /**
   * Creates a row rejection.
   *
   * @param rowNumber 1-based source row number
   * @param field offending field
   * @param value offending raw value
   * @param message human-readable reason
   */
  public NormalizationException(int rowNumber, CanonicalField field, String value, String message) {
    super("Row " + rowNumber + ", " + field.displayName() + ": " + message);
    this.rowNumber = rowNumber;
    this.field = field;
    this.value = value;
  }

  public int getRowNumber() {
    return rowNumber;
  }

  public CanonicalField getField() {
    return field;
  }

  public String getValue() {
    return value;
  }
}
