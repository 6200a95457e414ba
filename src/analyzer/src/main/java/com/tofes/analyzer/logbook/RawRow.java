package com.tofes.analyzer.logbook;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One undecoded source row as produced by a source reader.
 *
 * @param rowNumber 1-based row number in the source, used in error reports
 * @param cells raw cell text by 0-based column position; absent positions are empty cells
 */
public record RawRow(int rowNumber, Map<Integer, String> cells) {

  public RawRow {
    cells = Map.copyOf(cells);
  }

  /**
   * Builds a row from positional cell values; {@code null} cells are dropped.
   *
   * @param rowNumber 1-based source row number
   * @param values cell values in column order
   * @return raw row
   */
  public static RawRow of(int rowNumber, List<String> values) {
    Map<Integer, String> cells = new HashMap<>();
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i) != null) {
        cells.put(i, values.get(i));
      }
    }
    return new RawRow(rowNumber, cells);
  }

  /** Returns the raw text at a position, empty when the cell is absent. */
  public String cell(int index) {
    return cells.getOrDefault(index, "");
  }

  public boolean isBlank() {
    return cells.values().stream().allMatch(String::isBlank);
  }
}
