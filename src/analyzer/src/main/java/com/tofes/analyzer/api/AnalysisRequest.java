package com.tofes.analyzer.api;

import com.tofes.analyzer.column.ColumnMapping;
import com.tofes.analyzer.logbook.LogbookTable;
import com.tofes.analyzer.logbook.RawRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request body of {@code POST /api/logbook/analyze}: an already decoded logbook table.
 *
 * <p>The header row counts as source row 1, so the first data row is reported as row 2.
 *
 * @param headers header cells in column order
 * @param rows data rows, each a list of cells in column order
 * @param mapping optional explicit mapping from field name to header name or 0-based index
 */
public record AnalysisRequest(
    List<String> headers,
    List<List<String>> rows,
    Map<String, String> mapping) {

  private static final int FIRST_DATA_ROW = 2;

  LogbookTable toTable() {
    if (headers == null || headers.isEmpty()) {
      throw new BadRequestException("headers must not be empty");
    }
    List<RawRow> rawRows = new ArrayList<>();
    if (rows != null) {
      for (int i = 0; i < rows.size(); i++) {
        List<String> cells = rows.get(i);
        rawRows.add(RawRow.of(FIRST_DATA_ROW + i, cells == null ? List.of() : cells));
      }
    }
    return new LogbookTable(headers, rawRows);
  }

  ColumnMapping toMapping() {
    try {
      return ColumnMapping.fromText(mapping);
    } catch (IllegalArgumentException ex) {
      throw new BadRequestException("invalid mapping: " + ex.getMessage());
    }
  }
}
