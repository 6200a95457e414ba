package com.tofes.analyzer.logbook;

import java.util.List;

/**
 * A decoded logbook table: ordered headers and the data rows below them.
 *
 * @param headers raw header strings in column order
 * @param rows data rows, header row excluded
 */
public record LogbookTable(List<String> headers, List<RawRow> rows) {

  public LogbookTable {
    headers = headers == null
        ? List.of()
        : headers.stream().map(header -> header == null ? "" : header).toList();
    rows = rows == null ? List.of() : List.copyOf(rows);
  }
}
