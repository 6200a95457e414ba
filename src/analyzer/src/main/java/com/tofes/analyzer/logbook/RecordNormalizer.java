package com.tofes.analyzer.logbook;

import com.tofes.analyzer.column.CanonicalField;
import com.tofes.analyzer.column.ColumnResolution;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Converts one raw row into an immutable {@link FlightRecord}.
 *
 * <p>Rules:
 * <ul>
 *   <li>unmapped duration fields are zero; unparsable durations reject the row</li>
 *   <li>the date is always required and must parse</li>
 *   <li>a mapped required field other than the date that is blank rejects the row</li>
 *   <li>text fields are trimmed</li>
 * </ul>
 */
@Component
public class RecordNormalizer {
  private static final Set<CanonicalField> NON_BLANK = EnumSet.of(
      CanonicalField.FROM,
      CanonicalField.TO,
      CanonicalField.REGISTRATION,
      CanonicalField.AIRCRAFT_TYPE,
      CanonicalField.TOTAL_TIME);

  /**
   * Normalizes a row.
   *
   * @param row raw source row
   * @param resolution resolved column mapping
   * @return normalized record
   * @throws NormalizationException when a cell violates its field grammar
   */
  public FlightRecord normalize(RawRow row, ColumnResolution resolution) {
    int rowNumber = row.rowNumber();

    LocalDate date = parse(rowNumber, CanonicalField.DATE, cell(row, resolution, CanonicalField.DATE)
        .orElse(""), LogbookValues::parseDate);

    for (CanonicalField field : NON_BLANK) {
      Optional<String> value = cell(row, resolution, field);
      if (value.isPresent() && value.get().isBlank()) {
        throw new NormalizationException(rowNumber, field, value.get(), "required value is blank");
      }
    }

    Map<CanonicalField, BigDecimal> durations = new EnumMap<>(CanonicalField.class);
    for (CanonicalField field : CanonicalField.durations()) {
      Optional<String> value = cell(row, resolution, field);
      if (value.isPresent()) {
        durations.put(field, parse(rowNumber, field, value.get(), LogbookValues::parseHours));
      }
    }

    BigDecimal distance = cell(row, resolution, CanonicalField.DISTANCE)
        .map(value -> parse(rowNumber, CanonicalField.DISTANCE, value, LogbookValues::parseDistance))
        .orElse(null);

    int dayLandings = count(row, resolution, CanonicalField.DAY_LANDINGS);
    int nightLandings = count(row, resolution, CanonicalField.NIGHT_LANDINGS);

    return new FlightRecord(
        rowNumber,
        date,
        text(row, resolution, CanonicalField.FROM).toUpperCase(Locale.ROOT),
        text(row, resolution, CanonicalField.TO).toUpperCase(Locale.ROOT),
        text(row, resolution, CanonicalField.REGISTRATION),
        text(row, resolution, CanonicalField.AIRCRAFT_TYPE),
        text(row, resolution, CanonicalField.ENGINE_TYPE),
        text(row, resolution, CanonicalField.CLASS),
        durations,
        distance,
        dayLandings,
        nightLandings,
        text(row, resolution, CanonicalField.INSTRUCTOR),
        text(row, resolution, CanonicalField.REMARKS));
  }

  private static Optional<String> cell(RawRow row, ColumnResolution resolution, CanonicalField field) {
    return resolution.indexOf(field).map(index -> row.cell(index).trim());
  }

  private static String text(RawRow row, ColumnResolution resolution, CanonicalField field) {
    return cell(row, resolution, field).orElse("");
  }

  private static int count(RawRow row, ColumnResolution resolution, CanonicalField field) {
    return cell(row, resolution, field)
        .map(value -> parse(row.rowNumber(), field, value, LogbookValues::parseCount))
        .orElse(0);
  }

  private static <T> T parse(
      int rowNumber, CanonicalField field, String value, Function<String, T> parser) {
    try {
      return parser.apply(value);
    } catch (IllegalArgumentException ex) {
      throw new NormalizationException(rowNumber, field, value, ex.getMessage());
    }
  }
}
