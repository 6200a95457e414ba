package com.tofes.analyzer.logbook;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for the cell grammars found in logbook exports.
 *
 * <p>All parsers throw {@link IllegalArgumentException} with a client-facing message on values
 * outside their grammar.
 */
public final class LogbookValues {
  private static final Pattern DECIMAL = Pattern.compile("^(\\d+(\\.\\d*)?|\\.\\d+)$");
  private static final Pattern HOURS_MINUTES = Pattern.compile("^(\\d+):(\\d{1,2})$");
  private static final Pattern COMMA_DECIMAL = Pattern.compile("^(\\d+),(\\d+)$");
  private static final Pattern COUNT = Pattern.compile("^(\\d+)(\\.0*)?$");
  private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

  // Day-first before month-first: 03/04/2024 is 3 April.
  private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
      date("uuuu-M-d"),
      date("d/M/uuuu"),
      date("d-M-uuuu"),
      date("d.M.uuuu"),
      date("M/d/uuuu"),
      date("uuuu/M/d"),
      date("d MMM uuuu"),
      date("MMM d, uuuu"));

  private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
      date("uuuu-M-d HH:mm[:ss]"),
      date("uuuu-M-d'T'HH:mm[:ss]"));

  private LogbookValues() {}

  /**
   * Parses a duration as decimal hours.
   *
   * <p>Accepted, in order: plain decimal ({@code 1.5}), hours:minutes ({@code 1:30}), comma
   * decimal ({@code 1,5}). Blank is zero.
   *
   * @param raw raw cell text
   * @return non-negative hours
   */
  public static BigDecimal parseHours(String raw) {
    String value = raw == null ? "" : raw.trim();
    if (value.isEmpty()) {
      return BigDecimal.ZERO;
    }
    if (DECIMAL.matcher(value).matches()) {
      return new BigDecimal(value);
    }
    Matcher hoursMinutes = HOURS_MINUTES.matcher(value);
    if (hoursMinutes.matches()) {
      int minutes = Integer.parseInt(hoursMinutes.group(2));
      if (minutes >= 60) {
        throw new IllegalArgumentException("minutes must be below 60 in '" + value + "'");
      }
      BigDecimal fraction =
          BigDecimal.valueOf(minutes).divide(MINUTES_PER_HOUR, 2, RoundingMode.HALF_UP);
      return new BigDecimal(hoursMinutes.group(1)).add(fraction);
    }
    Matcher comma = COMMA_DECIMAL.matcher(value);
    if (comma.matches()) {
      return new BigDecimal(comma.group(1) + "." + comma.group(2));
    }
    throw new IllegalArgumentException(
        "'" + value + "' is not a duration (expected 1.5, 1:30 or 1,5)");
  }

  /**
   * Parses a flight date.
   *
   * @param raw raw cell text
   * @return parsed date
   */
  public static LocalDate parseDate(String raw) {
    String value = raw == null ? "" : raw.trim();
    if (value.isEmpty()) {
      throw new IllegalArgumentException("date is missing");
    }
    for (DateTimeFormatter format : DATE_FORMATS) {
      try {
        return LocalDate.parse(value, format);
      } catch (DateTimeParseException ignored) {
        // next grammar
      }
    }
    for (DateTimeFormatter format : DATE_TIME_FORMATS) {
      try {
        return LocalDateTime.parse(value, format).toLocalDate();
      } catch (DateTimeParseException ignored) {
        // next grammar
      }
    }
    throw new IllegalArgumentException("'" + value + "' is not a recognised date");
  }

  /**
   * Parses a count such as landings. Blank is zero; {@code 2.0} is accepted as 2.
   *
   * @param raw raw cell text
   * @return non-negative count
   */
  public static int parseCount(String raw) {
    String value = raw == null ? "" : raw.trim();
    if (value.isEmpty()) {
      return 0;
    }
    Matcher matcher = COUNT.matcher(value);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("'" + value + "' is not a whole number");
    }
    try {
      return Integer.parseInt(matcher.group(1));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("'" + value + "' is too large");
    }
  }

  /**
   * Parses a distance in nautical miles, ignoring grouping commas ({@code 1,250}).
   *
   * @param raw raw cell text
   * @return distance, or {@code null} when blank (unknown)
   */
  public static BigDecimal parseDistance(String raw) {
    String value = raw == null ? "" : raw.trim().replace(",", "");
    if (value.isEmpty()) {
      return null;
    }
    if (!DECIMAL.matcher(value).matches()) {
      throw new IllegalArgumentException("'" + raw.trim() + "' is not a distance");
    }
    return new BigDecimal(value);
  }

  private static DateTimeFormatter date(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);
  }
}
