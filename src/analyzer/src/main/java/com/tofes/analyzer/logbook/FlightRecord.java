package com.tofes.analyzer.logbook;

import com.tofes.analyzer.column.CanonicalField;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One normalized logbook flight.
 *
 * <p>Durations are decimal hours and never negative. Unmapped duration fields read as zero. The
 * distance is {@code null} when the source gave none, which means "unknown", not zero.
 *
 * @param rowNumber 1-based source row number
 * @param date flight date
 * @param from departure airport code
 * @param to arrival airport code
 * @param registration aircraft registration
 * @param aircraftType aircraft type code as logged
 * @param engineType engine metadata as logged (may be empty)
 * @param aircraftClass class metadata as logged (may be empty)
 * @param durations hours per duration field
 * @param distanceNm route distance in nautical miles, {@code null} when unknown
 * @param dayLandings day landing count
 * @param nightLandings night landing count
 * @param instructor instructor name, empty when flown without instructor
 * @param remarks free-text remarks
 */
public record FlightRecord(
    int rowNumber,
    LocalDate date,
    String from,
    String to,
    String registration,
    String aircraftType,
    String engineType,
    String aircraftClass,
    Map<CanonicalField, BigDecimal> durations,
    BigDecimal distanceNm,
    int dayLandings,
    int nightLandings,
    String instructor,
    String remarks) {

  public FlightRecord {
    Objects.requireNonNull(date, "date");
    from = nullToEmpty(from);
    to = nullToEmpty(to);
    registration = nullToEmpty(registration);
    aircraftType = nullToEmpty(aircraftType);
    engineType = nullToEmpty(engineType);
    aircraftClass = nullToEmpty(aircraftClass);
    instructor = nullToEmpty(instructor);
    remarks = nullToEmpty(remarks);

    Map<CanonicalField, BigDecimal> copy = new EnumMap<>(CanonicalField.class);
    durations.forEach((field, hours) -> {
      if (field.kind() != CanonicalField.Kind.DURATION) {
        throw new IllegalArgumentException(field + " is not a duration field");
      }
      if (hours.signum() < 0) {
        throw new IllegalArgumentException(field + " must not be negative");
      }
      copy.put(field, hours);
    });
    durations = Collections.unmodifiableMap(copy);

    if (distanceNm != null && distanceNm.signum() < 0) {
      throw new IllegalArgumentException("distance must not be negative");
    }
    if (dayLandings < 0 || nightLandings < 0) {
      throw new IllegalArgumentException("landing counts must not be negative");
    }
  }

  /** Returns the hours logged for a duration field, zero when absent. */
  public BigDecimal hours(CanonicalField field) {
    return durations.getOrDefault(field, BigDecimal.ZERO);
  }

  public BigDecimal totalTime() {
    return hours(CanonicalField.TOTAL_TIME);
  }

  public Optional<BigDecimal> distance() {
    return Optional.ofNullable(distanceNm);
  }

  public boolean hasInstructor() {
    return !instructor.isBlank();
  }

  public static Builder builder() {
    return new Builder();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  /** Fluent builder, mainly for source adapters and tests. */
  public static final class Builder {
    private int rowNumber;
    private LocalDate date = LocalDate.EPOCH;
    private String from = "";
    private String to = "";
    private String registration = "";
    private String aircraftType = "";
    private String engineType = "";
    private String aircraftClass = "";
    private final Map<CanonicalField, BigDecimal> durations = new EnumMap<>(CanonicalField.class);
    private BigDecimal distanceNm;
    private int dayLandings;
    private int nightLandings;
    private String instructor = "";
    private String remarks = "";

    private Builder() {}

    public Builder rowNumber(int rowNumber) {
      this.rowNumber = rowNumber;
      return this;
    }

    public Builder date(LocalDate date) {
      this.date = date;
      return this;
    }

    public Builder route(String from, String to) {
      this.from = from;
      this.to = to;
      return this;
    }

    public Builder registration(String registration) {
      this.registration = registration;
      return this;
    }

    public Builder aircraftType(String aircraftType) {
      this.aircraftType = aircraftType;
      return this;
    }

    public Builder engineType(String engineType) {
      this.engineType = engineType;
      return this;
    }

    public Builder aircraftClass(String aircraftClass) {
      this.aircraftClass = aircraftClass;
      return this;
    }

    public Builder hours(CanonicalField field, BigDecimal hours) {
      durations.put(field, hours);
      return this;
    }

    public Builder hours(CanonicalField field, String hours) {
      return hours(field, new BigDecimal(hours));
    }

    public Builder distanceNm(BigDecimal distanceNm) {
      this.distanceNm = distanceNm;
      return this;
    }

    public Builder landings(int day, int night) {
      this.dayLandings = day;
      this.nightLandings = night;
      return this;
    }

    public Builder instructor(String instructor) {
      this.instructor = instructor;
      return this;
    }

    public Builder remarks(String remarks) {
      this.remarks = remarks;
      return this;
    }

    public FlightRecord build() {
      return new FlightRecord(
          rowNumber,
          date,
          from,
          to,
          registration,
          aircraftType,
          engineType,
          aircraftClass,
          durations,
          distanceNm,
          dayLandings,
          nightLandings,
          instructor,
          remarks);
    }
  }
}
