package com.tofes.analyzer.classify;

import com.tofes.analyzer.aircraft.AircraftGroup;
import com.tofes.analyzer.aircraft.AircraftProfile;
import com.tofes.analyzer.column.CanonicalField;
import com.tofes.analyzer.logbook.FlightRecord;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable classification-in-progress for one flight.
 *
 * <p>Each pipeline step reads the record and the state left by earlier steps and updates the
 * draft in place. Not thread-safe; one draft per flight.
 */
final class ClassificationDraft {
  final FlightRecord record;
  final AircraftGroup group;
  final boolean complexType;
  final BigDecimal distanceNm;
  final BigDecimal total;

  String typeCode;
  final Map<Role, BigDecimal> credits = new EnumMap<>(Role.class);
  final Map<Role, DayNight> split = new EnumMap<>(Role.class);
  BigDecimal picCrossCountry = BigDecimal.ZERO;
  DayNight picCrossCountrySplit = DayNight.ZERO;
  BigDecimal crossCountryHours = BigDecimal.ZERO;
  BigDecimal actualInstrument = BigDecimal.ZERO;
  BigDecimal simulatedInstrument = BigDecimal.ZERO;
  BigDecimal picInstrument = BigDecimal.ZERO;
  BigDecimal dualInstrument = BigDecimal.ZERO;
  BigDecimal deviceHours = BigDecimal.ZERO;
  final Set<FlightFlag> flags = EnumSet.noneOf(FlightFlag.class);
  final List<String> advisories = new ArrayList<>();

  ClassificationDraft(FlightRecord record, AircraftProfile profile, BigDecimal distanceNm) {
    this.record = record;
    this.typeCode = profile.typeCode();
    this.group = profile.group();
    this.complexType = profile.complex();
    this.distanceNm = distanceNm;
    this.total = record.totalTime();
    for (Role role : Role.values()) {
      credits.put(role, BigDecimal.ZERO);
    }
  }

  BigDecimal hours(CanonicalField field) {
    return record.hours(field);
  }

  BigDecimal credit(Role role) {
    return credits.get(role);
  }

  void credit(Role role, BigDecimal hours) {
    credits.put(role, hours);
  }

  boolean is(FlightFlag flag) {
    return flags.contains(flag);
  }

  void flag(FlightFlag flag, boolean set) {
    if (set) {
      flags.add(flag);
    } else {
      flags.remove(flag);
    }
  }

  boolean isSingleEngine() {
    return group.isSingleEngine();
  }

  BigDecimal roleSum() {
    BigDecimal sum = BigDecimal.ZERO;
    for (BigDecimal credit : credits.values()) {
      sum = sum.add(credit);
    }
    return sum;
  }

  void advise(String note) {
    advisories.add("Row " + record.rowNumber() + ": " + note);
  }

  ClassifiedFlight toClassifiedFlight() {
    return new ClassifiedFlight(
        record,
        typeCode,
        group,
        split,
        picCrossCountrySplit,
        crossCountryHours,
        distanceNm,
        actualInstrument,
        simulatedInstrument,
        picInstrument,
        dualInstrument,
        deviceHours,
        flags,
        advisories);
  }
}
