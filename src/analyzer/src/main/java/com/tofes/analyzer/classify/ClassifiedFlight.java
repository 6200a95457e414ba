package com.tofes.analyzer.classify;

import com.tofes.analyzer.aircraft.AircraftGroup;
import com.tofes.analyzer.logbook.FlightRecord;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A flight after the CAAI rule pipeline.
 *
 * <p>Every {@link Role} has an entry in {@code roles}; the sum of all role credits never exceeds
 * the record's total time. Training device sessions carry no role credit, only device hours.
 *
 * @param record the normalized source record, unchanged
 * @param typeCode normalized aircraft type (the replicated aircraft for device sessions)
 * @param group CAAI group of the aircraft
 * @param roles day/night credit per role
 * @param picCrossCountry day/night PIC cross-country credit
 * @param crossCountryHours cross-country hours in any role
 * @param distanceNm route distance used for the cross-country test, {@code null} when unknown
 * @param actualInstrument actual instrument hours in the aircraft
 * @param simulatedInstrument simulated (hood) instrument hours in the aircraft
 * @param picInstrument actual instrument hours that qualify as PIC instrument time
 * @param dualInstrument instrument hours flown under instruction
 * @param deviceHours training device hours
 * @param flags derived facts
 * @param advisories clamp notes, empty for consistent rows
 */
public record ClassifiedFlight(
    FlightRecord record,
    String typeCode,
    AircraftGroup group,
    Map<Role, DayNight> roles,
    DayNight picCrossCountry,
    BigDecimal crossCountryHours,
    BigDecimal distanceNm,
    BigDecimal actualInstrument,
    BigDecimal simulatedInstrument,
    BigDecimal picInstrument,
    BigDecimal dualInstrument,
    BigDecimal deviceHours,
    Set<FlightFlag> flags,
    List<String> advisories) {

  public ClassifiedFlight {
    Map<Role, DayNight> copy = new EnumMap<>(Role.class);
    for (Role role : Role.values()) {
      copy.put(role, roles.getOrDefault(role, DayNight.ZERO));
    }
    roles = Collections.unmodifiableMap(copy);
    flags = flags.isEmpty()
        ? Collections.unmodifiableSet(EnumSet.noneOf(FlightFlag.class))
        : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    advisories = List.copyOf(advisories);
  }

  public BigDecimal credit(Role role) {
    return roles.get(role).total();
  }

  public BigDecimal day(Role role) {
    return roles.get(role).day();
  }

  public BigDecimal night(Role role) {
    return roles.get(role).night();
  }

  /** Sum of all role credits, safety pilot exclusion included. */
  public BigDecimal roleSum() {
    BigDecimal sum = BigDecimal.ZERO;
    for (DayNight credit : roles.values()) {
      sum = sum.add(credit.total());
    }
    return sum;
  }

  /** Form time of the flight: PIC + SIC + Student. */
  public BigDecimal formTime() {
    return credit(Role.PIC).add(credit(Role.SIC)).add(credit(Role.STUDENT));
  }

  /** Night hours carried by the credited roles. */
  public BigDecimal creditedNight() {
    return night(Role.PIC).add(night(Role.SIC)).add(night(Role.STUDENT));
  }

  public boolean has(FlightFlag flag) {
    return flags.contains(flag);
  }

  public boolean isTrainingDevice() {
    return has(FlightFlag.TRAINING_DEVICE);
  }

  public Optional<BigDecimal> distance() {
    return Optional.ofNullable(distanceNm);
  }
}
