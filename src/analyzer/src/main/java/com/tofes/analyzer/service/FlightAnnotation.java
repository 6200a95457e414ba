package com.tofes.analyzer.service;

import com.tofes.analyzer.classify.ClassifiedFlight;
import com.tofes.analyzer.classify.FlightFlag;
import com.tofes.analyzer.classify.Role;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Per-flight CAAI classification, as appended to an annotated logbook.
 *
 * @param rowNumber 1-based source row number
 * @param date flight date
 * @param typeCode normalized aircraft type
 * @param group Hebrew group letter, {@code SIM} for device sessions, empty when unresolved
 * @param role dominant credited role label
 * @param dayHours credited day hours
 * @param nightHours credited night hours
 * @param crossCountry cross-country flag
 * @param trainingDevice device session flag
 * @param complex complex or multi-engine flag
 * @param dualInstrument instrument hours under instruction
 */
public record FlightAnnotation(
    int rowNumber,
    LocalDate date,
    String typeCode,
    String group,
    String role,
    BigDecimal dayHours,
    BigDecimal nightHours,
    boolean crossCountry,
    boolean trainingDevice,
    boolean complex,
    BigDecimal dualInstrument) {

  public static FlightAnnotation of(ClassifiedFlight flight) {
    boolean device = flight.isTrainingDevice();
    BigDecimal day = BigDecimal.ZERO;
    BigDecimal night = BigDecimal.ZERO;
    for (Role role : Role.values()) {
      if (role != Role.SAFETY_PILOT_EXCLUDED) {
        day = day.add(flight.day(role));
        night = night.add(flight.night(role));
      }
    }
    return new FlightAnnotation(
        flight.record().rowNumber(),
        flight.record().date(),
        flight.typeCode(),
        device ? "SIM" : flight.group().formLetter(),
        roleLabel(flight),
        day,
        night,
        flight.has(FlightFlag.CROSS_COUNTRY),
        device,
        flight.has(FlightFlag.COMPLEX),
        flight.dualInstrument());
  }

  private static String roleLabel(ClassifiedFlight flight) {
    if (flight.isTrainingDevice()) {
      return "Device";
    }
    if (flight.credit(Role.STUDENT).signum() > 0 || flight.has(FlightFlag.UNDER_INSTRUCTION)) {
      return "Student";
    }
    if (flight.has(FlightFlag.SAFETY_PILOT)) {
      return "Safety Pilot";
    }
    if (flight.credit(Role.SIC).compareTo(flight.credit(Role.PIC)) > 0) {
      return "SIC";
    }
    if (flight.credit(Role.PIC).signum() > 0) {
      return "PIC";
    }
    return "";
  }
}
