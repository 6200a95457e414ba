package com.tofes.analyzer.form;

import com.tofes.analyzer.aircraft.AircraftGroup;
import com.tofes.analyzer.classify.DayNight;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Finalized summary form values.
 *
 * <p>Hours are exact decimal sums; rounding for display belongs to the form writer.
 *
 * @param groupRows Table 1 rows for groups A-D, always four, in group order
 * @param typeRows Table 1 rows per resolved aircraft type, ordered by group then type
 * @param instrumentRows Table 2 rows per aircraft type, ordered by type
 * @param totals role totals and the regulation 42(b) overall total
 * @param cpl commercial pilot licence fields
 * @param atpl airline transport pilot licence fields
 * @param cplLists CPL Table 2 flight lists
 * @param unresolvedAircraftTypes type codes whose group could not be determined, sorted
 */
public record FormValues(
    List<GroupRow> groupRows,
    List<TypeRow> typeRows,
    List<InstrumentRow> instrumentRows,
    Totals totals,
    CplFields cpl,
    AtplFields atpl,
    CplFlightLists cplLists,
    List<String> unresolvedAircraftTypes) {

  /** Table 1 row for one aircraft group. */
  public record GroupRow(
      AircraftGroup group,
      String formLetter,
      BigDecimal formTotal,
      DayNight pic,
      DayNight picCrossCountry,
      DayNight sic,
      DayNight student) {}

  /** Table 1 row for one aircraft type. */
  public record TypeRow(
      String typeCode,
      AircraftGroup group,
      BigDecimal formTotal,
      DayNight pic,
      DayNight picCrossCountry,
      DayNight sic,
      DayNight student) {}

  /** Table 2 instrument row for one aircraft type; device hours are mapped onto the replicated type. */
  public record InstrumentRow(
      String typeCode,
      BigDecimal actual,
      BigDecimal simulatedInAir,
      BigDecimal trainingDevice) {}

  /**
   * Role totals over every folded flight, unresolved groups included.
   *
   * @param overall PIC + SIC/2 + Student
   */
  public record Totals(
      BigDecimal pic,
      BigDecimal sic,
      BigDecimal student,
      BigDecimal formTotal,
      BigDecimal sicHalfCredit,
      BigDecimal overall,
      BigDecimal safetyPilotExcluded,
      BigDecimal trainingDevice,
      int flights,
      int deviceSessions) {}

  public record CplFields(
      BigDecimal picCrossCountry,
      BigDecimal dualReceived,
      BigDecimal dualInstrument,
      int nightLandings,
      BigDecimal nightHours,
      LongestSoloCrossCountry longestSoloCrossCountry,
      BigDecimal complexOrMultiEngine) {}

  /** Longest solo cross-country flight; {@code distanceNm} and {@code distanceKm} are null when unknown. */
  public record LongestSoloCrossCountry(
      LocalDate date,
      BigDecimal hours,
      BigDecimal distanceNm,
      BigDecimal distanceKm,
      String route) {}

  public record AtplFields(
      BigDecimal crossCountryAllRoles,
      BigDecimal nightPicCrossCountry,
      BigDecimal instrumentInAircraft) {}

  public record CplFlightLists(
      List<FlightListing> instrumentInstruction,
      List<FlightListing> nightPic,
      List<FlightListing> complex) {}

  /** One flight as printed in a CPL Table 2 list. */
  public record FlightListing(
      int rowNumber,
      LocalDate date,
      String route,
      String typeCode,
      String registration,
      BigDecimal hours) {}
}
