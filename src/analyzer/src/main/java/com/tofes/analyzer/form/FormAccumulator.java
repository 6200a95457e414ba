package com.tofes.analyzer.form;

import com.tofes.analyzer.aircraft.AircraftGroup;
import com.tofes.analyzer.classify.ClassifiedFlight;
import com.tofes.analyzer.classify.DayNight;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Running sums for the summary form.
 *
 * <p>Only sums, counts, sets and an order-independent maximum are kept, so the final values do
 * not depend on the order flights were folded in. Lists are kept unordered and sorted at
 * finalization. Not thread-safe; use one accumulator per worker and {@link FormAggregator#merge}.
 */
public final class FormAccumulator {
  final Map<TypeKey, TypeBucket> types = new HashMap<>();
  final Map<String, BigDecimal> deviceHoursByType = new HashMap<>();
  final SortedSet<String> unresolvedTypes = new TreeSet<>();

  BigDecimal safetyPilotExcluded = BigDecimal.ZERO;
  BigDecimal dualReceived = BigDecimal.ZERO;
  BigDecimal dualInstrument = BigDecimal.ZERO;
  BigDecimal nightHours = BigDecimal.ZERO;
  BigDecimal complexHours = BigDecimal.ZERO;
  BigDecimal crossCountryAllRoles = BigDecimal.ZERO;
  int nightLandings;
  int flights;
  int deviceSessions;
  ClassifiedFlight longestSoloCrossCountry;

  final List<ClassifiedFlight> instrumentInstruction = new ArrayList<>();
  final List<ClassifiedFlight> nightPic = new ArrayList<>();
  final List<ClassifiedFlight> complex = new ArrayList<>();

  public FormAccumulator() {}

  /** Aircraft type within its group. */
  record TypeKey(String typeCode, AircraftGroup group) {}

  /** Table 1 and Table 2 sums for one aircraft type. */
  static final class TypeBucket {
    DayNight pic = DayNight.ZERO;
    DayNight picCrossCountry = DayNight.ZERO;
    DayNight sic = DayNight.ZERO;
    DayNight student = DayNight.ZERO;
    BigDecimal actualInstrument = BigDecimal.ZERO;
    BigDecimal simulatedInstrument = BigDecimal.ZERO;

    void add(TypeBucket other) {
      pic = pic.plus(other.pic);
      picCrossCountry = picCrossCountry.plus(other.picCrossCountry);
      sic = sic.plus(other.sic);
      student = student.plus(other.student);
      actualInstrument = actualInstrument.add(other.actualInstrument);
      simulatedInstrument = simulatedInstrument.add(other.simulatedInstrument);
    }

    BigDecimal formTotal() {
      return pic.total().add(sic.total()).add(student.total());
    }
  }
}
