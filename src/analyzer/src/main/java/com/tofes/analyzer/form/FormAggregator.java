package com.tofes.analyzer.form;

import com.tofes.analyzer.aircraft.AircraftGroup;
import com.tofes.analyzer.classify.ClassifiedFlight;
import com.tofes.analyzer.classify.DayNight;
import com.tofes.analyzer.classify.FlightFlag;
import com.tofes.analyzer.classify.Role;
import com.tofes.analyzer.form.FormAccumulator.TypeBucket;
import com.tofes.analyzer.form.FormAccumulator.TypeKey;
import com.tofes.analyzer.logbook.FlightRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Folds classified flights into a {@link FormAccumulator} and finalizes it into {@link FormValues}.
 *
 * <p>Folding is commutative and associative: every accumulated quantity is an exact decimal sum,
 * a count, a set, or a maximum under a total order. The regulation 42(b) half credit is applied
 * once, at finalization.
 */
@Component
public class FormAggregator {
  private static final BigDecimal TWO = BigDecimal.valueOf(2);
  private static final BigDecimal KM_PER_NM = new BigDecimal("1.852");

  // Distance first (unknown sorts lowest), then duration; ties go to the earliest flight.
  static final Comparator<ClassifiedFlight> LONGEST_SOLO_XC =
      Comparator.<ClassifiedFlight, BigDecimal>comparing(
              flight -> flight.distance().orElse(BigDecimal.ONE.negate()))
          .thenComparing(flight -> flight.credit(Role.PIC))
          .thenComparing(flight -> flight.record().date(), Comparator.reverseOrder())
          .thenComparing(flight -> route(flight.record()), Comparator.reverseOrder())
          .thenComparing(flight -> flight.record().rowNumber(), Comparator.reverseOrder());

  private static final Comparator<ClassifiedFlight> BY_DATE =
      Comparator.<ClassifiedFlight, LocalDate>comparing(flight -> flight.record().date())
          .thenComparingInt(flight -> flight.record().rowNumber())
          .thenComparing(ClassifiedFlight::typeCode);

  /**
   * Adds one flight to the accumulator.
   *
   * @param acc accumulator, updated in place
   * @param flight classified flight, never modified
   * @return {@code acc}
   */
  public FormAccumulator fold(FormAccumulator acc, ClassifiedFlight flight) {
    if (flight.isTrainingDevice()) {
      acc.deviceSessions++;
      acc.deviceHoursByType.merge(flight.typeCode(), flight.deviceHours(), BigDecimal::add);
      return acc;
    }

    acc.flights++;
    TypeBucket bucket = acc.types.computeIfAbsent(
        new TypeKey(flight.typeCode(), flight.group()), key -> new TypeBucket());
    bucket.pic = bucket.pic.plus(flight.roles().get(Role.PIC));
    bucket.picCrossCountry = bucket.picCrossCountry.plus(flight.picCrossCountry());
    bucket.sic = bucket.sic.plus(flight.roles().get(Role.SIC));
    bucket.student = bucket.student.plus(flight.roles().get(Role.STUDENT));
    bucket.actualInstrument = bucket.actualInstrument.add(flight.actualInstrument());
    bucket.simulatedInstrument = bucket.simulatedInstrument.add(flight.simulatedInstrument());

    if (flight.group() == AircraftGroup.UNRESOLVED && !flight.typeCode().isEmpty()) {
      acc.unresolvedTypes.add(flight.typeCode());
    }

    acc.safetyPilotExcluded = acc.safetyPilotExcluded.add(flight.credit(Role.SAFETY_PILOT_EXCLUDED));
    acc.dualReceived = acc.dualReceived.add(flight.credit(Role.STUDENT));
    acc.dualInstrument = acc.dualInstrument.add(flight.dualInstrument());
    acc.nightHours = acc.nightHours.add(flight.creditedNight());
    acc.crossCountryAllRoles = acc.crossCountryAllRoles.add(flight.crossCountryHours());
    acc.nightLandings += flight.record().nightLandings();

    BigDecimal formTime = flight.formTime();
    if (flight.has(FlightFlag.COMPLEX)) {
      acc.complexHours = acc.complexHours.add(formTime);
      if (formTime.signum() > 0) {
        acc.complex.add(flight);
      }
    }
    if (flight.dualInstrument().signum() > 0) {
      acc.instrumentInstruction.add(flight);
    }
    if (flight.night(Role.PIC).signum() > 0) {
      acc.nightPic.add(flight);
    }
    if (flight.has(FlightFlag.SOLO) && flight.has(FlightFlag.CROSS_COUNTRY)) {
      acc.longestSoloCrossCountry = longer(acc.longestSoloCrossCountry, flight);
    }
    return acc;
  }

  /**
   * Combines two accumulators into a new one. Neither input is modified.
   *
   * @param left first accumulator
   * @param right second accumulator
   * @return accumulator equivalent to folding both inputs' flights
   */
  public FormAccumulator merge(FormAccumulator left, FormAccumulator right) {
    FormAccumulator merged = new FormAccumulator();
    addAll(merged, left);
    addAll(merged, right);
    return merged;
  }

  /**
   * Produces the form values. The accumulator is not modified, so repeated calls return equal
   * values.
   *
   * @param acc accumulator
   * @return finalized values
   */
  public FormValues finalizeForm(FormAccumulator acc) {
    Map<AircraftGroup, TypeBucket> byGroup = new EnumMap<>(AircraftGroup.class);
    List<FormValues.TypeRow> typeRows = new ArrayList<>();
    TypeBucket all = new TypeBucket();
    Map<String, TypeBucket> instrumentByType = new TreeMap<>();

    acc.types.entrySet().stream()
        .sorted(Map.Entry.comparingByKey(
            Comparator.comparing(TypeKey::group).thenComparing(TypeKey::typeCode)))
        .forEach(entry -> {
          TypeKey key = entry.getKey();
          TypeBucket bucket = entry.getValue();
          all.add(bucket);
          instrumentByType.computeIfAbsent(key.typeCode(), type -> new TypeBucket()).add(bucket);
          if (key.group() == AircraftGroup.UNRESOLVED) {
            return;
          }
          byGroup.computeIfAbsent(key.group(), group -> new TypeBucket()).add(bucket);
          typeRows.add(new FormValues.TypeRow(
              key.typeCode(),
              key.group(),
              bucket.formTotal(),
              bucket.pic,
              bucket.picCrossCountry,
              bucket.sic,
              bucket.student));
        });

    List<FormValues.GroupRow> groupRows = new ArrayList<>();
    for (AircraftGroup group : AircraftGroup.values()) {
      if (group == AircraftGroup.UNRESOLVED) {
        continue;
      }
      TypeBucket bucket = byGroup.getOrDefault(group, new TypeBucket());
      groupRows.add(new FormValues.GroupRow(
          group,
          group.formLetter(),
          bucket.formTotal(),
          bucket.pic,
          bucket.picCrossCountry,
          bucket.sic,
          bucket.student));
    }

    List<FormValues.InstrumentRow> instrumentRows = instrumentRows(instrumentByType, acc);

    BigDecimal pic = all.pic.total();
    BigDecimal sic = all.sic.total();
    BigDecimal student = all.student.total();
    BigDecimal sicHalfCredit = sic.divide(TWO);
    BigDecimal deviceTotal = acc.deviceHoursByType.values().stream()
        .reduce(BigDecimal.ZERO, BigDecimal::add);
    FormValues.Totals totals = new FormValues.Totals(
        pic,
        sic,
        student,
        pic.add(sic).add(student),
        sicHalfCredit,
        pic.add(sicHalfCredit).add(student),
        acc.safetyPilotExcluded,
        deviceTotal,
        acc.flights,
        acc.deviceSessions);

    FormValues.CplFields cpl = new FormValues.CplFields(
        all.picCrossCountry.total(),
        acc.dualReceived,
        acc.dualInstrument,
        acc.nightLandings,
        acc.nightHours,
        longestSoloCrossCountry(acc.longestSoloCrossCountry),
        acc.complexHours);

    FormValues.AtplFields atpl = new FormValues.AtplFields(
        acc.crossCountryAllRoles,
        all.picCrossCountry.night(),
        all.actualInstrument.add(all.simulatedInstrument));

    FormValues.CplFlightLists lists = new FormValues.CplFlightLists(
        listing(acc.instrumentInstruction, ClassifiedFlight::dualInstrument),
        listing(acc.nightPic, flight -> flight.night(Role.PIC)),
        listing(acc.complex, ClassifiedFlight::formTime));

    return new FormValues(
        List.copyOf(groupRows),
        List.copyOf(typeRows),
        instrumentRows,
        totals,
        cpl,
        atpl,
        lists,
        List.copyOf(acc.unresolvedTypes));
  }

  private static List<FormValues.InstrumentRow> instrumentRows(
      Map<String, TypeBucket> instrumentByType, FormAccumulator acc) {
    Map<String, FormValues.InstrumentRow> rows = new TreeMap<>();
    instrumentByType.forEach((type, bucket) -> {
      if (bucket.actualInstrument.signum() > 0 || bucket.simulatedInstrument.signum() > 0) {
        rows.put(type, new FormValues.InstrumentRow(
            type, bucket.actualInstrument, bucket.simulatedInstrument, BigDecimal.ZERO));
      }
    });
    acc.deviceHoursByType.forEach((type, hours) -> rows.merge(
        type,
        new FormValues.InstrumentRow(type, BigDecimal.ZERO, BigDecimal.ZERO, hours),
        (flown, device) -> new FormValues.InstrumentRow(
            type, flown.actual(), flown.simulatedInAir(), flown.trainingDevice().add(device.trainingDevice()))));
    return List.copyOf(rows.values());
  }

  private static void addAll(FormAccumulator target, FormAccumulator source) {
    source.types.forEach((key, bucket) ->
        target.types.computeIfAbsent(key, k -> new TypeBucket()).add(bucket));
    source.deviceHoursByType.forEach((type, hours) ->
        target.deviceHoursByType.merge(type, hours, BigDecimal::add));
    target.unresolvedTypes.addAll(source.unresolvedTypes);
    target.safetyPilotExcluded = target.safetyPilotExcluded.add(source.safetyPilotExcluded);
    target.dualReceived = target.dualReceived.add(source.dualReceived);
    target.dualInstrument = target.dualInstrument.add(source.dualInstrument);
    target.nightHours = target.nightHours.add(source.nightHours);
    target.complexHours = target.complexHours.add(source.complexHours);
    target.crossCountryAllRoles = target.crossCountryAllRoles.add(source.crossCountryAllRoles);
    target.nightLandings += source.nightLandings;
    target.flights += source.flights;
    target.deviceSessions += source.deviceSessions;
    if (source.longestSoloCrossCountry != null) {
      target.longestSoloCrossCountry = longer(target.longestSoloCrossCountry, source.longestSoloCrossCountry);
    }
    target.instrumentInstruction.addAll(source.instrumentInstruction);
    target.nightPic.addAll(source.nightPic);
    target.complex.addAll(source.complex);
  }

  private static ClassifiedFlight longer(ClassifiedFlight current, ClassifiedFlight candidate) {
    if (current == null) {
      return candidate;
    }
    return LONGEST_SOLO_XC.compare(candidate, current) > 0 ? candidate : current;
  }

  private static FormValues.LongestSoloCrossCountry longestSoloCrossCountry(ClassifiedFlight flight) {
    if (flight == null) {
      return null;
    }
    BigDecimal distanceNm = flight.distanceNm();
    BigDecimal distanceKm = distanceNm == null
        ? null
        : distanceNm.multiply(KM_PER_NM).setScale(1, RoundingMode.HALF_UP);
    return new FormValues.LongestSoloCrossCountry(
        flight.record().date(),
        flight.credit(Role.PIC),
        distanceNm,
        distanceKm,
        route(flight.record()));
  }

  private static List<FormValues.FlightListing> listing(
      List<ClassifiedFlight> flights, Function<ClassifiedFlight, BigDecimal> hours) {
    return flights.stream()
        .sorted(BY_DATE)
        .map(flight -> new FormValues.FlightListing(
            flight.record().rowNumber(),
            flight.record().date(),
            route(flight.record()),
            flight.typeCode(),
            flight.record().registration(),
            hours.apply(flight)))
        .toList();
  }

  private static String route(FlightRecord record) {
    return record.from() + "-" + record.to();
  }
}
