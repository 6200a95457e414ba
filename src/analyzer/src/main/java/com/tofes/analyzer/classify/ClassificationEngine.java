package com.tofes.analyzer.classify;

import com.tofes.analyzer.aircraft.AircraftGroup;
import com.tofes.analyzer.aircraft.AircraftGroupLookup;
import com.tofes.analyzer.aircraft.AircraftProfile;
import com.tofes.analyzer.aircraft.AircraftTypes;
import com.tofes.analyzer.column.CanonicalField;
import com.tofes.analyzer.logbook.FlightRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Applies the CAAI crediting rules to normalized flights.
 *
 * <p>The rules run as an ordered pipeline over a {@link ClassificationDraft}; later steps may
 * override what earlier ones assigned. Classification is a pure function of the record, the
 * aircraft lookup and the distance provider, and never throws for a valid record: inconsistent
 * credits are clamped and reported as advisories.
 */
public class ClassificationEngine {
  private static final String SAFETY_PILOT = "safety pilot";
  private static final int NIGHT_SCALE = 4;

  private final BigDecimal crossCountryThresholdNm;
  private final DistanceProvider distanceProvider;
  private final List<UnaryOperator<ClassificationDraft>> pipeline;

  /**
   * Creates an engine.
   *
   * @param crossCountryThresholdNm a flight longer than this distance is cross-country
   * @param distanceProvider fallback for rows without a recorded distance
   */
  public ClassificationEngine(BigDecimal crossCountryThresholdNm, DistanceProvider distanceProvider) {
    this.crossCountryThresholdNm = Objects.requireNonNull(crossCountryThresholdNm, "crossCountryThresholdNm");
    this.distanceProvider = Objects.requireNonNull(distanceProvider, "distanceProvider");
    this.pipeline = List.of(
        ClassificationEngine::detectSafetyPilot,
        ClassificationEngine::determineStudent,
        ClassificationEngine::determinePic,
        ClassificationEngine::determineSic,
        this::determineCrossCountry,
        ClassificationEngine::recordActualInstrument,
        ClassificationEngine::recordSimulatedInstrument,
        ClassificationEngine::detectTrainingDevice,
        ClassificationEngine::flagComplex,
        ClassificationEngine::enforceTotalTime,
        ClassificationEngine::splitNight);
  }

  /**
   * Classifies one flight.
   *
   * @param record normalized flight
   * @param lookup aircraft group lookup
   * @return classified flight
   */
  public ClassifiedFlight classify(FlightRecord record, AircraftGroupLookup lookup) {
    AircraftProfile profile =
        lookup.lookup(record.aircraftType(), record.engineType(), record.aircraftClass());
    BigDecimal distance = record.distance()
        .or(() -> distanceProvider.distanceNm(record.from(), record.to()))
        .orElse(null);

    ClassificationDraft draft = new ClassificationDraft(record, profile, distance);
    for (UnaryOperator<ClassificationDraft> step : pipeline) {
      draft = step.apply(draft);
    }
    return draft.toClassifiedFlight();
  }

  static ClassificationDraft detectSafetyPilot(ClassificationDraft draft) {
    boolean remarked = draft.record.remarks().toLowerCase(Locale.ROOT).contains(SAFETY_PILOT);
    if (!remarked || !draft.isSingleEngine()) {
      return draft;
    }
    draft.flag(FlightFlag.SAFETY_PILOT, true);
    BigDecimal pilotHours = draft.hours(CanonicalField.PIC).add(draft.hours(CanonicalField.SIC));
    if (pilotHours.signum() == 0) {
      pilotHours = draft.total;
    }
    if (pilotHours.compareTo(draft.total) > 0) {
      draft.advise("safety pilot hours " + pilotHours.toPlainString()
          + " capped at total time " + draft.total.toPlainString());
      pilotHours = draft.total;
    }
    draft.credit(Role.SAFETY_PILOT_EXCLUDED, pilotHours);
    return draft;
  }

  static ClassificationDraft determineStudent(ClassificationDraft draft) {
    if (!draft.record.hasInstructor() && draft.hours(CanonicalField.DUAL_RECEIVED).signum() == 0) {
      return draft;
    }
    draft.flag(FlightFlag.UNDER_INSTRUCTION, true);
    draft.flag(FlightFlag.SAFETY_PILOT, false);
    draft.credit(Role.SAFETY_PILOT_EXCLUDED, BigDecimal.ZERO);
    draft.credit(Role.STUDENT, draft.total);
    return draft;
  }

  static ClassificationDraft determinePic(ClassificationDraft draft) {
    if (draft.is(FlightFlag.UNDER_INSTRUCTION) || draft.is(FlightFlag.SAFETY_PILOT)) {
      return draft;
    }
    BigDecimal pic = draft.hours(CanonicalField.PIC);
    BigDecimal sic = draft.hours(CanonicalField.SIC);
    // No SIC on single-engine aircraft.
    if (draft.isSingleEngine() && sic.signum() > 0) {
      pic = pic.add(sic);
    }
    boolean solo = draft.hours(CanonicalField.SOLO).signum() > 0;
    if (pic.signum() == 0 && (solo || draft.hours(CanonicalField.DUAL_GIVEN).signum() > 0)) {
      pic = draft.total;
    }
    draft.credit(Role.PIC, pic);
    draft.flag(FlightFlag.SOLO, solo && pic.signum() > 0);
    return draft;
  }

  static ClassificationDraft determineSic(ClassificationDraft draft) {
    if (draft.is(FlightFlag.UNDER_INSTRUCTION)) {
      return draft;
    }
    if (draft.group.isMultiEngine() || draft.group == AircraftGroup.UNRESOLVED) {
      draft.credit(Role.SIC, draft.hours(CanonicalField.SIC));
    }
    return draft;
  }

  ClassificationDraft determineCrossCountry(ClassificationDraft draft) {
    BigDecimal logged = draft.hours(CanonicalField.CROSS_COUNTRY);
    boolean byDistance = draft.distanceNm != null && draft.distanceNm.compareTo(crossCountryThresholdNm) > 0;
    boolean crossCountry = logged.signum() > 0 || byDistance;
    draft.flag(FlightFlag.CROSS_COUNTRY, crossCountry);
    if (!crossCountry || draft.is(FlightFlag.SAFETY_PILOT)) {
      return draft;
    }
    draft.crossCountryHours = logged.signum() > 0 ? logged.min(draft.total) : draft.total;
    if (!draft.is(FlightFlag.UNDER_INSTRUCTION)) {
      BigDecimal pic = draft.credit(Role.PIC);
      draft.picCrossCountry = logged.signum() > 0 ? logged.min(pic) : pic;
    }
    return draft;
  }

  static ClassificationDraft recordActualInstrument(ClassificationDraft draft) {
    BigDecimal actual = draft.hours(CanonicalField.ACTUAL_INSTRUMENT);
    draft.actualInstrument = actual;
    draft.flag(FlightFlag.INSTRUMENT_ACTUAL, actual.signum() > 0);
    boolean singlePilot = draft.hours(CanonicalField.MULTI_PILOT).signum() == 0;
    BigDecimal pic = draft.credit(Role.PIC);
    if (!draft.is(FlightFlag.UNDER_INSTRUCTION) && singlePilot && pic.signum() > 0) {
      draft.picInstrument = actual.min(pic);
    }
    return draft;
  }

  static ClassificationDraft recordSimulatedInstrument(ClassificationDraft draft) {
    BigDecimal simulated = draft.hours(CanonicalField.SIMULATED_INSTRUMENT);
    draft.simulatedInstrument = simulated;
    draft.flag(FlightFlag.INSTRUMENT_SIMULATED, simulated.signum() > 0);
    if (draft.is(FlightFlag.UNDER_INSTRUCTION)) {
      draft.dualInstrument = draft.actualInstrument.add(simulated);
    }
    return draft;
  }

  static ClassificationDraft detectTrainingDevice(ClassificationDraft draft) {
    BigDecimal simulator = draft.hours(CanonicalField.SIMULATOR);
    boolean deviceOnly = simulator.signum() > 0 && draft.total.signum() == 0;
    FlightRecord record = draft.record;
    if (!deviceOnly && !AircraftTypes.isTrainingDevice(record.aircraftType(), record.registration())) {
      return draft;
    }
    for (Role role : Role.values()) {
      draft.credit(role, BigDecimal.ZERO);
    }
    draft.picCrossCountry = BigDecimal.ZERO;
    draft.crossCountryHours = BigDecimal.ZERO;
    draft.actualInstrument = BigDecimal.ZERO;
    draft.simulatedInstrument = BigDecimal.ZERO;
    draft.picInstrument = BigDecimal.ZERO;
    draft.dualInstrument = BigDecimal.ZERO;
    draft.deviceHours = simulator.signum() > 0 ? simulator : draft.total;
    draft.typeCode = AircraftTypes.deviceBaseType(record.aircraftType(), record.registration());
    draft.flags.clear();
    draft.flag(FlightFlag.TRAINING_DEVICE, true);
    return draft;
  }

  static ClassificationDraft flagComplex(ClassificationDraft draft) {
    if (draft.is(FlightFlag.TRAINING_DEVICE)) {
      return draft;
    }
    draft.flag(FlightFlag.COMPLEX, draft.complexType || draft.group.isMultiEngine());
    return draft;
  }

  static ClassificationDraft enforceTotalTime(ClassificationDraft draft) {
    for (Role role : Role.values()) {
      if (draft.credit(role).signum() < 0) {
        draft.advise(role + " credit was negative, clamped to zero");
        draft.credit(role, BigDecimal.ZERO);
      }
    }
    BigDecimal excess = draft.roleSum().subtract(draft.total);
    if (excess.signum() > 0) {
      draft.advise("role credits exceed total time " + draft.total.toPlainString()
          + " by " + excess.toPlainString() + ", reduced");
      for (Role role : List.of(Role.SIC, Role.PIC, Role.SAFETY_PILOT_EXCLUDED, Role.STUDENT)) {
        BigDecimal cut = excess.min(draft.credit(role));
        draft.credit(role, draft.credit(role).subtract(cut));
        excess = excess.subtract(cut);
      }
    }
    BigDecimal pic = draft.credit(Role.PIC);
    draft.picCrossCountry = draft.picCrossCountry.min(pic);
    draft.picInstrument = draft.picInstrument.min(pic);
    return draft;
  }

  static ClassificationDraft splitNight(ClassificationDraft draft) {
    BigDecimal night = draft.hours(CanonicalField.NIGHT);
    if (night.compareTo(draft.total) > 0) {
      draft.advise("night " + night.toPlainString() + " capped at total time " + draft.total.toPlainString());
      night = draft.total;
    }
    for (Role role : Role.values()) {
      draft.split.put(role, split(draft.credit(role), night, draft.total));
    }
    draft.picCrossCountrySplit = split(draft.picCrossCountry, night, draft.total);
    draft.flag(FlightFlag.NIGHT, !draft.is(FlightFlag.TRAINING_DEVICE) && night.signum() > 0);
    return draft;
  }

  private static DayNight split(BigDecimal credit, BigDecimal night, BigDecimal total) {
    if (credit.signum() == 0 || night.signum() == 0 || total.signum() == 0) {
      return new DayNight(credit, BigDecimal.ZERO);
    }
    BigDecimal nightPart = credit.compareTo(total) == 0
        ? night
        : credit.multiply(night).divide(total, NIGHT_SCALE, RoundingMode.HALF_UP);
    return new DayNight(credit.subtract(nightPart), nightPart);
  }
}
