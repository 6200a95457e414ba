package com.tofes.analyzer.classify;

import static org.assertj.core.api.Assertions.assertThat;

import com.tofes.analyzer.aircraft.AircraftGroup;
import com.tofes.analyzer.aircraft.AircraftGroupLookup;
import com.tofes.analyzer.aircraft.AircraftGroupResolver;
import com.tofes.analyzer.column.CanonicalField;
import com.tofes.analyzer.logbook.FlightRecord;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ClassificationEngineTest {
  private final ClassificationEngine engine =
      new ClassificationEngine(new BigDecimal("27"), DistanceProvider.none());
  private final AircraftGroupLookup lookup = new AircraftGroupResolver(Optional.empty());

  private static FlightRecord.Builder flight(String type, String total) {
    return FlightRecord.builder()
        .rowNumber(2)
        .route("LLHZ", "LLHA")
        .registration("4X-ABC")
        .aircraftType(type)
        .hours(CanonicalField.TOTAL_TIME, total);
  }

  @Test
  void singleEnginePicFlightCreditsPic() {
    ClassifiedFlight result = engine.classify(
        flight("C172", "1.5").hours(CanonicalField.PIC, "1.5").hours(CanonicalField.SIC, "0").build(), lookup);

    assertThat(result.credit(Role.PIC)).isEqualByComparingTo("1.5");
    assertThat(result.credit(Role.STUDENT)).isEqualByComparingTo("0");
    assertThat(result.credit(Role.SAFETY_PILOT_EXCLUDED)).isEqualByComparingTo("0");
    assertThat(result.group()).isEqualTo(AircraftGroup.A);
    assertThat(result.advisories()).isEmpty();
  }

  @Test
  void instructorMakesTheFlightStudentTime() {
    ClassifiedFlight result = engine.classify(
        flight("C172", "1.5").hours(CanonicalField.PIC, "1.5").instructor("J. Smith").build(), lookup);

    assertThat(result.credit(Role.STUDENT)).isEqualByComparingTo("1.5");
    assertThat(result.credit(Role.PIC)).isEqualByComparingTo("0");
    assertThat(result.has(FlightFlag.UNDER_INSTRUCTION)).isTrue();
  }

  @Test
  void dualReceivedAloneMakesTheFlightStudentTime() {
    ClassifiedFlight result = engine.classify(
        flight("PA28", "1.2").hours(CanonicalField.DUAL_RECEIVED, "1.2").build(), lookup);

    assertThat(result.credit(Role.STUDENT)).isEqualByComparingTo("1.2");
  }

  @Test
  void singleEngineFoldsSicIntoPic() {
    ClassifiedFlight result = engine.classify(
        flight("C172", "2.0").hours(CanonicalField.PIC, "1.0").hours(CanonicalField.SIC, "1.0").build(), lookup);

    assertThat(result.credit(Role.PIC)).isEqualByComparingTo("2.0");
    assertThat(result.credit(Role.SIC)).isEqualByComparingTo("0");
  }

  @Test
  void singleEngineSafetyPilotIsExcluded() {
    ClassifiedFlight result = engine.classify(
        flight("C172", "1.2")
            .hours(CanonicalField.PIC, "1.2")
            .hours(CanonicalField.CROSS_COUNTRY, "1.2")
            .remarks("Safety Pilot for checkride")
            .build(),
        lookup);

    assertThat(result.credit(Role.SAFETY_PILOT_EXCLUDED)).isEqualByComparingTo("1.2");
    assertThat(result.credit(Role.PIC)).isEqualByComparingTo("0");
    assertThat(result.formTime()).isEqualByComparingTo("0");
    assertThat(result.picCrossCountry().total()).isEqualByComparingTo("0");
    assertThat(result.crossCountryHours()).isEqualByComparingTo("0");
  }

  @Test
  void safetyPilotWithoutLoggedPilotTimeExcludesTotalTime() {
    ClassifiedFlight result = engine.classify(
        flight("PA28", "0.9").remarks("safety pilot").build(), lookup);

    assertThat(result.credit(Role.SAFETY_PILOT_EXCLUDED)).isEqualByComparingTo("0.9");
  }

  @Test
  void multiEngineSafetyPilotKeepsSicCredit() {
    ClassifiedFlight result = engine.classify(
        flight("BE76", "1.3").hours(CanonicalField.SIC, "1.3").remarks("safety pilot").build(), lookup);

    assertThat(result.credit(Role.SIC)).isEqualByComparingTo("1.3");
    assertThat(result.credit(Role.SAFETY_PILOT_EXCLUDED)).isEqualByComparingTo("0");
    assertThat(result.has(FlightFlag.SAFETY_PILOT)).isFalse();
  }

  @Test
  void instructionTakesPrecedenceOverSafetyPilot() {
    ClassifiedFlight result = engine.classify(
        flight("C172", "1.0").instructor("CFI").remarks("safety pilot").build(), lookup);

    assertThat(result.credit(Role.STUDENT)).isEqualByComparingTo("1.0");
    assertThat(result.credit(Role.SAFETY_PILOT_EXCLUDED)).isEqualByComparingTo("0");
  }

  @Test
  void multiEngineSicIsCreditedAsLogged() {
    ClassifiedFlight result = engine.classify(
        flight("A320", "2.5").hours(CanonicalField.SIC, "2.5").build(), lookup);

    assertThat(result.credit(Role.SIC)).isEqualByComparingTo("2.5");
    assertThat(result.credit(Role.PIC)).isEqualByComparingTo("0");
    assertThat(result.has(FlightFlag.COMPLEX)).isTrue();
  }

  @Test
  void soloTimeWithoutPicFieldCreditsTotalTime() {
    ClassifiedFlight result = engine.classify(
        flight("C152", "1.1").hours(CanonicalField.SOLO, "1.1").build(), lookup);

    assertThat(result.credit(Role.PIC)).isEqualByComparingTo("1.1");
    assertThat(result.has(FlightFlag.SOLO)).isTrue();
  }

  @Test
  void picCrossCountryIsBoundedByPic() {
    ClassifiedFlight result = engine.classify(
        flight("C172", "2.0").hours(CanonicalField.PIC, "1.5").hours(CanonicalField.CROSS_COUNTRY, "2.0").build(),
        lookup);

    assertThat(result.has(FlightFlag.CROSS_COUNTRY)).isTrue();
    assertThat(result.picCrossCountry().total()).isEqualByComparingTo("1.5");
    assertThat(result.crossCountryHours()).isEqualByComparingTo("2.0");
  }

  @Test
  void recordedDistanceAboveThresholdMarksCrossCountry() {
    ClassifiedFlight longHop = engine.classify(
        flight("C172", "1.4").hours(CanonicalField.PIC, "1.4").distanceNm(new BigDecimal("48")).build(), lookup);
    ClassifiedFlight shortHop = engine.classify(
        flight("C172", "0.6").hours(CanonicalField.PIC, "0.6").distanceNm(new BigDecimal("27")).build(), lookup);

    assertThat(longHop.picCrossCountry().total()).isEqualByComparingTo("1.4");
    assertThat(shortHop.has(FlightFlag.CROSS_COUNTRY)).isFalse();
  }

  @Test
  void distanceProviderIsConsultedWhenRowHasNoDistance() {
    ClassificationEngine withAirports = new ClassificationEngine(
        new BigDecimal("27"), (from, to) -> Optional.of(new BigDecimal("95")));

    ClassifiedFlight result = withAirports.classify(
        flight("C172", "1.0").hours(CanonicalField.PIC, "1.0").build(), lookup);

    assertThat(result.has(FlightFlag.CROSS_COUNTRY)).isTrue();
    assertThat(result.distanceNm()).isEqualByComparingTo("95");
  }

  @Test
  void studentCrossCountryIsNotPicCrossCountry() {
    ClassifiedFlight result = engine.classify(
        flight("C172", "2.0").instructor("CFI").hours(CanonicalField.CROSS_COUNTRY, "2.0").build(), lookup);

    assertThat(result.picCrossCountry().total()).isEqualByComparingTo("0");
    assertThat(result.crossCountryHours()).isEqualByComparingTo("2.0");
  }

  @Test
  void singlePilotActualInstrumentQualifiesAsPicInstrument() {
    ClassifiedFlight single = engine.classify(
        flight("C172", "1.5").hours(CanonicalField.PIC, "1.5").hours(CanonicalField.ACTUAL_INSTRUMENT, "0.7").build(),
        lookup);
    ClassifiedFlight crew = engine.classify(
        flight("A320", "3.0")
            .hours(CanonicalField.PIC, "3.0")
            .hours(CanonicalField.MULTI_PILOT, "3.0")
            .hours(CanonicalField.ACTUAL_INSTRUMENT, "0.7")
            .build(),
        lookup);

    assertThat(single.picInstrument()).isEqualByComparingTo("0.7");
    assertThat(crew.picInstrument()).isEqualByComparingTo("0");
    assertThat(crew.actualInstrument()).isEqualByComparingTo("0.7");
  }

  @Test
  void instrumentUnderInstructionIsDualInstrument() {
    ClassifiedFlight result = engine.classify(
        flight("C172", "1.5")
            .instructor("CFI")
            .hours(CanonicalField.ACTUAL_INSTRUMENT, "0.3")
            .hours(CanonicalField.SIMULATED_INSTRUMENT, "0.8")
            .build(),
        lookup);

    assertThat(result.dualInstrument()).isEqualByComparingTo("1.1");
    assertThat(result.picInstrument()).isEqualByComparingTo("0");
    assertThat(result.simulatedInstrument()).isEqualByComparingTo("0.8");
  }

  @Test
  void simulatorSessionOnlyCreditsDeviceHours() {
    ClassifiedFlight result = engine.classify(
        flight("C172", "0").hours(CanonicalField.SIMULATOR, "1.0").build(), lookup);

    assertThat(result.isTrainingDevice()).isTrue();
    assertThat(result.deviceHours()).isEqualByComparingTo("1.0");
    assertThat(result.roleSum()).isEqualByComparingTo("0");
  }

  @Test
  void namedDeviceSessionUsesTotalTimeAndReplicatedType() {
    ClassifiedFlight result = engine.classify(
        flight("A320 FFS", "4.0").hours(CanonicalField.PIC, "4.0").registration("CAE 3").build(), lookup);

    assertThat(result.isTrainingDevice()).isTrue();
    assertThat(result.deviceHours()).isEqualByComparingTo("4.0");
    assertThat(result.typeCode()).isEqualTo("A320");
    assertThat(result.credit(Role.PIC)).isEqualByComparingTo("0");
  }

  @Test
  void complexTypesAreFlagged() {
    assertThat(engine.classify(flight("PA44", "1.0").build(), lookup).has(FlightFlag.COMPLEX)).isTrue();
    assertThat(engine.classify(flight("C172", "1.0").build(), lookup).has(FlightFlag.COMPLEX)).isFalse();
  }

  @Test
  void nightSplitsEachCreditedRole() {
    ClassifiedFlight result = engine.classify(
        flight("C172", "2.0")
            .hours(CanonicalField.PIC, "2.0")
            .hours(CanonicalField.NIGHT, "0.5")
            .hours(CanonicalField.CROSS_COUNTRY, "1.0")
            .build(),
        lookup);

    assertThat(result.night(Role.PIC)).isEqualByComparingTo("0.5");
    assertThat(result.day(Role.PIC)).isEqualByComparingTo("1.5");
    assertThat(result.picCrossCountry().night()).isEqualByComparingTo("0.25");
    assertThat(result.picCrossCountry().total()).isEqualByComparingTo("1.0");
    assertThat(result.has(FlightFlag.NIGHT)).isTrue();
  }

  @Test
  void nightAboveTotalTimeIsCappedWithAdvisory() {
    ClassifiedFlight result = engine.classify(
        flight("C172", "1.0").hours(CanonicalField.PIC, "1.0").hours(CanonicalField.NIGHT, "1.4").build(), lookup);

    assertThat(result.night(Role.PIC)).isEqualByComparingTo("1.0");
    assertThat(result.advisories()).hasSize(1);
  }

  @Test
  void roleCreditsAreClampedToTotalTime() {
    ClassifiedFlight result = engine.classify(
        flight("ZZ99", "1.5").hours(CanonicalField.PIC, "1.5").hours(CanonicalField.SIC, "1.5").build(), lookup);

    assertThat(result.group()).isEqualTo(AircraftGroup.UNRESOLVED);
    assertThat(result.credit(Role.PIC)).isEqualByComparingTo("1.5");
    assertThat(result.credit(Role.SIC)).isEqualByComparingTo("0");
    assertThat(result.roleSum()).isLessThanOrEqualTo(result.record().totalTime());
    assertThat(result.advisories()).singleElement().asString().contains("exceed total time");
  }

  @Test
  void noInstructorAndNoDualNeverCreditsStudent() {
    List<FlightRecord> records = List.of(
        flight("C172", "1.0").hours(CanonicalField.PIC, "1.0").build(),
        flight("BE76", "1.0").hours(CanonicalField.SIC, "1.0").build(),
        flight("C172", "1.0").remarks("safety pilot").build(),
        flight("A320 SIM", "2.0").build(),
        flight("ZZ99", "0.8").hours(CanonicalField.SIMULATED_INSTRUMENT, "0.8").build());

    for (FlightRecord record : records) {
      assertThat(engine.classify(record, lookup).credit(Role.STUDENT)).isEqualByComparingTo("0");
    }
  }

  @Test
  void classificationIsDeterministic() {
    FlightRecord record = flight("PA44", "1.8")
        .hours(CanonicalField.PIC, "1.8")
        .hours(CanonicalField.NIGHT, "0.6")
        .hours(CanonicalField.CROSS_COUNTRY, "1.8")
        .build();

    assertThat(engine.classify(record, lookup)).isEqualTo(engine.classify(record, lookup));
  }
}
