package com.tofes.analyzer.form;

import static org.assertj.core.api.Assertions.assertThat;

import com.tofes.analyzer.aircraft.AircraftGroup;
import com.tofes.analyzer.aircraft.AircraftGroupLookup;
import com.tofes.analyzer.aircraft.AircraftGroupResolver;
import com.tofes.analyzer.classify.ClassificationEngine;
import com.tofes.analyzer.classify.ClassifiedFlight;
import com.tofes.analyzer.classify.DistanceProvider;
import com.tofes.analyzer.column.CanonicalField;
import com.tofes.analyzer.logbook.FlightRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.Test;

class FormAggregatorTest {
  private final ClassificationEngine engine =
      new ClassificationEngine(new BigDecimal("27"), DistanceProvider.none());
  private final AircraftGroupLookup lookup = new AircraftGroupResolver(Optional.empty());
  private final FormAggregator aggregator = new FormAggregator();

  private ClassifiedFlight classify(FlightRecord.Builder builder) {
    return engine.classify(builder.build(), lookup);
  }

  private static FlightRecord.Builder flight(int row, String date, String type, String total) {
    return FlightRecord.builder()
        .rowNumber(row)
        .date(LocalDate.parse(date))
        .route("LLHZ", "LLIB")
        .registration("4X-" + row)
        .aircraftType(type)
        .hours(CanonicalField.TOTAL_TIME, total);
  }

  private FormValues foldAll(List<ClassifiedFlight> flights) {
    FormAccumulator acc = new FormAccumulator();
    for (ClassifiedFlight flight : flights) {
      aggregator.fold(acc, flight);
    }
    return aggregator.finalizeForm(acc);
  }

  private List<ClassifiedFlight> mixedLogbook() {
    return List.of(
        classify(flight(2, "2024-01-10", "C172", "1.5").instructor("CFI")
            .hours(CanonicalField.SIMULATED_INSTRUMENT, "0.5")),
        classify(flight(3, "2024-01-12", "C172", "2.0").hours(CanonicalField.PIC, "2.0")
            .hours(CanonicalField.NIGHT, "0.7").hours(CanonicalField.CROSS_COUNTRY, "2.0")
            .hours(CanonicalField.SOLO, "2.0").distanceNm(new BigDecimal("64")).landings(1, 2)),
        classify(flight(4, "2024-02-01", "PA44", "1.3").hours(CanonicalField.PIC, "1.3")
            .hours(CanonicalField.ACTUAL_INSTRUMENT, "0.4")),
        classify(flight(5, "2024-02-03", "A320", "3.2").hours(CanonicalField.SIC, "3.2")
            .hours(CanonicalField.NIGHT, "1.1")),
        classify(flight(6, "2024-02-05", "C172", "1.2").hours(CanonicalField.PIC, "1.2")
            .remarks("safety pilot")),
        classify(flight(7, "2024-02-07", "C172", "0").hours(CanonicalField.SIMULATOR, "1.0")
            .registration("FRASCA 142")),
        classify(flight(8, "2024-02-09", "ZZ99", "0.9").hours(CanonicalField.PIC, "0.9")),
        classify(flight(9, "2024-02-11", "PC12", "2.4").hours(CanonicalField.PIC, "2.4")
            .hours(CanonicalField.NIGHT, "2.4")));
  }

  @Test
  void foldingOrderDoesNotChangeGroupTotals() {
    ClassifiedFlight first = classify(flight(2, "2024-03-01", "C172", "2.0").hours(CanonicalField.PIC, "2.0"));
    ClassifiedFlight second = classify(flight(3, "2024-03-02", "C172", "3.0").hours(CanonicalField.PIC, "3.0"));

    FormValues forward = foldAll(List.of(first, second));
    FormValues backward = foldAll(List.of(second, first));

    assertThat(forward.groupRows().get(0).group()).isEqualTo(AircraftGroup.A);
    assertThat(forward.groupRows().get(0).pic().total()).isEqualByComparingTo("5.0");
    assertThat(backward.groupRows().get(0).pic().total()).isEqualByComparingTo("5.0");
    assertThat(forward).isEqualTo(backward);
  }

  @Test
  void anyPermutationYieldsIdenticalValues() {
    List<ClassifiedFlight> flights = mixedLogbook();
    FormValues expected = foldAll(flights);

    Random random = new Random(42);
    for (int i = 0; i < 20; i++) {
      List<ClassifiedFlight> shuffled = new ArrayList<>(flights);
      Collections.shuffle(shuffled, random);
      assertThat(foldAll(shuffled)).isEqualTo(expected);
    }
  }

  @Test
  void mergingPartialAccumulatorsEqualsFoldingEverything() {
    List<ClassifiedFlight> flights = mixedLogbook();
    FormAccumulator left = new FormAccumulator();
    FormAccumulator right = new FormAccumulator();
    for (int i = 0; i < flights.size(); i++) {
      aggregator.fold(i % 2 == 0 ? left : right, flights.get(i));
    }

    FormAccumulator merged = aggregator.merge(right, left);

    assertThat(merged.size()).isEqualTo(flights.size());
    assertThat(aggregator.finalizeForm(merged)).isEqualTo(foldAll(flights));
  }

  @Test
  void overallTotalAppliesHalfCreditToSic() {
    FormValues values = foldAll(mixedLogbook());
    FormValues.Totals totals = values.totals();

    assertThat(totals.pic()).isEqualByComparingTo("6.6");
    assertThat(totals.sic()).isEqualByComparingTo("3.2");
    assertThat(totals.student()).isEqualByComparingTo("1.5");
    assertThat(totals.sicHalfCredit()).isEqualByComparingTo("1.6");
    assertThat(totals.overall())
        .isEqualByComparingTo(totals.pic().add(totals.sic().divide(BigDecimal.valueOf(2))).add(totals.student()));
    assertThat(totals.overall()).isEqualByComparingTo("9.7");
    assertThat(totals.safetyPilotExcluded()).isEqualByComparingTo("1.2");
  }

  @Test
  void finalizeIsIdempotent() {
    FormAccumulator acc = new FormAccumulator();
    mixedLogbook().forEach(flight -> aggregator.fold(acc, flight));

    assertThat(aggregator.finalizeForm(acc)).isEqualTo(aggregator.finalizeForm(acc));
  }

  @Test
  void groupRowsExcludeDevicesAndUnresolvedTypes() {
    FormValues values = foldAll(mixedLogbook());

    FormValues.GroupRow groupA = values.groupRows().get(0);
    assertThat(values.groupRows()).extracting(FormValues.GroupRow::group)
        .containsExactly(AircraftGroup.A, AircraftGroup.B, AircraftGroup.C, AircraftGroup.D);
    assertThat(groupA.formTotal()).isEqualByComparingTo("3.5");
    assertThat(groupA.student().total()).isEqualByComparingTo("1.5");
    assertThat(values.groupRows().get(2).sic().night()).isEqualByComparingTo("1.1");
    assertThat(values.groupRows().get(3).pic().night()).isEqualByComparingTo("2.4");
    assertThat(values.unresolvedAircraftTypes()).containsExactly("ZZ99");
    assertThat(values.typeRows()).extracting(FormValues.TypeRow::typeCode)
        .containsExactly("C172", "PA44", "A320", "PC12");
  }

  @Test
  void deviceHoursLandOnTheReplicatedTypeRow() {
    FormValues values = foldAll(mixedLogbook());

    assertThat(values.totals().trainingDevice()).isEqualByComparingTo("1.0");
    assertThat(values.totals().deviceSessions()).isEqualTo(1);
    FormValues.InstrumentRow c172 = values.instrumentRows().stream()
        .filter(row -> row.typeCode().equals("C172"))
        .findFirst()
        .orElseThrow();
    assertThat(c172.trainingDevice()).isEqualByComparingTo("1.0");
    assertThat(c172.simulatedInAir()).isEqualByComparingTo("0.5");
  }

  @Test
  void simulatorSessionLeavesTableOneUntouched() {
    FormValues values = foldAll(List.of(
        classify(flight(2, "2024-01-01", "C172", "0").hours(CanonicalField.SIMULATOR, "1.0"))));

    assertThat(values.totals().trainingDevice()).isEqualByComparingTo("1.0");
    assertThat(values.totals().formTotal()).isEqualByComparingTo("0");
    assertThat(values.groupRows()).allSatisfy(row -> assertThat(row.formTotal()).isEqualByComparingTo("0"));
    assertThat(values.typeRows()).isEmpty();
  }

  @Test
  void cplAndAtplFieldsAreAccumulated() {
    FormValues values = foldAll(mixedLogbook());

    assertThat(values.cpl().picCrossCountry()).isEqualByComparingTo("2.0");
    assertThat(values.cpl().dualReceived()).isEqualByComparingTo("1.5");
    assertThat(values.cpl().dualInstrument()).isEqualByComparingTo("0.5");
    assertThat(values.cpl().nightLandings()).isEqualTo(2);
    assertThat(values.cpl().nightHours()).isEqualByComparingTo("4.2");
    assertThat(values.cpl().complexOrMultiEngine()).isEqualByComparingTo("4.5");
    assertThat(values.atpl().crossCountryAllRoles()).isEqualByComparingTo("2.0");
    assertThat(values.atpl().nightPicCrossCountry()).isEqualByComparingTo("0.7");
    assertThat(values.atpl().instrumentInAircraft()).isEqualByComparingTo("0.9");
  }

  @Test
  void cplListsAreSortedByDate() {
    FormValues values = foldAll(mixedLogbook());

    assertThat(values.cplLists().nightPic()).extracting(FormValues.FlightListing::rowNumber)
        .containsExactly(3, 9);
    assertThat(values.cplLists().complex()).extracting(FormValues.FlightListing::rowNumber)
        .containsExactly(4, 5);
    assertThat(values.cplLists().instrumentInstruction()).extracting(FormValues.FlightListing::rowNumber)
        .containsExactly(2);
  }

  @Test
  void longestSoloCrossCountryPrefersDistanceThenDurationThenEarliestDate() {
    ClassifiedFlight short1 = classify(flight(2, "2024-04-01", "C172", "3.0").hours(CanonicalField.SOLO, "3.0")
        .hours(CanonicalField.CROSS_COUNTRY, "3.0").distanceNm(new BigDecimal("80")));
    ClassifiedFlight far = classify(flight(3, "2024-04-05", "C172", "1.5").hours(CanonicalField.SOLO, "1.5")
        .hours(CanonicalField.CROSS_COUNTRY, "1.5").distanceNm(new BigDecimal("120")));
    ClassifiedFlight farLonger = classify(flight(4, "2024-04-06", "C172", "1.8").hours(CanonicalField.SOLO, "1.8")
        .hours(CanonicalField.CROSS_COUNTRY, "1.8").distanceNm(new BigDecimal("120")));
    ClassifiedFlight farLongerEarlier = classify(flight(5, "2024-03-30", "C172", "1.8")
        .hours(CanonicalField.SOLO, "1.8").hours(CanonicalField.CROSS_COUNTRY, "1.8")
        .distanceNm(new BigDecimal("120")));

    assertThat(foldAll(List.of(short1, far)).cpl().longestSoloCrossCountry().distanceNm())
        .isEqualByComparingTo("120");
    assertThat(foldAll(List.of(far, farLonger)).cpl().longestSoloCrossCountry().hours())
        .isEqualByComparingTo("1.8");

    FormValues.LongestSoloCrossCountry tie = foldAll(List.of(farLonger, farLongerEarlier, far))
        .cpl().longestSoloCrossCountry();
    assertThat(tie.date()).isEqualTo(LocalDate.of(2024, 3, 30));
    assertThat(tie.distanceKm()).isEqualByComparingTo("222.2");
    assertThat(tie.route()).isEqualTo("LLHZ-LLIB");
  }

  @Test
  void emptyAccumulatorFinalizesToZeros() {
    FormValues values = aggregator.finalizeForm(new FormAccumulator());

    assertThat(values.totals().overall()).isEqualByComparingTo("0");
    assertThat(values.cpl().longestSoloCrossCountry()).isNull();
    assertThat(values.groupRows()).hasSize(4);
  }
}
