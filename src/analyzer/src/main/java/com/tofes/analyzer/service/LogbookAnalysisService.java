package com.tofes.analyzer.service;

import com.tofes.analyzer.aircraft.AircraftGroup;
import com.tofes.analyzer.aircraft.AircraftGroupLookup;
import com.tofes.analyzer.classify.ClassificationEngine;
import com.tofes.analyzer.classify.ClassifiedFlight;
import com.tofes.analyzer.column.CanonicalField;
import com.tofes.analyzer.column.ColumnMapping;
import com.tofes.analyzer.column.ColumnResolution;
import com.tofes.analyzer.column.ColumnResolver;
import com.tofes.analyzer.config.AnalyzerProperties;
import com.tofes.analyzer.form.FormAccumulator;
import com.tofes.analyzer.form.FormAggregator;
import com.tofes.analyzer.form.FormValues;
import com.tofes.analyzer.logbook.FlightRecord;
import com.tofes.analyzer.logbook.LogbookTable;
import com.tofes.analyzer.logbook.NormalizationException;
import com.tofes.analyzer.logbook.RawRow;
import com.tofes.analyzer.logbook.RecordNormalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the logbook pipeline: resolve columns once, then normalize, classify and fold every row,
 * and finalize the form.
 *
 * <p>Row-level problems never abort the run; they are collected into the {@link AnalysisReport}.
 * Only a table where no required column resolves at all is rejected.
 */
@Service
public class LogbookAnalysisService {
  private static final Logger LOGGER = LoggerFactory.getLogger(LogbookAnalysisService.class);

  private final ColumnResolver columnResolver;
  private final RecordNormalizer recordNormalizer;
  private final ClassificationEngine classificationEngine;
  private final AircraftGroupLookup aircraftGroupLookup;
  private final FormAggregator formAggregator;
  private final AnalyzerProperties properties;
  private final MeterRegistry meterRegistry;

  private final Counter normalizedCounter;
  private final Counter rejectedCounter;
  private final Counter classifiedCounter;
  private final Counter deviceCounter;
  private final Counter advisoryCounter;
  private final Map<AircraftGroup, Counter> groupCounters = new ConcurrentHashMap<>();

  public LogbookAnalysisService(
      ColumnResolver columnResolver,
      RecordNormalizer recordNormalizer,
      ClassificationEngine classificationEngine,
      AircraftGroupLookup aircraftGroupLookup,
      FormAggregator formAggregator,
      AnalyzerProperties properties,
      MeterRegistry meterRegistry) {
    this.columnResolver = columnResolver;
    this.recordNormalizer = recordNormalizer;
    this.classificationEngine = classificationEngine;
    this.aircraftGroupLookup = aircraftGroupLookup;
    this.formAggregator = formAggregator;
    this.properties = properties;
    this.meterRegistry = meterRegistry;

    this.normalizedCounter = meterRegistry.counter("analyzer.rows.normalized");
    this.rejectedCounter = meterRegistry.counter("analyzer.rows.rejected");
    this.classifiedCounter = meterRegistry.counter("analyzer.flights.classified");
    this.deviceCounter = meterRegistry.counter("analyzer.flights.devices");
    this.advisoryCounter = meterRegistry.counter("analyzer.advisories");
  }

  /**
   * Analyzes a table with the configured default column mapping.
   *
   * @param table decoded logbook table
   * @return analysis report
   */
  public AnalysisReport analyze(LogbookTable table) {
    return analyze(table, null);
  }

  /**
   * Analyzes a table.
   *
   * @param table decoded logbook table
   * @param mapping explicit column mapping; {@code null} or empty falls back to
   *     {@code analyzer.columns}
   * @return analysis report
   * @throws UnusableMappingException when no required column resolves
   */
  public AnalysisReport analyze(LogbookTable table, ColumnMapping mapping) {
    ColumnMapping explicit = mapping == null || mapping.isEmpty()
        ? ColumnMapping.fromText(properties.getColumns())
        : mapping;
    ColumnResolution resolution = columnResolver.resolve(table.headers(), explicit);
    if (!resolution.isUsable()) {
      throw new UnusableMappingException(table.headers(), resolution.unresolvedRequired());
    }
    if (!resolution.unresolvedRequired().isEmpty()) {
      LOGGER.warn("Required columns not found: {}", displayNames(resolution));
    }
    resolution.warnings().forEach(warning -> LOGGER.warn("Column mapping: {}", warning));

    FormAccumulator acc = new FormAccumulator();
    List<RowError> rowErrors = new ArrayList<>();
    List<String> advisories = new ArrayList<>();
    List<FlightAnnotation> flights = new ArrayList<>();
    int rowsRead = 0;

    for (RawRow row : table.rows()) {
      if (row.isBlank()) {
        continue;
      }
      rowsRead++;
      FlightRecord record;
      try {
        record = recordNormalizer.normalize(row, resolution);
      } catch (NormalizationException ex) {
        rejectedCounter.increment();
        rowErrors.add(RowError.from(ex));
        LOGGER.debug("Rejected row: {}", ex.getMessage());
        continue;
      }
      normalizedCounter.increment();

      ClassifiedFlight flight = classificationEngine.classify(record, aircraftGroupLookup);
      record(flight);
      advisories.addAll(flight.advisories());
      flights.add(FlightAnnotation.of(flight));
      formAggregator.fold(acc, flight);
    }

    FormValues form = formAggregator.finalizeForm(acc);
    if (!form.unresolvedAircraftTypes().isEmpty()) {
      LOGGER.warn("Aircraft types without a CAAI group: {}", form.unresolvedAircraftTypes());
    }
    LOGGER.info(
        "Analyzed logbook: rows={} rejected={} flights={} devices={} overall={}",
        rowsRead,
        rowErrors.size(),
        form.totals().flights(),
        form.totals().deviceSessions(),
        form.totals().overall().toPlainString());

    return new AnalysisReport(
        properties.getPilotName(), resolution, rowsRead, rowErrors, advisories, flights, form);
  }

  private void record(ClassifiedFlight flight) {
    classifiedCounter.increment();
    if (!flight.advisories().isEmpty()) {
      advisoryCounter.increment(flight.advisories().size());
    }
    if (flight.isTrainingDevice()) {
      deviceCounter.increment();
      return;
    }
    groupCounters.computeIfAbsent(
            flight.group(),
            group -> meterRegistry.counter("analyzer.aircraft.group.flights", "group", group.name()))
        .increment();
  }

  private static String displayNames(ColumnResolution resolution) {
    return resolution.unresolvedRequired().stream()
        .map(CanonicalField::displayName)
        .collect(Collectors.joining(", "));
  }
}
