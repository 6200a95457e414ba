package com.tofes.analyzer.api;

import com.tofes.analyzer.service.AnalysisReport;
import com.tofes.analyzer.service.LogbookAnalysisService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing logbook analysis.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code POST /api/logbook/analyze}: decoded table in, form values and report out</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/logbook")
public class AnalysisController {
  private final LogbookAnalysisService analysisService;

  /**
   * Creates the controller.
   *
   * @param analysisService pipeline entry point
   */
  public AnalysisController(LogbookAnalysisService analysisService) {
    this.analysisService = analysisService;
  }

  /**
   * Analyzes a logbook table.
   *
   * @param request headers, rows and optional column mapping
   * @return analysis report with the finalized form values
   */
  @PostMapping("/analyze")
  public AnalysisReport analyze(@RequestBody AnalysisRequest request) {
    if (request == null) {
      throw new BadRequestException("request body is required");
    }
    return analysisService.analyze(request.toTable(), request.toMapping());
  }
}
