package com.culprit.analysis.controller;

import com.culprit.analysis.model.AnalysisResponse;
import com.culprit.analysis.service.IncidentAnalysisService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AnalysisController {

  private final IncidentAnalysisService analysis;

  public AnalysisController(IncidentAnalysisService analysis) {
    this.analysis = analysis;
  }

  @GetMapping("/api/incidents/{incidentId}/analysis")
  public AnalysisResponse analyze(@PathVariable("incidentId") String incidentId) {
    return analysis.analyze(incidentId);
  }
}
