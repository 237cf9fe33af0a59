package com.culprit.ingest.controller;

import com.culprit.ingest.dto.CreateIncidentRequest;
import com.culprit.ingest.dto.EventBatch;
import com.culprit.ingest.dto.IncidentResponse;
import com.culprit.ingest.dto.IngestResult;
import com.culprit.ingest.dto.MetricBatch;
import com.culprit.ingest.service.IngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class IncidentController {

  private final IngestionService ingestion;

  public IncidentController(IngestionService ingestion) {
    this.ingestion = ingestion;
  }

  @PostMapping("/api/incidents")
  @ResponseStatus(HttpStatus.CREATED)
  public IncidentResponse create(@RequestBody(required = false) CreateIncidentRequest request) {
    return ingestion.createIncident(request);
  }

  @PostMapping("/api/incidents/{incidentId}/metrics")
  public IngestResult metrics(@PathVariable("incidentId") String incidentId, @RequestBody MetricBatch batch) {
    return ingestion.ingestPoints(incidentId, batch.points());
  }

  @PostMapping("/api/incidents/{incidentId}/events")
  public IngestResult events(@PathVariable("incidentId") String incidentId, @RequestBody EventBatch batch) {
    return ingestion.ingestEvents(incidentId, batch.events());
  }
}
