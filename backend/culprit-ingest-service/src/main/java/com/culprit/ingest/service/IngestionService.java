package com.culprit.ingest.service;

import com.culprit.ingest.dto.CreateIncidentRequest;
import com.culprit.ingest.dto.EventBatch;
import com.culprit.ingest.dto.IncidentResponse;
import com.culprit.ingest.dto.IngestResult;
import com.culprit.ingest.dto.MetricBatch;
import com.culprit.ingest.model.Incident;
import com.culprit.ingest.model.IncidentEvent;
import com.culprit.ingest.model.MetricPoint;
import com.culprit.ingest.repo.IncidentEventRepository;
import com.culprit.ingest.repo.IncidentRepository;
import com.culprit.ingest.repo.MetricPointRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persists incident metric points and events. Rows are unique on
 * {@code (incident_id, ts, metric_name)} and {@code (incident_id, ts, event_type)}; repeats are
 * counted as duplicates, never reported as errors.
 */
@Service
public class IngestionService {

  private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

  private final IncidentRepository incidents;
  private final MetricPointRepository points;
  private final IncidentEventRepository events;
  private final ObjectMapper mapper;
  private final Counter pointsInserted;
  private final Counter eventsInserted;
  private final Counter pointDuplicates;
  private final Counter eventDuplicates;

  public IngestionService(IncidentRepository incidents,
                          MetricPointRepository points,
                          IncidentEventRepository events,
                          ObjectMapper mapper,
                          MeterRegistry metrics) {
    this.incidents = incidents;
    this.points = points;
    this.events = events;
    this.mapper = mapper;
    this.pointsInserted = metrics.counter("culprit_ingest_points_total");
    this.eventsInserted = metrics.counter("culprit_ingest_events_total");
    this.pointDuplicates = metrics.counter("culprit_ingest_duplicates_total", "kind", "metric");
    this.eventDuplicates = metrics.counter("culprit_ingest_duplicates_total", "kind", "event");
  }

  public IncidentResponse createIncident(CreateIncidentRequest request) {
    String id = request == null || request.id() == null || request.id().isBlank()
        ? UUID.randomUUID().toString()
        : request.id().strip();
    if (incidents.existsById(id)) {
      throw new IncidentAlreadyExistsException(id);
    }
    Incident incident = new Incident();
    incident.setId(id);
    incident.setTitle(request == null ? null : request.title());
    incident.setCreatedAt(Instant.now());
    incidents.save(incident);
    log.info("Created incident {}", id);
    return new IncidentResponse(incident.getId(), incident.getTitle(), incident.getCreatedAt());
  }

  public IngestResult ingestPoints(String incidentId, List<MetricBatch.Item> items) {
    requireIncident(incidentId);
    List<MetricBatch.Item> batch = items == null ? List.of() : items;

    // first occurrence of a key wins inside one batch
    Map<String, MetricBatch.Item> unique = new LinkedHashMap<>();
    for (int i = 0; i < batch.size(); i++) {
      MetricBatch.Item item = batch.get(i);
      validate(item, i);
      unique.putIfAbsent(item.metricName().strip() + "|" + item.ts(), item);
    }

    int inserted = 0;
    for (MetricBatch.Item item : unique.values()) {
      if (insertPoint(incidentId, item)) inserted++;
    }
    int duplicates = batch.size() - inserted;
    pointsInserted.increment(inserted);
    pointDuplicates.increment(duplicates);
    log.info("Ingested metric points: incident={} received={} inserted={} duplicates={}",
        incidentId, batch.size(), inserted, duplicates);
    return new IngestResult(incidentId, batch.size(), inserted, duplicates);
  }

  public IngestResult ingestEvents(String incidentId, List<EventBatch.Item> items) {
    requireIncident(incidentId);
    List<EventBatch.Item> batch = items == null ? List.of() : items;

    Map<String, EventBatch.Item> unique = new LinkedHashMap<>();
    for (int i = 0; i < batch.size(); i++) {
      EventBatch.Item item = batch.get(i);
      validate(item, i);
      unique.putIfAbsent(item.eventType().strip() + "|" + item.ts(), item);
    }

    int inserted = 0;
    for (EventBatch.Item item : unique.values()) {
      if (insertEvent(incidentId, item)) inserted++;
    }
    int duplicates = batch.size() - inserted;
    eventsInserted.increment(inserted);
    eventDuplicates.increment(duplicates);
    log.info("Ingested events: incident={} received={} inserted={} duplicates={}",
        incidentId, batch.size(), inserted, duplicates);
    return new IngestResult(incidentId, batch.size(), inserted, duplicates);
  }

  private boolean insertPoint(String incidentId, MetricBatch.Item item) {
    String metric = item.metricName().strip();
    if (points.existsByIncidentIdAndTimestampAndMetricName(incidentId, item.ts(), metric)) return false;
    MetricPoint row = new MetricPoint();
    row.setIncidentId(incidentId);
    row.setMetricName(metric);
    row.setTimestamp(item.ts());
    row.setValue(item.value());
    try {
      points.saveAndFlush(row);
      return true;
    } catch (DataIntegrityViolationException e) {
      // lost a race with a concurrent writer
      log.debug("Duplicate metric point incident={} metric={} ts={}", incidentId, metric, item.ts());
      return false;
    }
  }

  private boolean insertEvent(String incidentId, EventBatch.Item item) {
    String type = item.eventType().strip();
    if (events.existsByIncidentIdAndTimestampAndEventType(incidentId, item.ts(), type)) return false;
    IncidentEvent row = new IncidentEvent();
    row.setIncidentId(incidentId);
    row.setEventType(type);
    row.setTimestamp(item.ts());
    row.setMetadata(toJson(item.meta()));
    try {
      events.saveAndFlush(row);
      return true;
    } catch (DataIntegrityViolationException e) {
      log.debug("Duplicate event incident={} type={} ts={}", incidentId, type, item.ts());
      return false;
    }
  }

  private void requireIncident(String incidentId) {
    if (incidentId == null || !incidents.existsById(incidentId)) {
      throw new IncidentNotFoundException(incidentId);
    }
  }

  private static void validate(MetricBatch.Item item, int index) {
    if (item == null) throw new InvalidPayloadException("points[" + index + "] is null");
    if (item.metricName() == null || item.metricName().isBlank()) {
      throw new InvalidPayloadException("points[" + index + "].metric_name is required");
    }
    if (item.ts() == null) throw new InvalidPayloadException("points[" + index + "].ts is required");
    if (item.value() == null || !Double.isFinite(item.value())) {
      throw new InvalidPayloadException("points[" + index + "].value must be a finite number");
    }
  }

  private static void validate(EventBatch.Item item, int index) {
    if (item == null) throw new InvalidPayloadException("events[" + index + "] is null");
    if (item.eventType() == null || item.eventType().isBlank()) {
      throw new InvalidPayloadException("events[" + index + "].event_type is required");
    }
    if (item.ts() == null) throw new InvalidPayloadException("events[" + index + "].ts is required");
  }

  private String toJson(Map<String, Object> meta) {
    if (meta == null || meta.isEmpty()) return "{}";
    try {
      return mapper.writeValueAsString(meta);
    } catch (JsonProcessingException e) {
      throw new InvalidPayloadException("event meta is not serializable: " + e.getOriginalMessage());
    }
  }
}
