package com.culprit.analysis.service;

import com.culprit.analysis.engine.Event;
import com.culprit.analysis.engine.IncidentAnalyzer;
import com.culprit.analysis.engine.MetricPoint;
import com.culprit.analysis.entity.DbEvent;
import com.culprit.analysis.model.AnalysisResponse;
import com.culprit.analysis.repo.DbEventRepository;
import com.culprit.analysis.repo.DbIncidentRepository;
import com.culprit.analysis.repo.DbMetricPointRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class IncidentAnalysisService {

  private static final Logger log = LoggerFactory.getLogger(IncidentAnalysisService.class);
  private static final TypeReference<LinkedHashMap<String, Object>> META_TYPE = new TypeReference<>() {};

  private final DbIncidentRepository incidents;
  private final DbMetricPointRepository points;
  private final DbEventRepository events;
  private final IncidentAnalyzer analyzer;
  private final ExecutorService executor;
  private final ObjectMapper mapper;
  private final long timeoutMs;
  private final MeterRegistry metrics;
  private final Counter runs;
  private final Timer duration;

  public IncidentAnalysisService(DbIncidentRepository incidents,
                                 DbMetricPointRepository points,
                                 DbEventRepository events,
                                 IncidentAnalyzer analyzer,
                                 @Qualifier("analysisRequestExecutor") ExecutorService executor,
                                 ObjectMapper mapper,
                                 @Value("${culprit.analysis.timeout-ms:10000}") long timeoutMs,
                                 MeterRegistry metrics) {
    this.incidents = incidents;
    this.points = points;
    this.events = events;
    this.analyzer = analyzer;
    this.executor = executor;
    this.mapper = mapper;
    this.timeoutMs = timeoutMs;
    this.metrics = metrics;
    this.runs = metrics.counter("culprit_analysis_runs_total");
    this.duration = metrics.timer("culprit_analysis_duration_seconds");
  }

  public AnalysisResponse analyze(String incidentId) {
    if (!incidents.existsById(incidentId)) {
      throw new IncidentNotFoundException(incidentId);
    }
    Instant start = Instant.now();
    runs.increment();

    List<MetricPoint> series = points.findByIncidentIdOrderByMetricNameAscTimestampAsc(incidentId).stream()
        .map(p -> new MetricPoint(p.getMetricName(), p.getTimestamp(), p.getValue()))
        .toList();
    List<Event> timeline = events.findByIncidentIdOrderByTimestampAscIdAsc(incidentId).stream()
        .map(this::toEvent)
        .toList();

    Future<AnalysisResponse> task = executor.submit(() -> analyzer.analyze(incidentId, series, timeline));
    try {
      AnalysisResponse response = task.get(timeoutMs, TimeUnit.MILLISECONDS);
      long ms = Duration.between(start, Instant.now()).toMillis();
      duration.record(Duration.ofMillis(ms));
      log.info("Analysis finished: incident={} points={} events={} anomalies={} episodes={} causes={} in {} ms",
          incidentId, series.size(), timeline.size(), response.anomalies().size(),
          response.episodes().size(), response.likelyCauses().size(), ms);
      return response;
    } catch (TimeoutException e) {
      task.cancel(true);
      failure("timeout");
      log.warn("Analysis of incident {} timed out after {} ms", incidentId, timeoutMs);
      throw new AnalysisTimeoutException(incidentId, timeoutMs);
    } catch (InterruptedException e) {
      task.cancel(true);
      Thread.currentThread().interrupt();
      failure("interrupted");
      throw new AnalysisFailedException("Analysis interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      failure("error");
      log.error("Analysis of incident {} failed", incidentId, cause);
      String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
      throw new AnalysisFailedException(msg, cause);
    }
  }

  private Event toEvent(DbEvent row) {
    return new Event(String.valueOf(row.getId()), row.getEventType(), row.getTimestamp(),
        parseMetadata(row));
  }

  private Map<String, Object> parseMetadata(DbEvent row) {
    String raw = row.getMetadata();
    if (raw == null || raw.isBlank()) return Map.of();
    try {
      return mapper.readValue(raw, META_TYPE);
    } catch (Exception e) {
      log.warn("Event {} has unreadable metadata, keeping raw text: {}", row.getId(), e.getMessage());
      Map<String, Object> fallback = new LinkedHashMap<>();
      fallback.put("raw", raw);
      return fallback;
    }
  }

  private void failure(String reason) {
    metrics.counter("culprit_analysis_failures_total", "reason", reason).increment();
  }
}
