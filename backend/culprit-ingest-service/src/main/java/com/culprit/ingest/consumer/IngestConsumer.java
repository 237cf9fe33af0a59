package com.culprit.ingest.consumer;

import com.culprit.ingest.dto.EventBatch;
import com.culprit.ingest.dto.MetricBatch;
import com.culprit.ingest.service.IngestionService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Consumes single metric points and events published as JSON envelopes:
 * <pre>
 * {"incident_id": "...", "kind": "metric", "metric_name": "...", "ts": "...", "value": 1.0}
 * {"incident_id": "...", "kind": "event", "event_type": "...", "ts": "...", "meta": {...}}
 * </pre>
 * Bad records are counted and skipped so one poison message never stalls the partition.
 */
@Component
@Profile("kafka")
public class IngestConsumer {

  private static final Logger log = LoggerFactory.getLogger(IngestConsumer.class);
  private static final TypeReference<Map<String, Object>> META_TYPE = new TypeReference<>() {};

  private final IngestionService ingestion;
  private final ObjectMapper mapper;
  private final Counter consumed;
  private final Counter rejected;

  public IngestConsumer(IngestionService ingestion, ObjectMapper mapper, MeterRegistry metrics) {
    this.ingestion = ingestion;
    this.mapper = mapper;
    this.consumed = metrics.counter("culprit_ingest_messages_consumed_total");
    this.rejected = metrics.counter("culprit_ingest_rejected_total");
  }

  @KafkaListener(
    topics = "${culprit.ingest.topic:incident-ingest}",
    concurrency = "${culprit.ingest.concurrency:1}"
  )
  public void onMessage(ConsumerRecord<String, String> record) {
    try {
      handle(record.value());
      consumed.increment();
      log.debug("Processed record from partition={} offset={}", record.partition(), record.offset());
    } catch (RuntimeException e) {
      rejected.increment();
      log.warn("Rejected ingest record partition={} offset={}: {}",
          record.partition(), record.offset(), e.getMessage());
    }
  }

  private void handle(String payload) {
    if (payload == null || payload.isBlank()) {
      throw new IllegalArgumentException("empty payload");
    }
    JsonNode node;
    try {
      node = mapper.readTree(payload);
    } catch (Exception e) {
      throw new IllegalArgumentException("payload is not JSON");
    }
    String incidentId = text(node, "incident_id");
    String kind = text(node, "kind");
    Instant ts = parseInstant(text(node, "ts"));

    if ("metric".equals(kind)) {
      JsonNode value = node.get("value");
      Double v = value != null && value.isNumber() ? value.asDouble() : null;
      ingestion.ingestPoints(incidentId, List.of(new MetricBatch.Item(text(node, "metric_name"), ts, v)));
    } else if ("event".equals(kind)) {
      JsonNode meta = node.get("meta");
      Map<String, Object> m = meta != null && meta.isObject() ? mapper.convertValue(meta, META_TYPE) : Map.of();
      ingestion.ingestEvents(incidentId, List.of(new EventBatch.Item(text(node, "event_type"), ts, m)));
    } else {
      throw new IllegalArgumentException("unknown kind '" + kind + "'");
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode f = node.get(field);
    return f == null || f.isNull() ? null : f.asText();
  }

  private static Instant parseInstant(String s) {
    if (s == null) return null;
    try { return Instant.parse(s); } catch (Exception e) { return null; }
  }
}
