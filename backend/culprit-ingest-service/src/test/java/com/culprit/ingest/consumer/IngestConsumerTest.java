package com.culprit.ingest.consumer;

import com.culprit.ingest.dto.EventBatch;
import com.culprit.ingest.dto.MetricBatch;
import com.culprit.ingest.service.IncidentNotFoundException;
import com.culprit.ingest.service.IngestionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestConsumerTest {

  @Mock
  private IngestionService ingestion;

  private SimpleMeterRegistry registry;
  private IngestConsumer consumer;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    consumer = new IngestConsumer(ingestion, new ObjectMapper(), registry);
  }

  @Test
  void metricEnvelopeIsIngestedAsSinglePoint() {
    consumer.onMessage(record("{\"incident_id\":\"INC-1\",\"kind\":\"metric\",\"metric_name\":\"latency\","
        + "\"ts\":\"2024-05-01T12:00:00Z\",\"value\":12.5}"));

    verify(ingestion).ingestPoints("INC-1",
        List.of(new MetricBatch.Item("latency", Instant.parse("2024-05-01T12:00:00Z"), 12.5)));
    assertThat(registry.counter("culprit_ingest_messages_consumed_total").count()).isEqualTo(1.0);
  }

  @Test
  void eventEnvelopeCarriesMeta() {
    consumer.onMessage(record("{\"incident_id\":\"INC-1\",\"kind\":\"event\",\"event_type\":\"deploy\","
        + "\"ts\":\"2024-05-01T11:57:00Z\",\"meta\":{\"version\":\"1.2.3\"}}"));

    verify(ingestion).ingestEvents("INC-1",
        List.of(new EventBatch.Item("deploy", Instant.parse("2024-05-01T11:57:00Z"), Map.of("version", "1.2.3"))));
  }

  @Test
  void malformedPayloadIsCountedAndSkipped() {
    consumer.onMessage(record("not json"));
    consumer.onMessage(record("{\"incident_id\":\"INC-1\",\"kind\":\"log\"}"));

    verifyNoInteractions(ingestion);
    assertThat(registry.counter("culprit_ingest_rejected_total").count()).isEqualTo(2.0);
  }

  @Test
  void serviceRejectionDoesNotEscapeListener() {
    when(ingestion.ingestPoints(eq("gone"), anyList())).thenThrow(new IncidentNotFoundException("gone"));

    consumer.onMessage(record("{\"incident_id\":\"gone\",\"kind\":\"metric\",\"metric_name\":\"cpu\","
        + "\"ts\":\"2024-05-01T12:00:00Z\",\"value\":1}"));

    assertThat(registry.counter("culprit_ingest_rejected_total").count()).isEqualTo(1.0);
    assertThat(registry.counter("culprit_ingest_messages_consumed_total").count()).isZero();
  }

  private static ConsumerRecord<String, String> record(String value) {
    return new ConsumerRecord<>("incident-ingest", 0, 5L, "key", value);
  }
}
