package com.culprit.ingest.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(
  name = "events",
  indexes = {
    @Index(name = "idx_events_incident_ts", columnList = "incident_id,ts")
  },
  uniqueConstraints = {
    @UniqueConstraint(name = "uq_event", columnNames = {"incident_id", "ts", "event_type"})
  }
)
public class IncidentEvent {
  @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "incident_id", nullable = false) private String incidentId;
  @Column(name = "event_type", nullable = false) private String eventType;
  @Column(name = "ts", nullable = false) private Instant timestamp;
  @Column(name = "metadata", columnDefinition = "text") private String metadata;

  public Long getId() { return id; }
  public String getIncidentId() { return incidentId; }
  public void setIncidentId(String incidentId) { this.incidentId = incidentId; }
  public String getEventType() { return eventType; }
  public void setEventType(String eventType) { this.eventType = eventType; }
  public Instant getTimestamp() { return timestamp; }
  public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
  public String getMetadata() { return metadata; }
  public void setMetadata(String metadata) { this.metadata = metadata; }
}
