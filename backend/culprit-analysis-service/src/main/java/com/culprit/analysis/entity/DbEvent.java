package com.culprit.analysis.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "events")
public class DbEvent {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private String incidentId;

  @Column(nullable = false)
  private String eventType;

  @Column(name = "ts", nullable = false)
  private Instant timestamp;

  // JSON object text
  @Column(columnDefinition = "text")
  private String metadata;

  public Long getId() { return id; }
  public String getIncidentId() { return incidentId; }
  public String getEventType() { return eventType; }
  public Instant getTimestamp() { return timestamp; }
  public String getMetadata() { return metadata; }
}
