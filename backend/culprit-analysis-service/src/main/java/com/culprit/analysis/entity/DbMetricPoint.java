package com.culprit.analysis.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "metric_points")
public class DbMetricPoint {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private String incidentId;

  @Column(nullable = false)
  private String metricName;

  @Column(name = "ts", nullable = false)
  private Instant timestamp;

  @Column(name = "point_value", nullable = false)
  private double value;

  public Long getId() { return id; }
  public String getIncidentId() { return incidentId; }
  public String getMetricName() { return metricName; }
  public Instant getTimestamp() { return timestamp; }
  public double getValue() { return value; }
}
