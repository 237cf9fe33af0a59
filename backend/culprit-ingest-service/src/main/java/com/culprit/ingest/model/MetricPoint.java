package com.culprit.ingest.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(
  name = "metric_points",
  indexes = {
    @Index(name = "idx_metric_points_series", columnList = "incident_id,metric_name,ts")
  },
  uniqueConstraints = {
    @UniqueConstraint(name = "uq_metric_point", columnNames = {"incident_id", "ts", "metric_name"})
  }
)
public class MetricPoint {
  @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "incident_id", nullable = false) private String incidentId;
  @Column(name = "metric_name", nullable = false) private String metricName;
  @Column(name = "ts", nullable = false) private Instant timestamp;
  @Column(name = "point_value", nullable = false) private double value;

  public Long getId() { return id; }
  public String getIncidentId() { return incidentId; }
  public void setIncidentId(String incidentId) { this.incidentId = incidentId; }
  public String getMetricName() { return metricName; }
  public void setMetricName(String metricName) { this.metricName = metricName; }
  public Instant getTimestamp() { return timestamp; }
  public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
  public double getValue() { return value; }
  public void setValue(double value) { this.value = value; }
}
