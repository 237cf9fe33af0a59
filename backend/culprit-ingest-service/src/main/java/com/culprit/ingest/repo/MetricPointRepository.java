package com.culprit.ingest.repo;

import com.culprit.ingest.model.MetricPoint;
import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MetricPointRepository extends JpaRepository<MetricPoint, Long> {
  boolean existsByIncidentIdAndTimestampAndMetricName(String incidentId, Instant timestamp, String metricName);

  long countByIncidentId(String incidentId);
}
