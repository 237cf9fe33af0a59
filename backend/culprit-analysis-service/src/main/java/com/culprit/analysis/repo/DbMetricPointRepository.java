package com.culprit.analysis.repo;

import com.culprit.analysis.entity.DbMetricPoint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DbMetricPointRepository extends JpaRepository<DbMetricPoint, Long> {
  List<DbMetricPoint> findByIncidentIdOrderByMetricNameAscTimestampAsc(String incidentId);
}
