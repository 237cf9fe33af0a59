package com.culprit.ingest.repo;

import com.culprit.ingest.model.IncidentEvent;
import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IncidentEventRepository extends JpaRepository<IncidentEvent, Long> {
  boolean existsByIncidentIdAndTimestampAndEventType(String incidentId, Instant timestamp, String eventType);

  long countByIncidentId(String incidentId);
}
