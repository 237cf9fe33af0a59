package com.culprit.analysis.repo;

import com.culprit.analysis.entity.DbEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DbEventRepository extends JpaRepository<DbEvent, Long> {
  List<DbEvent> findByIncidentIdOrderByTimestampAscIdAsc(String incidentId);
}
