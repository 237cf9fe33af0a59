package com.culprit.ingest.repo;

import com.culprit.ingest.model.Incident;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IncidentRepository extends JpaRepository<Incident, String> {}
