package com.culprit.analysis.repo;

import com.culprit.analysis.entity.DbIncident;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DbIncidentRepository extends JpaRepository<DbIncident, String> {}
