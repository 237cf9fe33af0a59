package com.culprit.analysis.controller;

import com.culprit.analysis.config.DatabaseStartupCheck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for {@link AnalysisController} against an in-memory database.
 */
@SpringBootTest
@AutoConfigureMockMvc
class AnalysisControllerIntegrationTest {

  private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private JdbcTemplate jdbc;

  @Autowired
  private DatabaseStartupCheck startupCheck;

  @BeforeEach
  void setUp() {
    jdbc.update("DELETE FROM metric_points");
    jdbc.update("DELETE FROM events");
    jdbc.update("DELETE FROM incidents");

    jdbc.update("INSERT INTO incidents (id, title, created_at) VALUES (?, ?, ?)",
        "INC-1", "checkout latency", utc(T0));
    for (int i = 0; i < 20; i++) {
      double value = i == 19 ? 160.0 : (i % 2 == 0 ? 98.0 : 102.0);
      jdbc.update("INSERT INTO metric_points (incident_id, metric_name, ts, point_value) VALUES (?, ?, ?, ?)",
          "INC-1", "latency", utc(T0.plusSeconds(60L * i)), value);
    }
    jdbc.update("INSERT INTO events (incident_id, event_type, ts, metadata) VALUES (?, ?, ?, ?)",
        "INC-1", "deploy", utc(T0.plusSeconds(16 * 60)), "{\"version\":\"1.2.3\"}");
    jdbc.update("INSERT INTO events (incident_id, event_type, ts, metadata) VALUES (?, ?, ?, ?)",
        "INC-1", "feature_flag", utc(T0.minusSeconds(3_600)), null);
  }

  @Test
  void returnsRankedAnalysis() throws Exception {
    mockMvc.perform(get("/api/incidents/INC-1/analysis"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.incident_id").value("INC-1"))
        .andExpect(jsonPath("$.anomalies.length()").value(1))
        .andExpect(jsonPath("$.anomalies[0].metric_name").value("latency"))
        .andExpect(jsonPath("$.anomalies[0].ts").value("2024-05-01T12:19:00Z"))
        .andExpect(jsonPath("$.anomalies[0].z_score").value(closeTo(30.0, 1e-9)))
        .andExpect(jsonPath("$.episodes.length()").value(1))
        .andExpect(jsonPath("$.episodes[0].start_ts").value("2024-05-01T12:19:00Z"))
        .andExpect(jsonPath("$.episodes[0].percent_change").value(closeTo(60.0, 1e-9)))
        .andExpect(jsonPath("$.likely_causes.length()").value(1))
        .andExpect(jsonPath("$.likely_causes[0].event_type").value("deploy"))
        .andExpect(jsonPath("$.likely_causes[0].meta.version").value("1.2.3"))
        .andExpect(jsonPath("$.likely_causes[0].confidence").value(1.0))
        .andExpect(jsonPath("$.likely_causes[0].evidence[0]").value(containsString("+60.0%")));
  }

  @Test
  void unknownIncidentIs404() throws Exception {
    mockMvc.perform(get("/api/incidents/nope/analysis"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("Incident not found"));
  }

  @Test
  void healthReportsOk() throws Exception {
    mockMvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));
  }

  @Test
  void startupCheckReachesDatabase() {
    assertThat(startupCheck.verifyConnection()).isTrue();
  }

  private static OffsetDateTime utc(Instant instant) {
    return instant.atOffset(ZoneOffset.UTC);
  }
}
