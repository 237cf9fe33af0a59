package com.culprit.analysis.engine;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.culprit.analysis.engine.Series.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CauseCorrelatorTest {

  private final CauseCorrelator correlator = new CauseCorrelator(AnalysisSettings.defaults());

  private final Episode spike = episode("latency", T0, T0, 160, 30);

  @Test
  void contributionIsProximityTimesPriorTimesWeights() {
    List<CauseCandidate> causes = correlator.rank(List.of(spike), new double[] {0.0},
        List.of(event("1", "deploy", T0.minusSeconds(180))));

    assertThat(causes).hasSize(1);
    // proximity 0.7, prior 1.0, severity capped to 1.0, no agreement
    assertThat(causes.get(0).score()).isCloseTo(0.7, within(1e-12));
    assertThat(causes.get(0).confidence()).isEqualTo(1.0);
  }

  @Test
  void evidenceDescribesEpisodeAndOffset() {
    List<CauseCandidate> causes = correlator.rank(List.of(spike), new double[] {0.0},
        List.of(event("1", "deploy", T0.minusSeconds(180))));

    assertThat(causes.get(0).evidence()).containsExactly(
        "latency abnormal 2024-05-01T12:00:00Z -> 2024-05-01T12:00:00Z: baseline 100.00 -> peak 160.00"
            + " (+60.0%, |z|=30.0); deploy 3.0 min before onset");
  }

  @Test
  void priorsRankEqualDistanceEvents() {
    List<CauseCandidate> causes = correlator.rank(List.of(spike), new double[] {0.0}, List.of(
        event("1", "config_change", T0.minusSeconds(120)),
        event("2", "deploy", T0.minusSeconds(120)),
        event("3", "something_else", T0.minusSeconds(120))));

    assertThat(causes).extracting(c -> c.event().eventType())
        .containsExactly("deploy", "config_change", "something_else");
    assertThat(causes.get(0).confidence()).isEqualTo(1.0);
    assertThat(causes.get(1).confidence()).isCloseTo(0.85, within(1e-12));
    assertThat(causes.get(2).confidence()).isCloseTo(0.6, within(1e-12));
  }

  @Test
  void eventsBeyondWindowAreNeverCandidates() {
    List<CauseCandidate> causes = correlator.rank(List.of(spike), new double[] {0.0},
        List.of(event("1", "deploy", T0.plusSeconds(601)), event("2", "deploy", T0.minusSeconds(3_600))));

    assertThat(causes).isEmpty();
  }

  @Test
  void eventOnWindowEdgeIsZeroWeightCandidateNextToScoringCause() {
    Event deploy = event("1", "deploy", T0.minusSeconds(180));
    Event note = event("2", "incident_note", T0.plusSeconds(600));

    List<CauseCandidate> causes = correlator.rank(List.of(spike), new double[] {0.0}, List.of(deploy, note));

    assertThat(causes).extracting(CauseCandidate::event).containsExactly(deploy, note);
    assertThat(causes.get(0).confidence()).isEqualTo(1.0);
    assertThat(causes.get(1).score()).isEqualTo(0.0);
    assertThat(causes.get(1).confidence()).isEqualTo(0.0);
    assertThat(causes.get(1).evidence()).singleElement().asString().endsWith("incident_note 10.0 min after onset");
  }

  @Test
  void onlyZeroWeightCandidatesYieldNoCauses() {
    Event edge = event("1", "deploy", T0.plusSeconds(600));

    assertThat(correlator.rank(List.of(spike), new double[] {0.0}, List.of(edge))).isEmpty();
  }

  @Test
  void tiedCandidatesOrderNumericIdsNumerically() {
    Event ten = event("10", "deploy", T0.minusSeconds(60));
    Event nine = event("9", "deploy", T0.minusSeconds(60));

    List<CauseCandidate> causes = correlator.rank(List.of(spike), new double[] {0.0}, List.of(ten, nine));

    assertThat(causes).extracting(c -> c.event().id()).containsExactly("9", "10");
  }

  @Test
  void contributionsAccumulateAcrossEpisodes() {
    Event deploy = event("1", "deploy", T0);
    Event flag = event("2", "feature_flag", T0.plusSeconds(300));
    Episode other = episode("errors", T0.plusSeconds(300), T0.plusSeconds(300), 160, 30);

    List<CauseCandidate> causes = correlator.rank(List.of(spike, other), new double[] {0.0, 0.0},
        List.of(deploy, flag));

    // deploy: 1.0 + 0.5, flag: 0.5 * 0.75 + 1.0 * 0.75
    assertThat(causes.get(0).event()).isEqualTo(deploy);
    assertThat(causes.get(0).score()).isCloseTo(1.5, within(1e-12));
    assertThat(causes.get(1).score()).isCloseTo(1.125, within(1e-12));
    assertThat(causes.get(1).confidence()).isCloseTo(0.75, within(1e-12));
  }

  @Test
  void agreementIsCappedAfterSummation() {
    List<Event> events = List.of(event("1", "deploy", T0));

    double none = correlator.rank(List.of(spike), new double[] {0.0}, events).get(0).score();
    double atCap = correlator.rank(List.of(spike), new double[] {0.6}, events).get(0).score();
    double above = correlator.rank(List.of(spike), new double[] {1.4}, events).get(0).score();

    assertThat(atCap).isCloseTo(none * 1.6, within(1e-12));
    assertThat(above).isEqualTo(atCap);
  }

  @Test
  void severityWeightRangesFromFloorToOne() {
    assertThat(correlator.severityWeight(episode("m", T0, T0, 130, 3.0))).isCloseTo(0.685, within(1e-12));
    assertThat(correlator.severityWeight(episode("m", T0, T0, 200, 10.0))).isCloseTo(1.0, within(1e-12));
    assertThat(correlator.severityWeight(episode("m", T0, T0, 900, 80.0))).isCloseTo(1.0, within(1e-12));
  }

  @Test
  void truncatesEvidenceAndCauseList() {
    List<Episode> episodes = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      episodes.add(episode("metric-" + i, T0.plusSeconds(i), T0.plusSeconds(i), 160, 30));
    }
    List<Event> events = new ArrayList<>();
    for (int i = 0; i < 7; i++) {
      events.add(event(String.valueOf(i), "deploy", T0.minusSeconds(30L * i)));
    }

    List<CauseCandidate> causes = correlator.rank(episodes, new double[8], events);

    assertThat(causes).hasSize(5);
    assertThat(causes).allSatisfy(c -> assertThat(c.evidence()).hasSize(6));
    assertThat(causes).extracting(c -> c.event().id()).containsExactly("0", "1", "2", "3", "4");
    assertThat(causes.get(0).confidence()).isEqualTo(1.0);
    assertThat(causes).allSatisfy(c -> assertThat(c.confidence()).isBetween(0.0, 1.0));
  }
}
