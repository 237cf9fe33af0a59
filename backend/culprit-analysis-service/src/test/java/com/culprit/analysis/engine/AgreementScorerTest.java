package com.culprit.analysis.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.culprit.analysis.engine.Series.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AgreementScorerTest {

  private final AgreementScorer scorer = new AgreementScorer(AnalysisSettings.defaults());

  @Test
  void overlappingPairGetsBonusOnBothSides() {
    double[] totals = scorer.score(List.of(
        episode("latency", T0, T0.plusSeconds(120), 150, 5),
        episode("errors", T0.plusSeconds(60), T0.plusSeconds(300), 150, 5)));

    assertThat(totals[0]).isCloseTo(0.35, within(1e-12));
    assertThat(totals[1]).isCloseTo(0.35, within(1e-12));
  }

  @Test
  void bonusesAccumulatePerOverlap() {
    double[] totals = scorer.score(List.of(
        episode("a", T0, T0.plusSeconds(300), 150, 5),
        episode("b", T0.plusSeconds(60), T0.plusSeconds(120), 150, 5),
        episode("c", T0.plusSeconds(200), T0.plusSeconds(400), 150, 5)));

    // a overlaps b and c, b and c are disjoint
    assertThat(totals[0]).isCloseTo(0.70, within(1e-12));
    assertThat(totals[1]).isCloseTo(0.35, within(1e-12));
    assertThat(totals[2]).isCloseTo(0.35, within(1e-12));
  }

  @Test
  void touchingEndpointsCountAsOverlap() {
    double[] totals = scorer.score(List.of(
        episode("a", T0, T0.plusSeconds(60), 150, 5),
        episode("b", T0.plusSeconds(60), T0.plusSeconds(90), 150, 5),
        episode("c", T0.plusSeconds(91), T0.plusSeconds(95), 150, 5)));

    assertThat(totals).containsExactly(new double[] {0.35, 0.35, 0.0}, within(1e-12));
  }

  @Test
  void totalsAreUncappedAtThisStage() {
    double[] totals = scorer.score(List.of(
        episode("a", T0, T0, 150, 5),
        episode("b", T0, T0, 150, 5),
        episode("c", T0, T0, 150, 5),
        episode("d", T0, T0, 150, 5)));

    assertThat(totals[0]).isCloseTo(1.05, within(1e-12));
  }
}
