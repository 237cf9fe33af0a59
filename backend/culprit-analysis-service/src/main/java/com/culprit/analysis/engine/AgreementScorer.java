package com.culprit.analysis.engine;

import java.util.List;

/**
 * Rewards episodes that are corroborated by simultaneous abnormal behaviour elsewhere.
 * Every overlapping pair adds the bonus to both sides; totals are uncapped here.
 */
public class AgreementScorer {

  private final AnalysisSettings settings;

  public AgreementScorer(AnalysisSettings settings) {
    this.settings = settings;
  }

  /** @return raw agreement totals indexed like {@code episodes} */
  public double[] score(List<Episode> episodes) {
    int n = episodes.size();
    double[] totals = new double[n];
    // O(n^2); episode counts per incident are small
    for (int i = 0; i < n; i++) {
      Episode a = episodes.get(i);
      for (int j = i + 1; j < n; j++) {
        if (a.overlaps(episodes.get(j))) {
          totals[i] += settings.agreementBonus();
          totals[j] += settings.agreementBonus();
        }
      }
    }
    return totals;
  }
}
