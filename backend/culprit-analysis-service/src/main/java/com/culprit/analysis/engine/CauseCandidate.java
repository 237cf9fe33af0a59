package com.culprit.analysis.engine;

import java.util.List;

public record CauseCandidate(
    Event event,
    double score,
    List<String> evidence,
    double confidence
) {
  public CauseCandidate {
    evidence = List.copyOf(evidence);
  }
}
