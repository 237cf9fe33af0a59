package com.culprit.analysis.engine;

/**
 * Reference statistics of one metric.
 *
 * @param scoringStart index of the first point scored against this baseline
 */
public record Baseline(double mean, double std, int scoringStart) {}
