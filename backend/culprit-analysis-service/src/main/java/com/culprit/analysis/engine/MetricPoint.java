package com.culprit.analysis.engine;

import java.time.Instant;

public record MetricPoint(String metricName, Instant timestamp, double value) {}
