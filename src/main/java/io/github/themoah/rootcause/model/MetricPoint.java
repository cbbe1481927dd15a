package io.github.themoah.rootcause.model;

import java.time.Instant;

/**
 * A single observation of a metric.
 *
 * @param metricName the metric this point belongs to
 * @param timestamp when the value was observed
 * @param value the observed value
 */
public record MetricPoint(
  String metricName,
  Instant timestamp,
  double value
) {}
