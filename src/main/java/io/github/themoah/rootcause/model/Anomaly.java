package io.github.themoah.rootcause.model;

import io.vertx.core.json.JsonObject;

/**
 * A metric point whose z-score magnitude reached the detection threshold.
 *
 * @param point the offending observation
 * @param baseline the baseline it was scored against
 * @param zScore standardized deviation from the baseline mean
 */
public record Anomaly(
  MetricPoint point,
  Baseline baseline,
  double zScore
) {

  public String metricName() {
    return point.metricName();
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("metric_name", point.metricName())
      .put("ts", point.timestamp().toString())
      .put("value", point.value())
      .put("baseline_mean", baseline.mean())
      .put("baseline_std", baseline.std())
      .put("z_score", zScore);
  }
}
