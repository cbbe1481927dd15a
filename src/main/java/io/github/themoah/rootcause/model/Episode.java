package io.github.themoah.rootcause.model;

import io.vertx.core.json.JsonObject;
import java.time.Instant;

/**
 * A contiguous abnormal window of one metric.
 *
 * @param metricName the metric
 * @param start timestamp of the first anomaly
 * @param end timestamp of the last anomaly
 * @param baselineMean baseline mean of the metric
 * @param baselineStd baseline standard deviation of the metric
 * @param peakValue value of the most deviant anomaly
 * @param peakZScore z-score of the most deviant anomaly
 * @param percentChange (peak - mean) / mean * 100, NaN when the mean is zero
 */
public record Episode(
  String metricName,
  Instant start,
  Instant end,
  double baselineMean,
  double baselineStd,
  double peakValue,
  double peakZScore,
  double percentChange
) {

  public boolean hasPercentChange() {
    return !Double.isNaN(percentChange);
  }

  /**
   * Inclusive overlap of the two time ranges.
   */
  public boolean overlaps(Episode other) {
    return !start.isAfter(other.end) && !other.start.isAfter(end);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("metric_name", metricName)
      .put("start_ts", start.toString())
      .put("end_ts", end.toString())
      .put("baseline_mean", baselineMean)
      .put("baseline_std", baselineStd)
      .put("peak_value", peakValue)
      .put("peak_z_score", peakZScore);
    if (hasPercentChange()) {
      json.put("percent_change", percentChange);
    } else {
      json.putNull("percent_change");
    }
    return json;
  }
}
