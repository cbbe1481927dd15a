package io.github.themoah.rootcause.analysis;

import io.github.themoah.rootcause.model.Anomaly;
import io.github.themoah.rootcause.model.Baseline;
import io.github.themoah.rootcause.model.MetricPoint;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags points that deviate from their metric's baseline by at least
 * {@code zThreshold} standard deviations, in either direction.
 *
 * <p>Every point is scored, including those that formed the baseline window.
 */
public class AnomalyDetector {

  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  private final double zThreshold;

  public AnomalyDetector(double zThreshold) {
    this.zThreshold = zThreshold;
  }

  /**
   * Scores all points of one metric.
   *
   * @param metricName the metric
   * @param points the metric's points in ascending timestamp order
   * @param baseline the metric's baseline
   * @return anomalies in timestamp order; empty when the baseline is degenerate
   */
  public List<Anomaly> detect(String metricName, List<MetricPoint> points, Baseline baseline) {
    if (baseline == null || baseline.isDegenerate()) {
      log.info("Skipping anomaly detection for metric={}: degenerate baseline (samples={})",
        metricName, baseline == null ? 0 : baseline.sampleCount());
      return List.of();
    }

    List<Anomaly> anomalies = new ArrayList<>();
    for (MetricPoint point : points) {
      double z = StatisticalUtils.zScore(point.value(), baseline.mean(), baseline.std());
      if (isAnomalous(z)) {
        anomalies.add(new Anomaly(point, baseline, z));
      }
    }

    if (!anomalies.isEmpty()) {
      log.debug("Detected {} anomalies for metric={} (threshold={})",
        anomalies.size(), metricName, zThreshold);
    }
    return anomalies;
  }

  boolean isAnomalous(double zScore) {
    return Math.abs(zScore) >= zThreshold;
  }
}
