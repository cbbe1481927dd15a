package io.github.themoah.rootcause.analysis;

import io.github.themoah.rootcause.analysis.StatisticalUtils.Stats;
import io.github.themoah.rootcause.model.Baseline;
import io.github.themoah.rootcause.model.MetricPoint;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a metric's baseline from the leading portion of its series.
 *
 * <p>The window holds max(minPoints, ceil(fraction * N)) points, capped at N.
 * Baselines are recomputed for every analysis and never shared between metrics.
 */
public class BaselineEstimator {

  private static final Logger log = LoggerFactory.getLogger(BaselineEstimator.class);

  private final int minPoints;
  private final double fraction;

  public BaselineEstimator(int minPoints, double fraction) {
    this.minPoints = minPoints;
    this.fraction = fraction;
  }

  /**
   * Number of leading points used as baseline for a series of the given length.
   */
  public int windowSize(int seriesLength) {
    if (seriesLength <= 0) {
      return 0;
    }
    int fractional = (int) Math.ceil(fraction * seriesLength);
    return Math.min(seriesLength, Math.max(minPoints, fractional));
  }

  /**
   * Estimates the baseline of one metric.
   *
   * @param metricName the metric, used for logging
   * @param points the metric's points in ascending timestamp order
   * @return the baseline, or null if the series is empty
   */
  public Baseline estimate(String metricName, List<MetricPoint> points) {
    if (points.isEmpty()) {
      return null;
    }

    int window = windowSize(points.size());
    Stats stats = StatisticalUtils.calculateStats(points, window);
    Baseline baseline = new Baseline(stats.mean(), stats.stdDev(), stats.count());

    log.debug("Baseline for metric={}: window={}/{}, mean={}, std={}",
      metricName, window, points.size(),
      String.format("%.4f", baseline.mean()), String.format("%.4f", baseline.std()));

    return baseline;
  }
}
