package io.github.themoah.rootcause.analysis;

import io.github.themoah.rootcause.model.MetricPoint;
import java.util.List;

/**
 * Statistical helpers shared by baseline estimation and anomaly scoring.
 */
public final class StatisticalUtils {

  private StatisticalUtils() {}

  /**
   * Mean and population standard deviation (divide by n) of the first {@code count}
   * points, accumulated in a single pass with Welford's update.
   *
   * @param points the points, already in timestamp order
   * @param count how many leading points to include
   * @return statistics over the window; stdDev is 0 when fewer than two points are included
   */
  public static Stats calculateStats(List<MetricPoint> points, int count) {
    int n = Math.min(count, points.size());
    if (n <= 0) {
      return new Stats(0.0, 0.0, 0);
    }

    double mean = 0.0;
    double m2 = 0.0;
    for (int i = 0; i < n; i++) {
      double value = points.get(i).value();
      double delta = value - mean;
      mean += delta / (i + 1);
      m2 += delta * (value - mean);
    }

    if (n < 2) {
      return new Stats(mean, 0.0, n);
    }
    double variance = Math.max(0.0, m2 / n);
    return new Stats(mean, Math.sqrt(variance), n);
  }

  /**
   * Calculates the z-score for a value.
   *
   * @return (value - mean) / stdDev, or 0 if stdDev is not positive
   */
  public static double zScore(double value, double mean, double stdDev) {
    if (!(stdDev > 0.0)) {
      return 0.0;
    }
    return (value - mean) / stdDev;
  }

  /**
   * Relative change of a value against a reference, in percent.
   *
   * @return (value - reference) / reference * 100, or NaN when reference is 0
   */
  public static double percentChange(double value, double reference) {
    if (reference == 0.0) {
      return Double.NaN;
    }
    return (value - reference) / reference * 100.0;
  }

  /**
   * Statistics over a window of points.
   *
   * @param mean the arithmetic mean
   * @param stdDev the population standard deviation
   * @param count number of points in the window
   */
  public record Stats(double mean, double stdDev, int count) {}
}
