package io.github.themoah.rootcause.model;

/**
 * Reference behavior of one metric, derived from the leading window of its series.
 *
 * @param mean the window mean
 * @param std population standard deviation of the window (0 when it cannot be estimated)
 * @param sampleCount number of points in the window
 */
public record Baseline(
  double mean,
  double std,
  int sampleCount
) {

  /**
   * A baseline with no spread cannot score deviations.
   */
  public boolean isDegenerate() {
    return !(std > 0.0);
  }
}
