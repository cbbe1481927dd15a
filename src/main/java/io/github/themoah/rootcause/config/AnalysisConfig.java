package io.github.themoah.rootcause.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tuning knobs of the analysis engine.
 *
 * @param zThreshold minimum |z| for a point to count as an anomaly (default 3.0)
 * @param baselineMinPoints lower bound of the baseline window (default 30)
 * @param baselineFraction fraction of the series used as baseline window (default 0.25)
 * @param episodeGapSeconds largest gap between anomalies of one episode (default 120)
 * @param correlationWindowSeconds largest event to episode distance considered (default 600)
 * @param agreementBonus confidence added when overlapping episodes of several metrics agree (default 0.35)
 * @param maxCauses default cap on returned causes, 0 or less for no cap (default 0)
 * @param parallelism worker threads for per-metric scoring, 1 runs inline (default: available processors)
 */
public record AnalysisConfig(
  double zThreshold,
  int baselineMinPoints,
  double baselineFraction,
  long episodeGapSeconds,
  long correlationWindowSeconds,
  double agreementBonus,
  int maxCauses,
  int parallelism
) {

  private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

  public static final double DEFAULT_Z_THRESHOLD = 3.0;
  public static final int DEFAULT_BASELINE_MIN_POINTS = 30;
  public static final double DEFAULT_BASELINE_FRACTION = 0.25;
  public static final long DEFAULT_EPISODE_GAP_SECONDS = 120;
  public static final long DEFAULT_CORRELATION_WINDOW_SECONDS = 600;
  public static final double DEFAULT_AGREEMENT_BONUS = 0.35;
  public static final int DEFAULT_MAX_CAUSES = 0;

  /**
   * Configuration with the documented defaults and inline (single threaded) scoring.
   */
  public static AnalysisConfig defaults() {
    return new AnalysisConfig(
      DEFAULT_Z_THRESHOLD,
      DEFAULT_BASELINE_MIN_POINTS,
      DEFAULT_BASELINE_FRACTION,
      DEFAULT_EPISODE_GAP_SECONDS,
      DEFAULT_CORRELATION_WINDOW_SECONDS,
      DEFAULT_AGREEMENT_BONUS,
      DEFAULT_MAX_CAUSES,
      1
    );
  }

  public AnalysisConfig withParallelism(int threads) {
    return new AnalysisConfig(zThreshold, baselineMinPoints, baselineFraction, episodeGapSeconds,
      correlationWindowSeconds, agreementBonus, maxCauses, threads);
  }

  public AnalysisConfig withMaxCauses(int limit) {
    return new AnalysisConfig(zThreshold, baselineMinPoints, baselineFraction, episodeGapSeconds,
      correlationWindowSeconds, agreementBonus, limit, parallelism);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>RCA_Z_THRESHOLD - anomaly threshold in standard deviations (default: 3.0)</li>
   *   <li>RCA_BASELINE_MIN_POINTS - minimum baseline window (default: 30)</li>
   *   <li>RCA_BASELINE_FRACTION - baseline window as a fraction of the series (default: 0.25)</li>
   *   <li>RCA_EPISODE_GAP_SECONDS - max gap inside one episode (default: 120)</li>
   *   <li>RCA_CORRELATION_WINDOW_SECONDS - max event distance (default: 600)</li>
   *   <li>RCA_AGREEMENT_BONUS - multi-metric agreement bonus (default: 0.35)</li>
   *   <li>RCA_MAX_CAUSES - cap on returned causes, 0 = unlimited (default: 0)</li>
   *   <li>RCA_PARALLELISM - per-metric scoring threads (default: available processors)</li>
   * </ul>
   */
  public static AnalysisConfig fromEnvironment() {
    double zThreshold = parseDouble("RCA_Z_THRESHOLD", DEFAULT_Z_THRESHOLD);
    int minPoints = parseInt("RCA_BASELINE_MIN_POINTS", DEFAULT_BASELINE_MIN_POINTS);
    double fraction = parseDouble("RCA_BASELINE_FRACTION", DEFAULT_BASELINE_FRACTION);
    long gap = parseLong("RCA_EPISODE_GAP_SECONDS", DEFAULT_EPISODE_GAP_SECONDS);
    long window = parseLong("RCA_CORRELATION_WINDOW_SECONDS", DEFAULT_CORRELATION_WINDOW_SECONDS);
    double bonus = parseDouble("RCA_AGREEMENT_BONUS", DEFAULT_AGREEMENT_BONUS);
    int maxCauses = parseInt("RCA_MAX_CAUSES", DEFAULT_MAX_CAUSES);
    int parallelism = parseInt("RCA_PARALLELISM", Runtime.getRuntime().availableProcessors());

    if (fraction <= 0 || fraction > 1) {
      log.warn("RCA_BASELINE_FRACTION must be in (0, 1], using default: {}", DEFAULT_BASELINE_FRACTION);
      fraction = DEFAULT_BASELINE_FRACTION;
    }
    if (window <= 0) {
      log.warn("RCA_CORRELATION_WINDOW_SECONDS must be > 0, using default: {}",
        DEFAULT_CORRELATION_WINDOW_SECONDS);
      window = DEFAULT_CORRELATION_WINDOW_SECONDS;
    }
    if (parallelism < 1) {
      log.warn("RCA_PARALLELISM must be >= 1, using 1");
      parallelism = 1;
    }

    AnalysisConfig config = new AnalysisConfig(
      zThreshold, minPoints, fraction, gap, window, bonus, maxCauses, parallelism);
    log.info("Analysis config: zThreshold={}, baselineMinPoints={}, baselineFraction={}, "
        + "episodeGapSeconds={}, correlationWindowSeconds={}, agreementBonus={}, maxCauses={}, parallelism={}",
      zThreshold, minPoints, fraction, gap, window, bonus, maxCauses, parallelism);

    return config;
  }

  private static double parseDouble(String envVar, double defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }

  private static int parseInt(String envVar, int defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }

  private static long parseLong(String envVar, long defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
