package io.github.themoah.rootcause.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service metrics configuration.
 *
 * @param enabled whether a meter registry is created at all
 * @param reporterType prometheus, otlp or datadog
 * @param jvmMetricsEnabled whether JVM binders are attached
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";

  /**
   * Loads METRICS_ENABLED (default true), METRICS_REPORTER (default prometheus)
   * and METRICS_JVM_ENABLED (default true).
   */
  public static MetricsConfig fromEnvironment() {
    boolean enabled = parseBoolean("METRICS_ENABLED", true);
    String reporter = System.getenv("METRICS_REPORTER");
    if (reporter == null || reporter.isBlank()) {
      reporter = DEFAULT_REPORTER;
    }
    boolean jvm = parseBoolean("METRICS_JVM_ENABLED", true);

    log.info("Metrics config: enabled={}, reporter={}, jvmMetrics={}", enabled, reporter, jvm);
    return new MetricsConfig(enabled, reporter, jvm);
  }

  private static boolean parseBoolean(String envVar, boolean defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }
}
