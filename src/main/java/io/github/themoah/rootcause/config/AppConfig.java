package io.github.themoah.rootcause.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port
 * @param analysisTimeoutMs upper bound for one analysis request before it is answered with 503
 */
public record AppConfig(
  int httpPort,
  long analysisTimeoutMs
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final long DEFAULT_ANALYSIS_TIMEOUT_MS = 30_000L;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    long timeout = getEnvLong("RCA_ANALYSIS_TIMEOUT_MS", DEFAULT_ANALYSIS_TIMEOUT_MS);

    log.info("AppConfig loaded: httpPort={}, analysisTimeoutMs={}", port, timeout);
    return new AppConfig(port, timeout);
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
