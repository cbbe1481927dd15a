package io.github.themoah.rootcause.health;

/**
 * Health of the service as reported by the probes, with the HTTP status each maps to.
 */
public enum HealthStatus {
  UP("UP", 200),
  DOWN("DOWN", 503);

  private final String value;
  private final int httpStatus;

  HealthStatus(String value, int httpStatus) {
    this.value = value;
    this.httpStatus = httpStatus;
  }

  public String getValue() {
    return value;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public static HealthStatus of(boolean healthy) {
    return healthy ? UP : DOWN;
  }
}
