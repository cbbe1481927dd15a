package io.github.themoah.rootcause.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param analyzer analyzer state (null for liveness check)
 * @param incidents number of tracked incidents (null for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String analyzer,
  Integer incidents
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null, null);
  }

  /**
   * Creates a readiness response.
   *
   * @param analyzerRunning true if the analyzer accepts work
   * @param incidents number of incidents held by the store
   */
  public static HealthCheckResponse readiness(boolean analyzerRunning, int incidents) {
    HealthStatus status = HealthStatus.of(analyzerRunning);
    String analyzer = analyzerRunning ? "running" : "stopped";
    return new HealthCheckResponse(status, analyzer, incidents);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (analyzer != null) {
      json.put("analyzer", analyzer);
    }
    if (incidents != null) {
      json.put("incidents", incidents);
    }
    return json;
  }
}
