package io.github.themoah.rootcause.health;

import io.github.themoah.rootcause.analysis.IncidentAnalyzer;
import io.github.themoah.rootcause.store.IncidentStore;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final IncidentAnalyzer analyzer;
  private final IncidentStore store;

  public HealthCheckHandler(IncidentAnalyzer analyzer, IncidentStore store) {
    this.analyzer = analyzer;
    this.store = store;
  }

  /**
   * Registers health check routes on the router. {@code /health} is kept as an
   * alias of the liveness probe.
   */
  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/health").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /health, /readyz");
  }

  private void handleLiveness(RoutingContext ctx) {
    respond(ctx, HealthCheckResponse.liveness());
  }

  /**
   * Returns 200 while the analyzer accepts work, 503 once it has been shut down.
   */
  private void handleReadiness(RoutingContext ctx) {
    HealthCheckResponse response = HealthCheckResponse.readiness(analyzer.isRunning(), store.incidentCount());
    if (response.status() == HealthStatus.DOWN) {
      log.warn("Readiness probe failed: analyzer is {}", response.analyzer());
    }
    respond(ctx, response);
  }

  private static void respond(RoutingContext ctx, HealthCheckResponse response) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.status().httpStatus())
      .end(response.toJson().encode());
  }
}
