package io.github.themoah.rootcause.api;

import io.github.themoah.rootcause.analysis.IncidentAnalyzer;
import io.github.themoah.rootcause.model.AnalysisResult;
import io.github.themoah.rootcause.model.IncidentSnapshot;
import io.github.themoah.rootcause.store.IncidentStore;
import io.github.themoah.rootcause.store.IngestResult;
import io.github.themoah.rootcause.store.UnknownIncidentException;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP endpoints for incident ingest and analysis.
 */
public class IncidentHandler {

  private static final Logger log = LoggerFactory.getLogger(IncidentHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final Vertx vertx;
  private final IncidentStore store;
  private final IncidentAnalyzer analyzer;
  private final long analysisTimeoutMs;

  public IncidentHandler(Vertx vertx, IncidentStore store, IncidentAnalyzer analyzer, long analysisTimeoutMs) {
    this.vertx = vertx;
    this.store = store;
    this.analyzer = analyzer;
    this.analysisTimeoutMs = analysisTimeoutMs;
  }

  /**
   * Registers incident routes on the router.
   *
   * @param router the Vert.x router
   */
  public void registerRoutes(Router router) {
    router.route("/incidents*").handler(BodyHandler.create());
    router.post("/incidents").handler(this::handleCreate);
    router.post("/incidents/:id/metrics").handler(this::handleMetrics);
    router.post("/incidents/:id/events").handler(this::handleEvents);
    router.get("/incidents/:id/analysis").handler(this::handleAnalysis);
    log.info("Incident routes registered: /incidents, /incidents/:id/{metrics,events,analysis}");
  }

  private void handleCreate(RoutingContext ctx) {
    String incidentId;
    try {
      JsonObject body = optionalBody(ctx);
      incidentId = body == null ? null : body.getString("incident_id");
    } catch (DecodeException | ClassCastException e) {
      badRequest(ctx, "Invalid JSON body: " + e.getMessage());
      return;
    }
    if (incidentId == null || incidentId.isBlank()) {
      incidentId = UUID.randomUUID().toString();
    }

    boolean created = store.createIncident(incidentId);
    respond(ctx, created ? 201 : 200, new JsonObject().put("incident_id", incidentId));
  }

  private void handleMetrics(RoutingContext ctx) {
    String incidentId = ctx.pathParam("id");
    try {
      IngestResult result = store.appendPoints(incidentId, IncidentPayloads.parsePoints(requireBody(ctx)));
      respond(ctx, 200, result.toJson());
    } catch (IllegalArgumentException | DecodeException e) {
      badRequest(ctx, e.getMessage());
    } catch (UnknownIncidentException e) {
      notFound(ctx, incidentId);
    }
  }

  private void handleEvents(RoutingContext ctx) {
    String incidentId = ctx.pathParam("id");
    try {
      IngestResult result = store.appendEvents(incidentId, IncidentPayloads.parseEvents(requireBody(ctx)));
      respond(ctx, 200, result.toJson());
    } catch (IllegalArgumentException | DecodeException e) {
      badRequest(ctx, e.getMessage());
    } catch (UnknownIncidentException e) {
      notFound(ctx, incidentId);
    }
  }

  private void handleAnalysis(RoutingContext ctx) {
    String incidentId = ctx.pathParam("id");

    int limit;
    try {
      limit = parseLimit(ctx.queryParam("limit"));
    } catch (IllegalArgumentException e) {
      badRequest(ctx, e.getMessage());
      return;
    }

    Optional<IncidentSnapshot> snapshot = store.snapshot(incidentId);
    if (snapshot.isEmpty()) {
      notFound(ctx, incidentId);
      return;
    }

    analyzeWithTimeout(snapshot.get(), limit)
      .onSuccess(result -> respond(ctx, 200, result.toJson()))
      .onFailure(err -> {
        if (err instanceof AnalysisTimeoutException) {
          log.warn("Analysis of incident {} exceeded {}ms", incidentId, analysisTimeoutMs);
          respond(ctx, 503, new JsonObject().put("error", err.getMessage()));
        } else {
          log.error("Analysis of incident {} failed", incidentId, err);
          respond(ctx, 500, new JsonObject().put("error", "Analysis failed"));
        }
      });
  }

  private Future<AnalysisResult> analyzeWithTimeout(IncidentSnapshot snapshot, int limit) {
    Promise<AnalysisResult> promise = Promise.promise();
    long timerId = vertx.setTimer(analysisTimeoutMs, id ->
      promise.tryFail(new AnalysisTimeoutException(analysisTimeoutMs)));

    vertx.executeBlocking(() -> analyzer.analyze(snapshot, limit), false)
      .onComplete(ar -> {
        vertx.cancelTimer(timerId);
        if (ar.succeeded()) {
          promise.tryComplete(ar.result());
        } else {
          promise.tryFail(ar.cause());
        }
      });

    return promise.future();
  }

  static int parseLimit(List<String> values) {
    if (values == null || values.isEmpty()) {
      return 0;
    }
    String raw = values.get(0);
    try {
      int limit = Integer.parseInt(raw);
      if (limit < 0) {
        throw new IllegalArgumentException("limit must be >= 0");
      }
      return limit;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("limit must be an integer: " + raw);
    }
  }

  private static JsonObject optionalBody(RoutingContext ctx) {
    if (ctx.body() == null || ctx.body().length() == 0) {
      return null;
    }
    return ctx.body().asJsonObject();
  }

  private static JsonObject requireBody(RoutingContext ctx) {
    JsonObject body = optionalBody(ctx);
    if (body == null) {
      throw new IllegalArgumentException("Request body is required");
    }
    return body;
  }

  private static void badRequest(RoutingContext ctx, String message) {
    respond(ctx, 400, new JsonObject().put("error", message));
  }

  private static void notFound(RoutingContext ctx, String incidentId) {
    respond(ctx, 404, new JsonObject().put("error", "Incident not found: " + incidentId));
  }

  private static void respond(RoutingContext ctx, int status, JsonObject body) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(status)
      .end(body.encode());
  }

  /**
   * Raised when an analysis does not finish within the configured timeout.
   */
  static final class AnalysisTimeoutException extends RuntimeException {
    AnalysisTimeoutException(long timeoutMs) {
      super("Analysis did not complete within " + timeoutMs + "ms");
    }
  }
}
