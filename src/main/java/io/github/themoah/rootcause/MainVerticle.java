package io.github.themoah.rootcause;

import io.github.themoah.rootcause.analysis.IncidentAnalyzer;
import io.github.themoah.rootcause.api.IncidentHandler;
import io.github.themoah.rootcause.config.AnalysisConfig;
import io.github.themoah.rootcause.config.AppConfig;
import io.github.themoah.rootcause.health.HealthCheckHandler;
import io.github.themoah.rootcause.metrics.AnalysisMetrics;
import io.github.themoah.rootcause.metrics.MetricsConfig;
import io.github.themoah.rootcause.metrics.MicrometerConfig;
import io.github.themoah.rootcause.metrics.PrometheusHandler;
import io.github.themoah.rootcause.store.InMemoryIncidentStore;
import io.github.themoah.rootcause.store.IncidentStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle: wires the incident store, the analyzer and the HTTP server.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final AppConfig appConfig;
  private final AnalysisConfig analysisConfig;
  private final MetricsConfig metricsConfig;

  private IncidentAnalyzer analyzer;
  private MeterRegistry meterRegistry;
  private HttpServer httpServer;

  public MainVerticle() {
    this(AppConfig.fromEnvironment(), AnalysisConfig.fromEnvironment(), MetricsConfig.fromEnvironment());
  }

  /**
   * Constructor for tests and embedding with explicit configuration.
   */
  public MainVerticle(AppConfig appConfig, AnalysisConfig analysisConfig, MetricsConfig metricsConfig) {
    this.appConfig = appConfig;
    this.analysisConfig = analysisConfig;
    this.metricsConfig = metricsConfig;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting root cause analysis MainVerticle");

    Router router = Router.router(vertx);

    meterRegistry = createMeterRegistry(router);
    AnalysisMetrics analysisMetrics = meterRegistry != null
      ? new AnalysisMetrics(meterRegistry)
      : AnalysisMetrics.noop();

    IncidentStore store = new InMemoryIncidentStore();
    analyzer = new IncidentAnalyzer(analysisConfig, analysisMetrics);

    new HealthCheckHandler(analyzer, store).registerRoutes(router);
    new IncidentHandler(vertx, store, analyzer, appConfig.analysisTimeoutMs()).registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    vertx.createHttpServer()
      .requestHandler(router)
      .listen(appConfig.httpPort())
      .onSuccess(server -> {
        httpServer = server;
        log.info("Root cause analysis service started on port {}", server.actualPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start HTTP server", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping root cause analysis MainVerticle");

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    // Analyzer closes only after the server stops accepting requests.
    stopHttpServer
      .onComplete(ar -> {
        if (analyzer != null) {
          analyzer.close();
        }
        if (meterRegistry != null) {
          meterRegistry.close();
        }
      })
      .onSuccess(v -> {
        log.info("Root cause analysis service stopped");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * Port the HTTP server is bound to, or -1 before start.
   */
  public int actualPort() {
    return httpServer != null ? httpServer.actualPort() : -1;
  }

  private MeterRegistry createMeterRegistry(Router router) {
    if (!metricsConfig.enabled()) {
      log.info("Metrics reporting is disabled");
      return null;
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(metricsConfig.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", metricsConfig.reporterType());
      return null;
    }

    if (metricsConfig.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }
    return registry;
  }
}
