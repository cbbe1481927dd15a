package io.github.themoah.rootcause;

import io.github.themoah.rootcause.config.VertxConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the root cause analysis service. Builds Vert.x from the
 * environment, deploys {@link MainVerticle} and closes Vert.x on JVM shutdown.
 */
public class RootCauseLauncher {

  private static final Logger log = LoggerFactory.getLogger(RootCauseLauncher.class);

  public static void main(String[] args) {
    VertxOptions vertxOptions = VertxConfig.createVertxOptions();
    Vertx vertx = Vertx.vertx(vertxOptions);

    DeploymentOptions deploymentOptions = VertxConfig.createDeploymentOptions();

    // Undeploying closes the analyzer pool and the meter registry.
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      log.info("Shutdown requested, closing Vert.x");
      vertx.close().toCompletionStage().toCompletableFuture().join();
    }, "rca-shutdown"));

    vertx.deployVerticle(new MainVerticle(), deploymentOptions)
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }
}
