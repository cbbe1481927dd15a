package io.github.themoah.rootcause.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x configuration. The worker pool runs analysis requests off the event loop;
 * size it with VERTX_WORKER_POOL_SIZE.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_WORKER_POOL_SIZE = "VERTX_WORKER_POOL_SIZE";

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    int workers = workerPoolSize();
    if (workers > 0) {
      log.info("Vert.x worker pool size: {}", workers);
      options.setWorkerPoolSize(workers);
    }
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    return new DeploymentOptions();
  }

  static int workerPoolSize() {
    String value = System.getenv(ENV_WORKER_POOL_SIZE);
    if (value == null || value.isBlank()) {
      return 0;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using Vert.x default", ENV_WORKER_POOL_SIZE, value);
      return 0;
    }
  }
}
