package io.github.themoah.rootcause.metrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for Micrometer registries used to export service metrics.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private static final String SERVICE_NAME = "rootcause";

  private MicrometerConfig() {}

  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * OTLP over HTTP. Endpoint from OTEL_EXPORTER_OTLP_METRICS_ENDPOINT, defaulting to
   * a local collector.
   */
  public static MeterRegistry createOtlpRegistry() {
    String endpoint = System.getenv("OTEL_EXPORTER_OTLP_METRICS_ENDPOINT");
    String url = (endpoint != null && !endpoint.isBlank()) ? endpoint : "http://localhost:4318/v1/metrics";

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        return url;
      }

      @Override
      public Map<String, String> resourceAttributes() {
        String serviceName = System.getenv("OTEL_SERVICE_NAME");
        return Map.of("service.name",
          (serviceName != null && !serviceName.isBlank()) ? serviceName : SERVICE_NAME);
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    log.info("Creating OTLP meter registry, endpoint: {}", url);
    return new OtlpMeterRegistry(config, Clock.SYSTEM);
  }

  /**
   * Datadog registry using DD_API_KEY and DD_SITE.
   */
  public static MeterRegistry createDatadogRegistry() {
    log.info("Creating Datadog meter registry");

    DatadogConfig config = new DatadogConfig() {
      @Override
      public String apiKey() {
        return System.getenv("DD_API_KEY");
      }

      @Override
      public String uri() {
        return "https://api." + System.getenv().getOrDefault("DD_SITE", "datadoghq.com");
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    return new DatadogMeterRegistry(config, Clock.SYSTEM);
  }

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType prometheus, otlp or datadog
   * @return the registry, or null if the type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }

    return switch (reporterType.toLowerCase()) {
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry();
      case "datadog" -> createDatadogRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }
}
