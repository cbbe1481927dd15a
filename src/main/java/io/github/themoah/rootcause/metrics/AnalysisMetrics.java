package io.github.themoah.rootcause.metrics;

import io.github.themoah.rootcause.model.AnalysisResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation of the analysis engine.
 */
public class AnalysisMetrics {

  private final Timer analysisTimer;
  private final Counter analyses;
  private final Counter anomalies;
  private final Counter episodes;
  private final Counter causes;
  private final Counter degenerateBaselines;

  public AnalysisMetrics(MeterRegistry registry) {
    this.analysisTimer = Timer.builder("rca.analysis.duration")
      .description("Wall time of one incident analysis")
      .register(registry);
    this.analyses = Counter.builder("rca.analysis.count").register(registry);
    this.anomalies = Counter.builder("rca.anomalies.detected").register(registry);
    this.episodes = Counter.builder("rca.episodes.detected").register(registry);
    this.causes = Counter.builder("rca.causes.ranked").register(registry);
    this.degenerateBaselines = Counter.builder("rca.baselines.degenerate")
      .description("Metrics skipped because their baseline has no spread")
      .register(registry);
  }

  /**
   * Instrumentation that records into a registry with no backends.
   */
  public static AnalysisMetrics noop() {
    return new AnalysisMetrics(new CompositeMeterRegistry());
  }

  public void recordAnalysis(AnalysisResult result, long durationNanos) {
    analysisTimer.record(durationNanos, TimeUnit.NANOSECONDS);
    analyses.increment();
    anomalies.increment(result.anomalies().size());
    episodes.increment(result.episodes().size());
    causes.increment(result.likelyCauses().size());
  }

  public void recordDegenerateBaseline() {
    degenerateBaselines.increment();
  }
}
