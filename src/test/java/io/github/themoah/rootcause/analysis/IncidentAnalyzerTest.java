package io.github.themoah.rootcause.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.rootcause.config.AnalysisConfig;
import io.github.themoah.rootcause.metrics.AnalysisMetrics;
import io.github.themoah.rootcause.model.AnalysisResult;
import io.github.themoah.rootcause.model.Anomaly;
import io.github.themoah.rootcause.model.Cause;
import io.github.themoah.rootcause.model.Episode;
import io.github.themoah.rootcause.model.Event;
import io.github.themoah.rootcause.model.IncidentSnapshot;
import io.github.themoah.rootcause.model.MetricPoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * End-to-end tests of the analysis pipeline.
 */
public class IncidentAnalyzerTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private final IncidentAnalyzer analyzer = new IncidentAnalyzer(AnalysisConfig.defaults());

  @AfterEach
  void tearDown() {
    analyzer.close();
  }

  /**
   * 30 baseline points one minute apart ending at T0-60s, alternating mean-std / mean+std,
   * followed by the given spike values starting at T0.
   */
  private static List<MetricPoint> seriesWithSpike(String metric, double mean, double std, double... spikes) {
    List<MetricPoint> points = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      double value = i % 2 == 0 ? mean - std : mean + std;
      points.add(new MetricPoint(metric, T0.minusSeconds((30 - i) * 60L), value));
    }
    for (int i = 0; i < spikes.length; i++) {
      points.add(new MetricPoint(metric, T0.plusSeconds(i * 60L), spikes[i]));
    }
    return points;
  }

  private static IncidentSnapshot snapshot(Map<String, List<MetricPoint>> metrics, List<Event> events) {
    return new IncidentSnapshot("inc-1", metrics, events);
  }

  @Test
  void scenarioA_singleMetricDeploy() {
    Map<String, List<MetricPoint>> metrics = Map.of("latency", seriesWithSpike("latency", 120, 10, 950));
    Event deploy = new Event(T0.minusSeconds(60), "deploy", Map.of("version", "2.4.0"));

    AnalysisResult result = analyzer.analyze(snapshot(metrics, List.of(deploy)));

    assertEquals(1, result.anomalies().size());
    Anomaly anomaly = result.anomalies().get(0);
    assertEquals(83.0, anomaly.zScore(), 1e-6);
    assertEquals(120.0, anomaly.baseline().mean(), 1e-9);
    assertEquals(10.0, anomaly.baseline().std(), 1e-9);

    assertEquals(1, result.episodes().size());
    Episode episode = result.episodes().get(0);
    assertEquals(T0, episode.start());
    assertEquals(T0, episode.end());
    assertEquals(950.0, episode.peakValue());

    assertEquals(1, result.likelyCauses().size());
    Cause cause = result.likelyCauses().get(0);
    assertEquals(deploy, cause.event());
    assertEquals(0.9, cause.confidence(), 1e-9);
    assertEquals(1, cause.evidence().size());
    assertTrue(cause.evidence().get(0).startsWith("latency abnormal"));
    assertTrue(cause.evidence().get(0).endsWith("event within 60s"));
  }

  @Test
  void scenarioB_twoMetricsAgree() {
    Map<String, List<MetricPoint>> metrics = new LinkedHashMap<>();
    metrics.put("latency", seriesWithSpike("latency", 120, 10, 950));
    metrics.put("errors", seriesWithSpike("errors", 1.0, 0.1, 1.5));
    Event deploy = new Event(T0.minusSeconds(60), "deploy");

    AnalysisResult result = analyzer.analyze(snapshot(metrics, List.of(deploy)));

    assertEquals(2, result.episodes().size());
    assertEquals("errors", result.episodes().get(0).metricName());
    assertEquals("latency", result.episodes().get(1).metricName());

    Cause cause = result.likelyCauses().get(0);
    assertEquals(1.0, cause.confidence(), 1e-12);
    assertEquals(2, cause.evidence().size());
    assertTrue(cause.evidence().get(0).startsWith("errors"));
    assertTrue(cause.evidence().get(1).startsWith("latency"));
  }

  @Test
  void scenarioC_noEvents_noCauses() {
    Map<String, List<MetricPoint>> metrics = Map.of("latency", seriesWithSpike("latency", 120, 10, 950));

    AnalysisResult result = analyzer.analyze(snapshot(metrics, List.of()));

    assertFalse(result.anomalies().isEmpty());
    assertFalse(result.episodes().isEmpty());
    assertTrue(result.likelyCauses().isEmpty());
  }

  @Test
  void scenarioD_distantEvent_noCause() {
    Map<String, List<MetricPoint>> metrics = Map.of("latency", seriesWithSpike("latency", 120, 10, 950));
    Event stale = new Event(T0.minusSeconds(700), "deploy");

    AnalysisResult result = analyzer.analyze(snapshot(metrics, List.of(stale)));

    assertEquals(1, result.episodes().size());
    assertTrue(result.likelyCauses().isEmpty());
  }

  @Test
  void emptySnapshot_emptyResult() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    try (IncidentAnalyzer instrumented =
           new IncidentAnalyzer(AnalysisConfig.defaults(), new AnalysisMetrics(registry))) {
      AnalysisResult result = instrumented.analyze(snapshot(Map.of(), List.of(new Event(T0, "deploy"))));

      assertEquals(AnalysisResult.empty("inc-1"), result);
      assertEquals(1.0, registry.counter("rca.analysis.count").count());
    }
  }

  @Test
  void constantMetric_noAnomaliesButOthersStillAnalyzed() {
    List<MetricPoint> flat = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      flat.add(new MetricPoint("queue_depth", T0.minusSeconds(i * 30L), 5.0));
    }
    flat.add(new MetricPoint("queue_depth", T0.plusSeconds(5), 5_000.0));

    Map<String, List<MetricPoint>> metrics = new LinkedHashMap<>();
    metrics.put("queue_depth", flat);
    metrics.put("latency", seriesWithSpike("latency", 120, 10, 950));
    metrics.put("empty", List.of());

    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    try (IncidentAnalyzer instrumented =
           new IncidentAnalyzer(AnalysisConfig.defaults(), new AnalysisMetrics(registry))) {
      AnalysisResult result = instrumented.analyze(snapshot(metrics, List.of()));

      assertEquals(1, result.anomalies().size());
      assertEquals("latency", result.anomalies().get(0).metricName());
      assertEquals(1.0, registry.counter("rca.baselines.degenerate").count());
      assertEquals(1, registry.timer("rca.analysis.duration").count());
    }
  }

  @Test
  void unsortedInput_isOrderedBeforeAnalysis() {
    List<MetricPoint> points = seriesWithSpike("latency", 120, 10, 950, 960, 970);
    List<MetricPoint> shuffled = new ArrayList<>(points);
    Collections.reverse(shuffled);

    AnalysisResult sorted = analyzer.analyze(snapshot(Map.of("latency", points), List.of()));
    AnalysisResult reversed = analyzer.analyze(snapshot(Map.of("latency", shuffled), List.of()));

    assertEquals(sorted.toJson().encode(), reversed.toJson().encode());
    assertEquals(3, reversed.anomalies().size());
    assertEquals(1, reversed.episodes().size());
    assertEquals(T0.plusSeconds(120), reversed.episodes().get(0).end());
  }

  @Test
  void causeLimit_appliedByCaller() {
    Map<String, List<MetricPoint>> metrics = Map.of("latency", seriesWithSpike("latency", 120, 10, 950));
    List<Event> events = List.of(
      new Event(T0.minusSeconds(60), "deploy"),
      new Event(T0.minusSeconds(30), "note"),
      new Event(T0.minusSeconds(90), "config_change"));

    assertEquals(3, analyzer.analyze(snapshot(metrics, events)).likelyCauses().size());
    List<Cause> top = analyzer.analyze(snapshot(metrics, events), 1).likelyCauses();
    assertEquals(1, top.size());
    assertEquals("deploy", top.get(0).event().eventType());
  }

  @Test
  void parallelScoring_isDeterministicAndMatchesInline() {
    Map<String, List<MetricPoint>> metrics = new LinkedHashMap<>();
    for (int m = 0; m < 12; m++) {
      String name = "metric_" + (char) ('z' - m);
      metrics.put(name, seriesWithSpike(name, 100 + m, 5 + m, 400 + 10 * m, 90, 500 + m));
    }
    List<Event> events = List.of(
      new Event(T0.minusSeconds(45), "deploy"),
      new Event(T0.plusSeconds(200), "feature_flag"),
      new Event(T0.minusSeconds(500), "unknown_kind"));
    IncidentSnapshot snapshot = snapshot(metrics, events);

    String inline = analyzer.analyze(snapshot).toJson().encode();
    try (IncidentAnalyzer parallel = new IncidentAnalyzer(AnalysisConfig.defaults().withParallelism(4))) {
      String first = parallel.analyze(snapshot).toJson().encode();
      String second = parallel.analyze(snapshot).toJson().encode();

      assertEquals(first, second);
      assertEquals(inline, first);
    }

    AnalysisResult result = analyzer.analyze(snapshot);
    for (int i = 1; i < result.anomalies().size(); i++) {
      Anomaly prev = result.anomalies().get(i - 1);
      Anomaly next = result.anomalies().get(i);
      int byName = prev.metricName().compareTo(next.metricName());
      assertTrue(byName < 0
        || (byName == 0 && prev.point().timestamp().isBefore(next.point().timestamp())));
    }
  }

  @Test
  void closedAnalyzer_reportsNotRunningAndRejectsWork() {
    IncidentAnalyzer local = new IncidentAnalyzer(AnalysisConfig.defaults().withParallelism(2));
    assertTrue(local.isRunning());
    local.close();
    assertFalse(local.isRunning());

    Map<String, List<MetricPoint>> metrics = new LinkedHashMap<>();
    metrics.put("latency", seriesWithSpike("latency", 120, 10, 950));
    metrics.put("errors", seriesWithSpike("errors", 2, 1, 40));
    IncidentSnapshot snapshot = snapshot(metrics, List.of());

    AnalysisException e = assertThrows(AnalysisException.class, () -> local.analyze(snapshot));
    assertTrue(e.getMessage().contains("closed"));
  }

  @Test
  void farFutureEvent_ignoredWithoutFailure() {
    Map<String, List<MetricPoint>> metrics = Map.of("latency", seriesWithSpike("latency", 120, 10, 950));
    List<Event> events = List.of(
      new Event(Instant.parse("+500000000-01-01T00:00:00Z"), "deploy"),
      new Event(T0.minusSeconds(60), "deploy"));

    AnalysisResult result = analyzer.analyze(snapshot(metrics, events));

    assertEquals(1, result.likelyCauses().size());
    assertEquals(T0.minusSeconds(60), result.likelyCauses().get(0).event().timestamp());
  }
}
