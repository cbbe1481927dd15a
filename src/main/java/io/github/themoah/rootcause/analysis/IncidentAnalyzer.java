package io.github.themoah.rootcause.analysis;

import io.github.themoah.rootcause.config.AnalysisConfig;
import io.github.themoah.rootcause.metrics.AnalysisMetrics;
import io.github.themoah.rootcause.model.AnalysisResult;
import io.github.themoah.rootcause.model.Anomaly;
import io.github.themoah.rootcause.model.Baseline;
import io.github.themoah.rootcause.model.Cause;
import io.github.themoah.rootcause.model.CauseContribution;
import io.github.themoah.rootcause.model.Episode;
import io.github.themoah.rootcause.model.IncidentSnapshot;
import io.github.themoah.rootcause.model.MetricPoint;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the full analysis pipeline on one incident snapshot:
 * baseline, detection, clustering, correlation and ranking.
 *
 * <p>Baseline estimation and detection are independent per metric and run on a
 * bounded worker pool when parallelism is above 1. Results are merged in metric
 * name order, so the output does not depend on task completion order. Everything
 * else runs on the calling thread.
 */
public class IncidentAnalyzer implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(IncidentAnalyzer.class);

  private static final Comparator<MetricPoint> BY_TIMESTAMP =
    Comparator.comparing(MetricPoint::timestamp);

  private final AnalysisConfig config;
  private final AnalysisMetrics metrics;
  private final BaselineEstimator baselineEstimator;
  private final AnomalyDetector anomalyDetector;
  private final EpisodeClusterer episodeClusterer;
  private final CauseCorrelator causeCorrelator;
  private final CauseRanker causeRanker;
  private final ExecutorService executor;

  private volatile boolean closed = false;

  public IncidentAnalyzer(AnalysisConfig config) {
    this(config, AnalysisMetrics.noop());
  }

  public IncidentAnalyzer(AnalysisConfig config, AnalysisMetrics metrics) {
    this.config = config;
    this.metrics = metrics;
    this.baselineEstimator = new BaselineEstimator(config.baselineMinPoints(), config.baselineFraction());
    this.anomalyDetector = new AnomalyDetector(config.zThreshold());
    this.episodeClusterer = new EpisodeClusterer(Duration.ofSeconds(config.episodeGapSeconds()));
    this.causeCorrelator = new CauseCorrelator(config.correlationWindowSeconds());
    this.causeRanker = new CauseRanker(config.agreementBonus());
    this.executor = config.parallelism() > 1 ? createExecutor(config.parallelism()) : null;
  }

  /**
   * Analyzes a snapshot with the configured cause limit.
   */
  public AnalysisResult analyze(IncidentSnapshot snapshot) {
    return analyze(snapshot, config.maxCauses());
  }

  /**
   * Analyzes a snapshot.
   *
   * @param snapshot the incident's metrics and events
   * @param causeLimit maximum number of causes to return, 0 or less for all
   * @return anomalies, episodes and ranked causes
   * @throws AnalysisException once the analyzer is closed, or when metric scoring is interrupted
   */
  public AnalysisResult analyze(IncidentSnapshot snapshot, int causeLimit) {
    if (closed) {
      throw new AnalysisException("Incident analyzer is closed");
    }
    long startNanos = System.nanoTime();
    log.debug("Analyzing incident={}: {} metrics, {} points, {} events",
      snapshot.incidentId(), snapshot.metrics().size(), snapshot.pointCount(), snapshot.events().size());

    if (snapshot.metrics().isEmpty()) {
      AnalysisResult empty = AnalysisResult.empty(snapshot.incidentId());
      metrics.recordAnalysis(empty, System.nanoTime() - startNanos);
      log.info("Analyzed incident={}: no metrics", snapshot.incidentId());
      return empty;
    }

    SortedMap<String, List<MetricPoint>> series = groupByMetric(snapshot.metrics());
    List<MetricScores> scored = scoreMetrics(series);

    List<Anomaly> anomalies = new ArrayList<>();
    List<Episode> episodes = new ArrayList<>();
    for (MetricScores scores : scored) {
      if (scores.baseline() != null && scores.baseline().isDegenerate()) {
        metrics.recordDegenerateBaseline();
      }
      anomalies.addAll(scores.anomalies());
      episodes.addAll(episodeClusterer.cluster(scores.anomalies()));
    }

    List<CauseContribution> contributions = causeCorrelator.correlate(snapshot.events(), episodes);
    List<Cause> causes = causeRanker.rank(contributions, causeLimit);

    AnalysisResult result = new AnalysisResult(snapshot.incidentId(), anomalies, episodes, causes);
    long elapsed = System.nanoTime() - startNanos;
    metrics.recordAnalysis(result, elapsed);

    log.info("Analyzed incident={}: anomalies={}, episodes={}, causes={} in {}ms",
      snapshot.incidentId(), anomalies.size(), episodes.size(), causes.size(),
      String.format("%.1f", elapsed / 1_000_000.0));
    return result;
  }

  /**
   * Builds the per-metric grouping once: metric names in natural order, points in
   * timestamp order. Series that are already ordered are not re-sorted.
   */
  static SortedMap<String, List<MetricPoint>> groupByMetric(Map<String, List<MetricPoint>> metrics) {
    SortedMap<String, List<MetricPoint>> grouped = new TreeMap<>();
    for (Map.Entry<String, List<MetricPoint>> entry : metrics.entrySet()) {
      List<MetricPoint> points = entry.getValue();
      if (!isSorted(points)) {
        List<MetricPoint> sorted = new ArrayList<>(points);
        sorted.sort(BY_TIMESTAMP);
        points = sorted;
      }
      grouped.put(entry.getKey(), points);
    }
    return grouped;
  }

  private static boolean isSorted(List<MetricPoint> points) {
    for (int i = 1; i < points.size(); i++) {
      if (BY_TIMESTAMP.compare(points.get(i - 1), points.get(i)) > 0) {
        return false;
      }
    }
    return true;
  }

  private List<MetricScores> scoreMetrics(SortedMap<String, List<MetricPoint>> series) {
    if (executor == null || series.size() < 2) {
      List<MetricScores> results = new ArrayList<>(series.size());
      series.forEach((name, points) -> results.add(scoreMetric(name, points)));
      return results;
    }

    List<Callable<MetricScores>> tasks = new ArrayList<>(series.size());
    series.forEach((name, points) -> tasks.add(() -> scoreMetric(name, points)));

    // invokeAll returns futures in submission order, i.e. metric name order
    try {
      List<Future<MetricScores>> futures = executor.invokeAll(tasks);
      List<MetricScores> results = new ArrayList<>(futures.size());
      for (Future<MetricScores> future : futures) {
        results.add(future.get());
      }
      return results;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AnalysisException("Interrupted while scoring metrics", e);
    } catch (ExecutionException e) {
      throw new AnalysisException("Metric scoring failed", e.getCause());
    } catch (RejectedExecutionException e) {
      throw new AnalysisException("Metric scoring pool is shut down", e);
    }
  }

  private MetricScores scoreMetric(String metricName, List<MetricPoint> points) {
    Baseline baseline = baselineEstimator.estimate(metricName, points);
    if (baseline == null) {
      return new MetricScores(metricName, null, List.of());
    }
    List<Anomaly> anomalies = anomalyDetector.detect(metricName, points, baseline);
    return new MetricScores(metricName, baseline, anomalies);
  }

  /**
   * Whether the analyzer still accepts work.
   */
  public boolean isRunning() {
    return !closed;
  }

  @Override
  public void close() {
    closed = true;
    if (executor != null) {
      executor.shutdown();
      log.info("Incident analyzer worker pool shut down");
    }
  }

  private static ExecutorService createExecutor(int parallelism) {
    AtomicInteger counter = new AtomicInteger();
    log.info("Creating metric scoring pool with {} threads", parallelism);
    return Executors.newFixedThreadPool(parallelism, runnable -> {
      Thread thread = new Thread(runnable, "rca-metric-scoring-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  private record MetricScores(String metricName, Baseline baseline, List<Anomaly> anomalies) {}
}
