package io.github.themoah.rootcause.analysis;

import io.github.themoah.rootcause.model.CauseContribution;
import io.github.themoah.rootcause.model.Episode;
import io.github.themoah.rootcause.model.Event;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs events with nearby episodes and scores each pairing.
 *
 * <p>raw score = proximity * prior * severity, where
 * <ul>
 *   <li>proximity = max(0, 1 - d / window), d being the event's distance to the episode</li>
 *   <li>prior comes from the event type</li>
 *   <li>severity = 0.55 + 0.45 * min(|peak z| / 10, 1)</li>
 * </ul>
 * Events before and after an episode are treated alike.
 */
public class CauseCorrelator {

  private static final Logger log = LoggerFactory.getLogger(CauseCorrelator.class);

  static final double SEVERITY_FLOOR = 0.55;
  static final double SEVERITY_RANGE = 0.45;
  static final double SEVERITY_SATURATION_Z = 10.0;

  private final double windowSeconds;

  public CauseCorrelator(long windowSeconds) {
    this.windowSeconds = windowSeconds;
  }

  /**
   * Scores every (event, episode) pair within the correlation window.
   *
   * @param events incident events
   * @param episodes episodes of all metrics
   * @return one contribution per candidate pair, in event order then episode order
   */
  public List<CauseContribution> correlate(List<Event> events, List<Episode> episodes) {
    List<CauseContribution> contributions = new ArrayList<>();

    for (Event event : events) {
      double prior = event.type().prior();
      for (Episode episode : episodes) {
        double distance = distanceSeconds(event.timestamp(), episode);
        if (distance > windowSeconds) {
          continue;
        }

        double raw = proximity(distance) * prior * severity(episode.peakZScore());
        contributions.add(new CauseContribution(
          event, episode, distance, raw, evidence(episode, distance)));

        log.debug("Correlated event type={} ts={} with metric={} episode: distance={}s, raw={}",
          event.eventType(), event.timestamp(), episode.metricName(),
          String.format("%.1f", distance), String.format("%.3f", raw));
      }
    }

    return contributions;
  }

  /**
   * Distance in seconds from a timestamp to an episode: 0 inside [start, end],
   * otherwise the distance to the nearer boundary.
   */
  public static double distanceSeconds(Instant timestamp, Episode episode) {
    Duration gap;
    if (timestamp.isBefore(episode.start())) {
      gap = Duration.between(timestamp, episode.start());
    } else if (timestamp.isAfter(episode.end())) {
      gap = Duration.between(episode.end(), timestamp);
    } else {
      return 0.0;
    }
    return gap.getSeconds() + gap.getNano() / 1_000_000_000.0;
  }

  double proximity(double distanceSeconds) {
    return Math.max(0.0, 1.0 - distanceSeconds / windowSeconds);
  }

  static double severity(double peakZScore) {
    return SEVERITY_FLOOR
      + SEVERITY_RANGE * Math.min(Math.abs(peakZScore) / SEVERITY_SATURATION_Z, 1.0);
  }

  /**
   * Formats the evidence line for one pairing, for example
   * {@code latency abnormal 2024-05-01T10:00:00Z–2024-05-01T10:02:00Z: 120.00 → 950.00 (+691.67%), z≈83.0, event within 60s}.
   */
  static String evidence(Episode episode, double distanceSeconds) {
    String change;
    if (episode.hasPercentChange()) {
      String sign = episode.percentChange() >= 0 ? "+" : "";
      change = sign + String.format(Locale.ROOT, "%.2f", episode.percentChange()) + "%";
    } else {
      change = "n/a";
    }

    return String.format(Locale.ROOT,
      "%s abnormal %s–%s: %.2f → %.2f (%s), z≈%.1f, event within %ds",
      episode.metricName(),
      episode.start(),
      episode.end(),
      episode.baselineMean(),
      episode.peakValue(),
      change,
      episode.peakZScore(),
      Math.round(distanceSeconds));
  }
}
