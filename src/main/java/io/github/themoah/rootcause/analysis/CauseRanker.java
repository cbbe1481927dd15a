package io.github.themoah.rootcause.analysis;

import io.github.themoah.rootcause.model.Cause;
import io.github.themoah.rootcause.model.CauseContribution;
import io.github.themoah.rootcause.model.Episode;
import io.github.themoah.rootcause.model.Event;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregates contributions per event into ranked causes.
 *
 * <p>An event's base confidence is its strongest single contribution. When the event
 * is corroborated by overlapping episodes of at least two distinct metrics, the
 * agreement bonus is added; the result is clamped to [0, 1].
 */
public class CauseRanker {

  private static final Logger log = LoggerFactory.getLogger(CauseRanker.class);

  static final Comparator<Cause> RANKING = Comparator
    .comparingDouble(Cause::confidence).reversed()
    .thenComparingDouble(Cause::minDistanceSeconds)
    .thenComparing(c -> c.event().timestamp())
    .thenComparing(c -> c.event().eventType(), Comparator.nullsFirst(Comparator.<String>naturalOrder()));

  private static final Comparator<CauseContribution> EVIDENCE_ORDER = Comparator
    .comparing((CauseContribution c) -> c.episode().metricName())
    .thenComparing(c -> c.episode().start());

  private final double agreementBonus;

  public CauseRanker(double agreementBonus) {
    this.agreementBonus = agreementBonus;
  }

  /**
   * Ranks causes.
   *
   * @param contributions all candidate pairings
   * @param limit maximum number of causes to return, 0 or less for all
   * @return causes with confidence above zero, best first
   */
  public List<Cause> rank(List<CauseContribution> contributions, int limit) {
    Map<Event.Key, List<CauseContribution>> byEvent = contributions.stream()
      .collect(Collectors.groupingBy(c -> c.event().key(), LinkedHashMap::new, Collectors.toList()));

    List<Cause> causes = new ArrayList<>();
    for (List<CauseContribution> group : byEvent.values()) {
      Cause cause = toCause(group);
      if (cause.confidence() > 0.0) {
        causes.add(cause);
      }
    }

    causes.sort(RANKING);

    if (limit > 0 && causes.size() > limit) {
      log.debug("Truncating {} causes to limit={}", causes.size(), limit);
      return new ArrayList<>(causes.subList(0, limit));
    }
    return causes;
  }

  private Cause toCause(List<CauseContribution> group) {
    double base = 0.0;
    double minDistance = Double.MAX_VALUE;
    for (CauseContribution contribution : group) {
      base = Math.max(base, contribution.rawScore());
      minDistance = Math.min(minDistance, contribution.distanceSeconds());
    }

    double bonus = hasCrossMetricAgreement(group) ? agreementBonus : 0.0;
    double confidence = clamp(base + bonus);

    // Events sharing (ts, type) but not metadata pair with the same episodes; keep one line per episode.
    Map<Episode, CauseContribution> perEpisode = new LinkedHashMap<>();
    for (CauseContribution contribution : group) {
      perEpisode.putIfAbsent(contribution.episode(), contribution);
    }
    List<CauseContribution> ordered = new ArrayList<>(perEpisode.values());
    ordered.sort(EVIDENCE_ORDER);

    List<String> evidence = ordered.stream()
      .map(CauseContribution::evidence)
      .collect(Collectors.toList());
    List<Episode> episodes = ordered.stream()
      .map(CauseContribution::episode)
      .collect(Collectors.toList());

    Event event = group.get(0).event();
    log.debug("Cause type={} ts={}: base={}, bonus={}, confidence={}",
      event.eventType(), event.timestamp(),
      String.format("%.3f", base), String.format("%.2f", bonus), String.format("%.3f", confidence));

    return new Cause(event, confidence, evidence, episodes, minDistance);
  }

  /**
   * True when two contributions from different metrics have overlapping episodes.
   */
  static boolean hasCrossMetricAgreement(List<CauseContribution> group) {
    for (int i = 0; i < group.size(); i++) {
      Episode a = group.get(i).episode();
      for (int j = i + 1; j < group.size(); j++) {
        Episode b = group.get(j).episode();
        if (!a.metricName().equals(b.metricName()) && a.overlaps(b)) {
          return true;
        }
      }
    }
    return false;
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
