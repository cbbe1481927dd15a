package io.github.themoah.rootcause.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.rootcause.model.Cause;
import io.github.themoah.rootcause.model.CauseContribution;
import io.github.themoah.rootcause.model.Episode;
import io.github.themoah.rootcause.model.Event;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CauseRanker.
 */
public class CauseRankerTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private final CauseRanker ranker = new CauseRanker(0.35);

  private static Episode episode(String metric, long startOffset, long endOffset) {
    return new Episode(metric, T0.plusSeconds(startOffset), T0.plusSeconds(endOffset),
      100, 10, 200, 10, 100);
  }

  private static CauseContribution contribution(Event event, Episode episode, double distance, double raw) {
    return new CauseContribution(event, episode, distance, raw,
      episode.metricName() + "@" + episode.start());
  }

  @Test
  void emptyContributions_noCauses() {
    assertTrue(ranker.rank(List.of(), 0).isEmpty());
  }

  @Test
  void singleMetric_noBonus() {
    Event deploy = new Event(T0.minusSeconds(60), "deploy");

    List<Cause> causes = ranker.rank(List.of(
      contribution(deploy, episode("latency", 0, 0), 60, 0.9)), 0);

    assertEquals(1, causes.size());
    assertEquals(0.9, causes.get(0).confidence(), 1e-12);
  }

  @Test
  void scenarioB_overlappingEpisodesOfTwoMetrics_bonusClampedToOne() {
    Event deploy = new Event(T0.minusSeconds(60), "deploy");

    List<Cause> causes = ranker.rank(List.of(
      contribution(deploy, episode("latency", 0, 120), 60, 0.9),
      contribution(deploy, episode("errors", 60, 180), 120, 0.6)), 0);

    assertEquals(1, causes.size());
    assertEquals(1.0, causes.get(0).confidence(), 1e-12);
    assertEquals(60.0, causes.get(0).minDistanceSeconds());
  }

  @Test
  void bonusAddsToBase() {
    Event flag = new Event(T0, "feature_flag");

    List<Cause> causes = ranker.rank(List.of(
      contribution(flag, episode("latency", 0, 60), 0, 0.4),
      contribution(flag, episode("errors", 60, 90), 0, 0.2)), 0);

    assertEquals(0.75, causes.get(0).confidence(), 1e-12);
  }

  @Test
  void nonOverlappingEpisodes_noBonus() {
    Event deploy = new Event(T0, "deploy");

    List<Cause> causes = ranker.rank(List.of(
      contribution(deploy, episode("latency", 0, 60), 0, 0.5),
      contribution(deploy, episode("errors", 61, 120), 61, 0.3)), 0);

    assertEquals(0.5, causes.get(0).confidence(), 1e-12);
  }

  @Test
  void sameMetricEpisodes_noBonus() {
    Event deploy = new Event(T0, "deploy");

    assertFalse(CauseRanker.hasCrossMetricAgreement(List.of(
      contribution(deploy, episode("latency", 0, 60), 0, 0.5),
      contribution(deploy, episode("latency", 0, 60), 0, 0.5))));
  }

  @Test
  void bonusNeverDecreasesConfidence() {
    Event deploy = new Event(T0, "deploy");
    List<CauseContribution> single = List.of(contribution(deploy, episode("latency", 0, 60), 0, 0.7));
    List<CauseContribution> corroborated = List.of(
      contribution(deploy, episode("latency", 0, 60), 0, 0.7),
      contribution(deploy, episode("errors", 30, 90), 0, 0.1));

    double alone = ranker.rank(single, 0).get(0).confidence();
    double together = ranker.rank(corroborated, 0).get(0).confidence();

    assertTrue(together >= alone);
    assertTrue(together <= 1.0);
  }

  @Test
  void ordering_confidenceThenDistanceThenTimestamp() {
    Event strong = new Event(T0.minusSeconds(300), "deploy");
    Event tiedNear = new Event(T0.minusSeconds(200), "config_change");
    Event tiedFar = new Event(T0.minusSeconds(100), "config_change");
    Event tiedFarEarlier = new Event(T0.minusSeconds(150), "migration");
    Episode ep = episode("latency", 0, 0);

    List<Cause> causes = ranker.rank(List.of(
      contribution(tiedFar, ep, 100, 0.5),
      contribution(tiedNear, ep, 50, 0.5),
      contribution(tiedFarEarlier, ep, 100, 0.5),
      contribution(strong, ep, 300, 0.8)), 0);

    assertEquals(List.of(strong, tiedNear, tiedFarEarlier, tiedFar),
      causes.stream().map(Cause::event).toList());
  }

  @Test
  void eventsWithSameTimestampAndType_aggregateTogether() {
    Event a = new Event(T0, "deploy", Map.of("version", "1.2.3"));
    Event b = new Event(T0, "deploy", Map.of("version", "1.2.4"));

    List<Cause> causes = ranker.rank(List.of(
      contribution(a, episode("latency", 0, 0), 0, 0.3),
      contribution(b, episode("errors", 0, 0), 0, 0.6)), 0);

    assertEquals(1, causes.size());
    assertEquals(0.95, causes.get(0).confidence(), 1e-12);
  }

  @Test
  void eventsDifferingOnlyInMetadata_keepFirstEventAndOneLinePerEpisode() {
    Event first = new Event(T0, "deploy", Map.of("version", "1.2.3"));
    Event second = new Event(T0, "deploy", Map.of("version", "1.2.4"));
    Episode latency = episode("latency", 0, 0);

    List<Cause> causes = ranker.rank(List.of(
      contribution(first, latency, 0, 0.6),
      contribution(second, latency, 0, 0.6)), 0);

    assertEquals(1, causes.size());
    assertEquals("1.2.3", causes.get(0).event().metadata().get("version"));
    assertEquals(List.of("latency@" + T0), causes.get(0).evidence());
    assertEquals(1, causes.get(0).episodes().size());
  }

  @Test
  void evidenceOrderedByMetricThenStart() {
    Event deploy = new Event(T0, "deploy");

    Cause cause = ranker.rank(List.of(
      contribution(deploy, episode("latency", 300, 360), 300, 0.2),
      contribution(deploy, episode("errors", 0, 10), 0, 0.5),
      contribution(deploy, episode("latency", 0, 10), 0, 0.4)), 0).get(0);

    assertEquals(List.of(
      "errors@" + T0,
      "latency@" + T0,
      "latency@" + T0.plusSeconds(300)), cause.evidence());
    assertEquals(3, cause.episodes().size());
  }

  @Test
  void zeroConfidence_dropped() {
    Event edge = new Event(T0.minusSeconds(600), "deploy");

    assertTrue(ranker.rank(List.of(contribution(edge, episode("latency", 0, 0), 600, 0.0)), 0).isEmpty());
  }

  @Test
  void limit_truncatesAfterSorting() {
    Episode ep = episode("latency", 0, 0);
    List<CauseContribution> contributions = List.of(
      contribution(new Event(T0.minusSeconds(10), "note"), ep, 10, 0.3),
      contribution(new Event(T0.minusSeconds(20), "deploy"), ep, 20, 0.9),
      contribution(new Event(T0.minusSeconds(30), "migration"), ep, 30, 0.6));

    List<Cause> top = ranker.rank(contributions, 2);

    assertEquals(2, top.size());
    assertEquals("deploy", top.get(0).event().eventType());
    assertEquals("migration", top.get(1).event().eventType());
    assertEquals(3, ranker.rank(contributions, 0).size());
  }
}
