package io.github.themoah.rootcause.analysis;

import io.github.themoah.rootcause.model.Anomaly;
import io.github.themoah.rootcause.model.Baseline;
import io.github.themoah.rootcause.model.Episode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges temporally adjacent anomalies of one metric into episodes.
 *
 * <p>An episode grows while each anomaly follows the previous one by at most
 * {@code maxGap}; a longer gap closes it. Metrics are never mixed here.
 */
public class EpisodeClusterer {

  private static final Logger log = LoggerFactory.getLogger(EpisodeClusterer.class);

  private final Duration maxGap;

  public EpisodeClusterer(Duration maxGap) {
    this.maxGap = maxGap;
  }

  /**
   * Clusters the anomalies of a single metric.
   *
   * @param anomalies anomalies of one metric, in timestamp order
   * @return episodes ordered by start, non-overlapping
   */
  public List<Episode> cluster(List<Anomaly> anomalies) {
    List<Episode> episodes = new ArrayList<>();
    if (anomalies.isEmpty()) {
      return episodes;
    }

    List<Anomaly> current = new ArrayList<>();
    Anomaly previous = null;
    for (Anomaly anomaly : anomalies) {
      if (previous != null && gapExceeded(previous, anomaly)) {
        episodes.add(toEpisode(current));
        current = new ArrayList<>();
      }
      current.add(anomaly);
      previous = anomaly;
    }
    episodes.add(toEpisode(current));

    log.debug("Clustered {} anomalies of metric={} into {} episodes",
      anomalies.size(), anomalies.get(0).metricName(), episodes.size());
    return episodes;
  }

  private boolean gapExceeded(Anomaly previous, Anomaly next) {
    Duration gap = Duration.between(previous.point().timestamp(), next.point().timestamp());
    return gap.compareTo(maxGap) > 0;
  }

  private Episode toEpisode(List<Anomaly> group) {
    Anomaly first = group.get(0);
    Anomaly last = group.get(group.size() - 1);

    Anomaly peak = first;
    for (Anomaly anomaly : group) {
      if (Math.abs(anomaly.zScore()) > Math.abs(peak.zScore())) {
        peak = anomaly;
      }
    }

    Baseline baseline = first.baseline();
    double peakValue = peak.point().value();

    return new Episode(
      first.metricName(),
      first.point().timestamp(),
      last.point().timestamp(),
      baseline.mean(),
      baseline.std(),
      peakValue,
      peak.zScore(),
      StatisticalUtils.percentChange(peakValue, baseline.mean())
    );
  }
}
