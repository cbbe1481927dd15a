package io.github.themoah.rootcause.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of everything known about one incident at analysis time.
 *
 * @param incidentId the incident identifier
 * @param metrics metric name to its points
 * @param events events recorded for the incident
 */
public record IncidentSnapshot(
  String incidentId,
  Map<String, List<MetricPoint>> metrics,
  List<Event> events
) {

  public IncidentSnapshot {
    Map<String, List<MetricPoint>> copy = new LinkedHashMap<>();
    metrics.forEach((name, points) -> copy.put(name, List.copyOf(points)));
    metrics = Collections.unmodifiableMap(copy);
    events = List.copyOf(events);
  }

  public int pointCount() {
    return metrics.values().stream().mapToInt(List::size).sum();
  }
}
