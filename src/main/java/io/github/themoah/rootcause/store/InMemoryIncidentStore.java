package io.github.themoah.rootcause.store;

import io.github.themoah.rootcause.model.Event;
import io.github.themoah.rootcause.model.IncidentSnapshot;
import io.github.themoah.rootcause.model.MetricPoint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local incident store. Each incident is guarded by its own monitor, so
 * ingest and snapshot calls on different incidents never contend.
 */
public class InMemoryIncidentStore implements IncidentStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryIncidentStore.class);

  private final Map<String, IncidentData> incidents = new ConcurrentHashMap<>();

  @Override
  public boolean createIncident(String incidentId) {
    boolean created = incidents.putIfAbsent(incidentId, new IncidentData()) == null;
    if (created) {
      log.info("Created incident {}", incidentId);
    } else {
      log.debug("Incident {} already exists", incidentId);
    }
    return created;
  }

  @Override
  public IngestResult appendPoints(String incidentId, List<MetricPoint> points) {
    IncidentData data = require(incidentId);
    int accepted = 0;
    synchronized (data) {
      for (MetricPoint point : points) {
        Map<Instant, MetricPoint> series = data.metrics
          .computeIfAbsent(point.metricName(), k -> new TreeMap<>());
        if (series.putIfAbsent(point.timestamp(), point) == null) {
          accepted++;
        }
      }
    }
    IngestResult result = new IngestResult(accepted, points.size() - accepted);
    log.debug("Ingested points for incident {}: accepted={}, duplicates={}",
      incidentId, result.accepted(), result.duplicates());
    return result;
  }

  @Override
  public IngestResult appendEvents(String incidentId, List<Event> events) {
    IncidentData data = require(incidentId);
    int accepted = 0;
    synchronized (data) {
      for (Event event : events) {
        if (data.events.add(event)) {
          accepted++;
        }
      }
    }
    IngestResult result = new IngestResult(accepted, events.size() - accepted);
    log.debug("Ingested events for incident {}: accepted={}, duplicates={}",
      incidentId, result.accepted(), result.duplicates());
    return result;
  }

  @Override
  public Optional<IncidentSnapshot> snapshot(String incidentId) {
    IncidentData data = incidents.get(incidentId);
    if (data == null) {
      return Optional.empty();
    }
    synchronized (data) {
      Map<String, List<MetricPoint>> metrics = new LinkedHashMap<>();
      data.metrics.forEach((name, series) -> metrics.put(name, new ArrayList<>(series.values())));
      return Optional.of(new IncidentSnapshot(incidentId, metrics, new ArrayList<>(data.events)));
    }
  }

  @Override
  public int incidentCount() {
    return incidents.size();
  }

  private IncidentData require(String incidentId) {
    IncidentData data = incidents.get(incidentId);
    if (data == null) {
      throw new UnknownIncidentException(incidentId);
    }
    return data;
  }

  /**
   * Mutable per-incident state; only touched while holding its monitor.
   */
  private static final class IncidentData {
    private final Map<String, TreeMap<Instant, MetricPoint>> metrics = new TreeMap<>();
    private final Set<Event> events = new LinkedHashSet<>();
  }
}
