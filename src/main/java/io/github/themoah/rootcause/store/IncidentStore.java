package io.github.themoah.rootcause.store;

import io.github.themoah.rootcause.model.Event;
import io.github.themoah.rootcause.model.IncidentSnapshot;
import io.github.themoah.rootcause.model.MetricPoint;
import java.util.List;
import java.util.Optional;

/**
 * Source of incident snapshots. Owns ingestion and uniqueness of points and events;
 * the analysis engine only ever sees the immutable snapshots it hands out.
 */
public interface IncidentStore {

  /**
   * Registers an incident.
   *
   * @param incidentId the incident identifier
   * @return true if the incident was created, false if it already existed
   */
  boolean createIncident(String incidentId);

  /**
   * Appends metric points. A point is unique per (metric name, timestamp);
   * repeats are ignored.
   *
   * @throws UnknownIncidentException if the incident does not exist
   */
  IngestResult appendPoints(String incidentId, List<MetricPoint> points);

  /**
   * Appends events. An event is unique per (timestamp, type, metadata); repeats are ignored.
   *
   * @throws UnknownIncidentException if the incident does not exist
   */
  IngestResult appendEvents(String incidentId, List<Event> events);

  /**
   * Materializes the current state of an incident.
   *
   * @return the snapshot, or empty if the incident is unknown
   */
  Optional<IncidentSnapshot> snapshot(String incidentId);

  /**
   * Number of incidents currently tracked.
   */
  int incidentCount();
}
