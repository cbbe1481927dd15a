package io.github.themoah.rootcause.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;

/**
 * A ranked candidate root cause.
 *
 * <p>Events are grouped by (timestamp, type). When several events of a group differ only
 * in metadata, the cause carries the first one ingested.
 *
 * @param event the event being blamed
 * @param confidence normalized score in [0, 1]
 * @param evidence evidence strings, ordered by metric name then episode start
 * @param episodes the episodes that contributed, same order as evidence
 * @param minDistanceSeconds smallest distance between the event and any contributing episode
 */
public record Cause(
  Event event,
  double confidence,
  List<String> evidence,
  List<Episode> episodes,
  double minDistanceSeconds
) {

  public Cause {
    evidence = List.copyOf(evidence);
    episodes = List.copyOf(episodes);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("event_type", event.eventType())
      .put("ts", event.timestamp().toString())
      .put("meta", event.metadataJson())
      .put("confidence", confidence)
      .put("evidence", new JsonArray(new ArrayList<>(evidence)));
  }
}
