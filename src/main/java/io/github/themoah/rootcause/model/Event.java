package io.github.themoah.rootcause.model;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A discrete change that may explain an incident (deploy, config change, flag flip...).
 *
 * @param timestamp when the event happened
 * @param eventType free-form type string, matched against {@link EventType} for its prior
 * @param metadata opaque attributes supplied by the caller
 */
public record Event(
  Instant timestamp,
  String eventType,
  Map<String, Object> metadata
) {

  public Event {
    metadata = metadata == null
      ? Map.of()
      : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public Event(Instant timestamp, String eventType) {
    this(timestamp, eventType, Map.of());
  }

  /**
   * Identity used when aggregating contributions: two events with the same
   * timestamp and type are the same cause.
   */
  public Key key() {
    return new Key(timestamp, eventType);
  }

  /**
   * Resolved prior weight for this event's type.
   */
  public EventType type() {
    return EventType.fromString(eventType);
  }

  public record Key(Instant timestamp, String eventType) {}

  public JsonObject metadataJson() {
    return new JsonObject(new LinkedHashMap<>(metadata));
  }
}
