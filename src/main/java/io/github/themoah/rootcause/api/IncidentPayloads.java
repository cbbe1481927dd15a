package io.github.themoah.rootcause.api;

import io.github.themoah.rootcause.model.Event;
import io.github.themoah.rootcause.model.MetricPoint;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decodes ingest request bodies. Every method throws IllegalArgumentException
 * with a client-facing message when the payload is malformed.
 */
public final class IncidentPayloads {

  private IncidentPayloads() {}

  /**
   * Parses {@code {"points": [{"metric_name": "...", "ts": ..., "value": ...}]}}.
   */
  public static List<MetricPoint> parsePoints(JsonObject body) {
    JsonArray array = requireArray(body, "points");
    List<MetricPoint> points = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      JsonObject item = requireObject(array, i, "points");
      String metricName = item.getString("metric_name");
      if (metricName == null || metricName.isBlank()) {
        throw new IllegalArgumentException("points[" + i + "].metric_name is required");
      }
      Object rawValue = item.getValue("value");
      if (!(rawValue instanceof Number)) {
        throw new IllegalArgumentException("points[" + i + "].value must be a number");
      }
      double value = ((Number) rawValue).doubleValue();
      if (!Double.isFinite(value)) {
        throw new IllegalArgumentException("points[" + i + "].value must be finite");
      }
      points.add(new MetricPoint(metricName, parseTimestamp(item.getValue("ts"), "points[" + i + "].ts"), value));
    }
    return points;
  }

  /**
   * Parses {@code {"events": [{"ts": ..., "event_type": "...", "meta": {...}}]}}.
   */
  public static List<Event> parseEvents(JsonObject body) {
    JsonArray array = requireArray(body, "events");
    List<Event> events = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      JsonObject item = requireObject(array, i, "events");
      String type = item.getString("event_type");
      if (type == null || type.isBlank()) {
        throw new IllegalArgumentException("events[" + i + "].event_type is required");
      }
      Object meta = item.getValue("meta");
      if (meta != null && !(meta instanceof JsonObject)) {
        throw new IllegalArgumentException("events[" + i + "].meta must be an object");
      }
      Map<String, Object> metadata = meta == null ? Map.of() : ((JsonObject) meta).copy().getMap();
      events.add(new Event(parseTimestamp(item.getValue("ts"), "events[" + i + "].ts"), type, metadata));
    }
    return events;
  }

  /**
   * Accepts ISO-8601 instants or epoch seconds (integral or fractional).
   */
  static Instant parseTimestamp(Object raw, String field) {
    if (raw instanceof Number) {
      double seconds = ((Number) raw).doubleValue();
      return Instant.ofEpochMilli(Math.round(seconds * 1000.0));
    }
    if (raw instanceof String) {
      try {
        return Instant.parse((String) raw);
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException(field + " is not an ISO-8601 instant: " + raw);
      }
    }
    throw new IllegalArgumentException(field + " is required");
  }

  private static JsonArray requireArray(JsonObject body, String field) {
    if (body == null) {
      throw new IllegalArgumentException("Request body must be a JSON object");
    }
    Object value = body.getValue(field);
    if (!(value instanceof JsonArray)) {
      throw new IllegalArgumentException("'" + field + "' must be an array");
    }
    return (JsonArray) value;
  }

  private static JsonObject requireObject(JsonArray array, int index, String field) {
    Object value = array.getValue(index);
    if (!(value instanceof JsonObject)) {
      throw new IllegalArgumentException(field + "[" + index + "] must be an object");
    }
    return (JsonObject) value;
  }
}
