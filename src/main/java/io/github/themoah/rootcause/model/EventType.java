package io.github.themoah.rootcause.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Known event types and the prior likelihood that an event of that type causes
 * an incident. Types not listed here resolve to {@link #UNKNOWN}.
 */
public enum EventType {
  DEPLOY("deploy", 1.00),
  CONFIG_CHANGE("config_change", 0.85),
  MIGRATION("migration", 0.80),
  FEATURE_FLAG("feature_flag", 0.75),
  NOTE("note", 0.50),
  UNKNOWN(null, 0.60);

  private static final Map<String, EventType> BY_VALUE = new HashMap<>();

  static {
    for (EventType type : values()) {
      if (type.value != null) {
        BY_VALUE.put(type.value, type);
      }
    }
  }

  private final String value;
  private final double prior;

  EventType(String value, double prior) {
    this.value = value;
    this.prior = prior;
  }

  /**
   * Resolves an event type by exact (case-sensitive) match.
   *
   * @param value the raw event_type string
   * @return the matching type, or UNKNOWN
   */
  public static EventType fromString(String value) {
    if (value == null) {
      return UNKNOWN;
    }
    return BY_VALUE.getOrDefault(value, UNKNOWN);
  }

  public double prior() {
    return prior;
  }
}
