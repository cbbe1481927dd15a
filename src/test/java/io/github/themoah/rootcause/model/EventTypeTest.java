package io.github.themoah.rootcause.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EventType and Event identity.
 */
public class EventTypeTest {

  @Test
  void fromString_knownTypes() {
    assertEquals(EventType.DEPLOY, EventType.fromString("deploy"));
    assertEquals(EventType.CONFIG_CHANGE, EventType.fromString("config_change"));
    assertEquals(EventType.FEATURE_FLAG, EventType.fromString("feature_flag"));
    assertEquals(EventType.MIGRATION, EventType.fromString("migration"));
    assertEquals(EventType.NOTE, EventType.fromString("note"));
  }

  @Test
  void fromString_unknownDefaultsToSixty() {
    assertEquals(EventType.UNKNOWN, EventType.fromString("rollback"));
    assertEquals(EventType.UNKNOWN, EventType.fromString("DEPLOY"));
    assertEquals(EventType.UNKNOWN, EventType.fromString(null));
    assertEquals(0.60, EventType.UNKNOWN.prior());
  }

  @Test
  void eventKey_ignoresMetadata() {
    Instant ts = Instant.parse("2024-05-01T10:00:00Z");
    Event a = new Event(ts, "deploy", Map.of("sha", "abc"));
    Event b = new Event(ts, "deploy", Map.of("sha", "def"));

    assertEquals(a.key(), b.key());
    assertNotEquals(a, b);
    assertEquals(new Event(ts, "deploy").metadata(), Map.of());
  }
}
