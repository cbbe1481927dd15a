package io.github.themoah.rootcause.store;

/**
 * Thrown when an operation targets an incident the store does not know.
 */
public class UnknownIncidentException extends RuntimeException {

  private final String incidentId;

  public UnknownIncidentException(String incidentId) {
    super("Unknown incident: " + incidentId);
    this.incidentId = incidentId;
  }

  public String incidentId() {
    return incidentId;
  }
}
