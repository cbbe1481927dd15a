package io.github.themoah.rootcause.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Output of one analysis call.
 *
 * @param incidentId the analyzed incident
 * @param anomalies anomalies ordered by metric name then timestamp
 * @param episodes episodes ordered by metric name then start
 * @param likelyCauses causes ordered by confidence, descending
 */
public record AnalysisResult(
  String incidentId,
  List<Anomaly> anomalies,
  List<Episode> episodes,
  List<Cause> likelyCauses
) {

  public AnalysisResult {
    anomalies = List.copyOf(anomalies);
    episodes = List.copyOf(episodes);
    likelyCauses = List.copyOf(likelyCauses);
  }

  public static AnalysisResult empty(String incidentId) {
    return new AnalysisResult(incidentId, List.of(), List.of(), List.of());
  }

  /**
   * Converts to the JSON shape served by the analysis endpoint.
   */
  public JsonObject toJson() {
    JsonArray anomalyJson = new JsonArray();
    anomalies.forEach(a -> anomalyJson.add(a.toJson()));

    JsonArray episodeJson = new JsonArray();
    episodes.forEach(e -> episodeJson.add(e.toJson()));

    JsonArray causeJson = new JsonArray();
    likelyCauses.forEach(c -> causeJson.add(c.toJson()));

    return new JsonObject()
      .put("incident_id", incidentId)
      .put("anomalies", anomalyJson)
      .put("episodes", episodeJson)
      .put("likely_causes", causeJson);
  }
}
