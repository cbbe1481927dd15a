package io.github.themoah.rootcause.store;

import io.vertx.core.json.JsonObject;

/**
 * Outcome of an ingest call.
 *
 * @param accepted number of new items stored
 * @param duplicates number of items ignored because they were already present
 */
public record IngestResult(int accepted, int duplicates) {

  public JsonObject toJson() {
    return new JsonObject()
      .put("accepted", accepted)
      .put("duplicates", duplicates);
  }
}
