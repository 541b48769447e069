package com.codeheadsystems.gitgate.model.githook;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single branch or tag movement within a push.
 * <p>
 * Git describes every reference update with the object id the reference pointed to before the
 * push, the object id it points to afterwards, and the fully-qualified reference name. Creations
 * and deletions use the all-zero object id on the respective side.
 *
 * @param ref    fully-qualified reference name, e.g. {@code refs/heads/main}
 * @param oldSha object id before the update
 * @param newSha object id after the update
 */
public record ReferenceUpdate(
    @JsonProperty("ref") String ref,
    @JsonProperty("old") String oldSha,
    @JsonProperty("new") String newSha) {

  /**
   * Validates that all three fields are present.
   */
  public ReferenceUpdate {
    requireField(ref, "ref");
    requireField(oldSha, "old");
    requireField(newSha, "new");
  }

  private static void requireField(String value, String name) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Missing required field: " + name);
    }
  }
}
