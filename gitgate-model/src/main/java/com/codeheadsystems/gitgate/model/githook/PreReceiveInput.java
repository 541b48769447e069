package com.codeheadsystems.gitgate.model.githook;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Body of the pre-receive bridge call. Carries every reference update of the push in the order
 * git reported them, before any reference has been moved.
 * <p>
 * Used by: {@code POST /v1/internal/git-hooks/pre-receive}
 *
 * @param repoId      id of the repository being pushed to
 * @param principalId id of the principal performing the push
 * @param refUpdates  the reference updates, in stdin order
 */
public record PreReceiveInput(
    @JsonProperty("repo_id") long repoId,
    @JsonProperty("principal_id") long principalId,
    @JsonProperty("ref_updates") List<ReferenceUpdate> refUpdates) {

  public PreReceiveInput {
    refUpdates = refUpdates == null ? List.of() : List.copyOf(refUpdates);
  }
}
