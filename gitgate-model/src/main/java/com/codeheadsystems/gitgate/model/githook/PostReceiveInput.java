package com.codeheadsystems.gitgate.model.githook;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Body of the post-receive bridge call, sent after git has moved all references.
 * <p>
 * Used by: {@code POST /v1/internal/git-hooks/post-receive}
 *
 * @param repoId      id of the repository that was pushed to
 * @param principalId id of the principal that performed the push
 * @param refUpdates  the applied reference updates, in stdin order
 */
public record PostReceiveInput(
    @JsonProperty("repo_id") long repoId,
    @JsonProperty("principal_id") long principalId,
    @JsonProperty("ref_updates") List<ReferenceUpdate> refUpdates) {

  public PostReceiveInput {
    refUpdates = refUpdates == null ? List.of() : List.copyOf(refUpdates);
  }
}
