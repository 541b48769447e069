package com.codeheadsystems.gitgate.model.githook;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the update bridge call. Git runs the update hook once per reference, so the body
 * carries exactly one reference update.
 * <p>
 * Used by: {@code POST /v1/internal/git-hooks/update}
 *
 * @param repoId      id of the repository being pushed to
 * @param principalId id of the principal performing the push
 * @param refUpdate   the single reference update
 */
public record UpdateInput(
    @JsonProperty("repo_id") long repoId,
    @JsonProperty("principal_id") long principalId,
    @JsonProperty("ref_update") ReferenceUpdate refUpdate) {
}
