package com.codeheadsystems.gitgate.server.model;

import java.time.Instant;

/**
 * A non-human identity owned by a parent resource (e.g. a space or repository).
 *
 * @param id          numeric id
 * @param uid         unique name
 * @param displayName display name
 * @param parentType  kind of the owning resource
 * @param parentId    id of the owning resource
 * @param salt        per-account secret used to sign and verify the account's tokens
 * @param created     creation time
 */
public record ServiceAccount(
    long id,
    String uid,
    String displayName,
    String parentType,
    long parentId,
    String salt,
    Instant created) {

  @Override
  public String toString() {
    return "ServiceAccount[id=" + id + ", uid=" + uid + ", parentType=" + parentType
        + ", parentId=" + parentId + "]";
  }
}
