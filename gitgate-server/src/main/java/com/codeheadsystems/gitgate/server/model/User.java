package com.codeheadsystems.gitgate.server.model;

import java.time.Instant;

/**
 * A human user as held by the user store.
 *
 * @param id          numeric id
 * @param uid         unique login name
 * @param email       email address
 * @param displayName display name
 * @param admin       whether the user is a system administrator
 * @param blocked     whether the user is blocked
 * @param salt        per-user secret used to sign and verify the user's tokens
 * @param created     creation time
 */
public record User(
    long id,
    String uid,
    String email,
    String displayName,
    boolean admin,
    boolean blocked,
    String salt,
    Instant created) {

  @Override
  public String toString() {
    return "User[id=" + id + ", uid=" + uid + ", email=" + email + ", admin=" + admin
        + ", blocked=" + blocked + "]";
  }
}
