package com.codeheadsystems.gitgate.server.model;

import java.time.Instant;
import java.util.Set;

/**
 * A persisted, revocable token record. The signed credential a client presents only references
 * this record by id; deleting the record revokes the credential.
 *
 * @param id          token id, referenced by the {@code tki} claim
 * @param principalId id of the owning principal
 * @param type        token class
 * @param uid         human-readable token name
 * @param grants      permissions granted to the bearer
 * @param issuedAt    issue time
 * @param expiresAt   expiry time, or null for tokens that never expire
 */
public record Token(
    long id,
    long principalId,
    TokenType type,
    String uid,
    Set<String> grants,
    Instant issuedAt,
    Instant expiresAt) {

  public Token {
    grants = grants == null ? Set.of() : Set.copyOf(grants);
  }

  /**
   * Whether the token has expired at the given instant.
   *
   * @param now the instant to compare against
   * @return true if expired
   */
  public boolean isExpired(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }
}
