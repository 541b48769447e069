package com.codeheadsystems.gitgate.server.model;

import java.util.Set;

/**
 * Token details attached to a session.
 *
 * @param tokenType the token class
 * @param tokenId   the token id
 * @param grants    the permissions granted by the token
 */
public record TokenMetadata(TokenType tokenType, long tokenId, Set<String> grants) {

  public TokenMetadata {
    grants = grants == null ? Set.of() : Set.copyOf(grants);
  }

  /**
   * Metadata describing the given token record.
   *
   * @param token the token
   * @return the token metadata
   */
  public static TokenMetadata of(Token token) {
    return new TokenMetadata(token.type(), token.id(), token.grants());
  }
}
