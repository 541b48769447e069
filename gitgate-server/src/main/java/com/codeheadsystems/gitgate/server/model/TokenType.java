package com.codeheadsystems.gitgate.server.model;

import java.util.Optional;

/**
 * Class of an issued token. Each class belongs to exactly one {@link PrincipalType}, which decides
 * the store the owning principal is looked up in.
 */
public enum TokenType {
  /**
   * Personal access token.
   */
  PAT("pat"),
  SESSION("session"),
  OAUTH2("oauth2"),
  /**
   * Service account token.
   */
  SAT("sat");

  private final String value;

  TokenType(String value) {
    this.value = value;
  }

  /**
   * The wire value used in the {@code tkt} claim.
   *
   * @return the string
   */
  public String value() {
    return value;
  }

  /**
   * The principal class whose secret signs tokens of this class.
   *
   * @return the principal type
   */
  public PrincipalType principalType() {
    return switch (this) {
      case PAT, SESSION, OAUTH2 -> PrincipalType.USER;
      case SAT -> PrincipalType.SERVICE_ACCOUNT;
    };
  }

  /**
   * Looks up a token class by its wire value.
   *
   * @param value the claimed value
   * @return the token type, or empty for unrecognised values
   */
  public static Optional<TokenType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (TokenType type : values()) {
      if (type.value.equals(value)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
