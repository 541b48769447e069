package com.codeheadsystems.gitgate.server.auth;

/**
 * Raised when a request cannot be authenticated.
 * <p>
 * The {@link Reason} is for the request boundary and for logs. Callers must answer every reason
 * other than {@link Reason#NO_AUTH_DATA} with the same unauthenticated response, so that the
 * existence of principals and tokens is not revealed.
 */
public class AuthenticationException extends RuntimeException {

  /**
   * Why authentication failed.
   */
  public enum Reason {
    /**
     * No credential was presented. The caller may fall back to anonymous access.
     */
    NO_AUTH_DATA,
    /**
     * The credential is malformed, not signed with an accepted algorithm, expired, or its
     * signature does not verify.
     */
    INVALID_TOKEN,
    /**
     * The credential claims a token class the authenticator does not recognise.
     */
    UNSUPPORTED_TOKEN_TYPE,
    /**
     * The principal named by the credential does not exist.
     */
    PRINCIPAL_NOT_FOUND,
    /**
     * The token record referenced by the credential was deleted or expired.
     */
    TOKEN_NOT_FOUND
  }

  private final Reason reason;

  /**
   * Instantiates a new Authentication exception.
   *
   * @param reason  the reason
   * @param message the message
   */
  public AuthenticationException(final Reason reason, final String message) {
    super(message);
    this.reason = reason;
  }

  /**
   * Instantiates a new Authentication exception.
   *
   * @param reason  the reason
   * @param message the message
   * @param cause   the cause
   */
  public AuthenticationException(final Reason reason, final String message, final Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  /**
   * The reason.
   *
   * @return the reason
   */
  public Reason reason() {
    return reason;
  }

  /**
   * Whether the request simply carried no credential.
   *
   * @return true for {@link Reason#NO_AUTH_DATA}
   */
  public boolean isNoAuthData() {
    return reason == Reason.NO_AUTH_DATA;
  }
}
