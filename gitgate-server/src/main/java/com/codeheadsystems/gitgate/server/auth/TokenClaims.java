package com.codeheadsystems.gitgate.server.auth;

import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;

/**
 * The untrusted claim set of a bearer credential. Nothing here may be relied on until the
 * signature has been verified with the secret of the principal it names.
 *
 * @param principalId the {@code pid} claim
 * @param tokenType   the raw {@code tkt} claim
 * @param tokenId     the {@code tki} claim
 */
public record TokenClaims(long principalId, String tokenType, long tokenId) {

  public static final String PRINCIPAL_ID = "pid";
  public static final String TOKEN_TYPE = "tkt";
  public static final String TOKEN_ID = "tki";

  /**
   * Reads the claim set from a decoded, not yet verified, token.
   *
   * @param jwt the decoded token
   * @return the token claims
   * @throws AuthenticationException with {@code INVALID_TOKEN} if a claim is missing or mistyped
   */
  public static TokenClaims from(DecodedJWT jwt) {
    Long principalId = longClaim(jwt, PRINCIPAL_ID);
    Long tokenId = longClaim(jwt, TOKEN_ID);
    String tokenType = jwt.getClaim(TOKEN_TYPE).asString();
    if (principalId == null || tokenId == null || tokenType == null) {
      throw new AuthenticationException(AuthenticationException.Reason.INVALID_TOKEN, "invalid token");
    }
    return new TokenClaims(principalId, tokenType, tokenId);
  }

  private static Long longClaim(DecodedJWT jwt, String name) {
    Claim claim = jwt.getClaim(name);
    if (claim.isMissing() || claim.isNull()) {
      return null;
    }
    return claim.asLong();
  }
}
