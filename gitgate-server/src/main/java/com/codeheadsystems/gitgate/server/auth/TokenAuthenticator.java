package com.codeheadsystems.gitgate.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.gitgate.server.auth.AuthenticationException.Reason;
import com.codeheadsystems.gitgate.server.model.Principal;
import com.codeheadsystems.gitgate.server.model.Session;
import com.codeheadsystems.gitgate.server.model.Token;
import com.codeheadsystems.gitgate.server.model.TokenMetadata;
import com.codeheadsystems.gitgate.server.model.TokenType;
import com.codeheadsystems.gitgate.server.store.TokenStore;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates a request by the bearer token it carries.
 * <p>
 * Tokens are HMAC-signed JWTs whose key is the salt of the principal they were issued to. The
 * claim set names that principal, so verification runs in this order:
 * <ol>
 *   <li>decode the claims without trusting them;</li>
 *   <li>map the claimed token class to a principal class, rejecting unknown classes before any
 *       store is touched;</li>
 *   <li>accept only HS256, HS384 and HS512 as the header algorithm;</li>
 *   <li>resolve the principal and verify the signature with its salt;</li>
 *   <li>confirm the referenced token record still exists and belongs to that principal.</li>
 * </ol>
 * The last step makes deletion of a token record an immediate revocation of every credential that
 * references it, however valid its signature.
 * <p>
 * Stateless and lock-free: safe to share across concurrent requests.
 */
@Singleton
public class TokenAuthenticator implements Authenticator {

  private static final Logger log = LoggerFactory.getLogger(TokenAuthenticator.class);

  private static final String INVALID_TOKEN = "invalid token";

  private final CredentialExtractor credentialExtractor;
  private final PrincipalResolver principalResolver;
  private final TokenStore tokenStore;

  /**
   * Instantiates a new Token authenticator.
   *
   * @param credentialExtractor the credential extractor
   * @param principalResolver   the principal resolver
   * @param tokenStore          the token store
   */
  @Inject
  public TokenAuthenticator(final CredentialExtractor credentialExtractor,
                            final PrincipalResolver principalResolver,
                            final TokenStore tokenStore) {
    this.credentialExtractor = credentialExtractor;
    this.principalResolver = principalResolver;
    this.tokenStore = tokenStore;
  }

  @Override
  public Session authenticate(final HttpServletRequest request) {
    String credential = credentialExtractor.extract(request)
        .orElseThrow(() -> new AuthenticationException(Reason.NO_AUTH_DATA, "no authentication data"));
    return authenticate(credential);
  }

  /**
   * Authenticates a raw credential, as extracted from a request.
   *
   * @param credential the credential
   * @return the session
   * @throws AuthenticationException if the credential is not acceptable
   */
  public Session authenticate(final String credential) {
    DecodedJWT unverified;
    try {
      unverified = JWT.decode(credential);
    } catch (JWTDecodeException e) {
      log.debug("Token could not be decoded: {}", e.getMessage());
      throw new AuthenticationException(Reason.INVALID_TOKEN, INVALID_TOKEN, e);
    }
    TokenClaims claims = TokenClaims.from(unverified);

    TokenType tokenType = TokenType.fromValue(claims.tokenType())
        .orElseThrow(() -> {
          log.debug("Unsupported token type '{}'", claims.tokenType());
          return new AuthenticationException(Reason.UNSUPPORTED_TOKEN_TYPE,
              "unsupported token type '" + claims.tokenType() + "'");
        });

    String algorithmName = unverified.getAlgorithm();
    if (!isHmac(algorithmName)) {
      log.debug("Rejected token signed with algorithm {}", algorithmName);
      throw new AuthenticationException(Reason.INVALID_TOKEN, INVALID_TOKEN);
    }

    Principal principal = principalResolver.resolve(tokenType.principalType(), claims.principalId())
        .orElseThrow(() -> {
          log.warn("cannot find principal token_type={} principal_id={}",
              tokenType.value(), claims.principalId());
          return new AuthenticationException(Reason.PRINCIPAL_NOT_FOUND, "principal not found");
        });

    verifySignature(unverified, algorithmName, principal);

    Token token = tokenStore.find(claims.tokenId())
        .filter(found -> found.principalId() == principal.id())
        .orElseThrow(() -> {
          log.debug("Token id={} for principal_id={} not found", claims.tokenId(), principal.id());
          return new AuthenticationException(Reason.TOKEN_NOT_FOUND, "token wasn't found");
        });

    return new Session(principal, TokenMetadata.of(token));
  }

  private void verifySignature(DecodedJWT unverified, String algorithmName, Principal principal) {
    String salt = principal.salt();
    if (salt == null || salt.isEmpty()) {
      log.warn("principal_id={} has no signing secret", principal.id());
      throw new AuthenticationException(Reason.INVALID_TOKEN, INVALID_TOKEN);
    }
    JWTVerifier verifier = JWT.require(hmac(algorithmName, salt.getBytes(StandardCharsets.UTF_8)))
        .build();
    try {
      verifier.verify(unverified);
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed for principal_id={}: {}", principal.id(), e.getMessage());
      throw new AuthenticationException(Reason.INVALID_TOKEN, INVALID_TOKEN, e);
    }
  }

  private static boolean isHmac(String algorithmName) {
    return "HS256".equals(algorithmName)
        || "HS384".equals(algorithmName)
        || "HS512".equals(algorithmName);
  }

  private static Algorithm hmac(String algorithmName, byte[] secret) {
    return switch (algorithmName) {
      case "HS256" -> Algorithm.HMAC256(secret);
      case "HS384" -> Algorithm.HMAC384(secret);
      case "HS512" -> Algorithm.HMAC512(secret);
      default -> throw new AuthenticationException(Reason.INVALID_TOKEN, INVALID_TOKEN);
    };
  }
}
