package com.codeheadsystems.gitgate.server.auth;

import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import javax.inject.Singleton;

/**
 * Pulls the bearer credential out of an inbound request.
 * <p>
 * The {@code Authorization} header wins over the {@code access_token} request parameter. A header
 * using the {@code Basic} scheme yields the password, which is how git's credential prompt
 * presents a token over HTTPS. Otherwise the {@code Bearer} and {@code IdentityService} scheme
 * prefixes are stripped.
 */
@Singleton
public class CredentialExtractor {

  public static final String AUTHORIZATION_HEADER = "Authorization";
  public static final String ACCESS_TOKEN_PARAMETER = "access_token";

  private static final String BASIC = "Basic";
  private static final String BASIC_PREFIX = "Basic ";
  private static final String BEARER_PREFIX = "Bearer ";
  private static final String IDENTITY_SERVICE_PREFIX = "IdentityService ";

  /**
   * Extracts the credential.
   *
   * @param request the request
   * @return the credential, or empty when none was presented or a Basic header is malformed
   */
  public Optional<String> extract(final HttpServletRequest request) {
    String header = request.getHeader(AUTHORIZATION_HEADER);
    if (header == null || header.isEmpty()) {
      return nonEmpty(request.getParameter(ACCESS_TOKEN_PARAMETER));
    }
    if (header.startsWith(BASIC)) {
      return basicPassword(header).flatMap(CredentialExtractor::nonEmpty);
    }
    String credential = stripPrefix(header, BEARER_PREFIX);
    credential = stripPrefix(credential, IDENTITY_SERVICE_PREFIX);
    return nonEmpty(credential);
  }

  private static Optional<String> basicPassword(String header) {
    if (!header.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
      return Optional.empty();
    }
    String decoded;
    try {
      decoded = new String(Base64.getDecoder().decode(header.substring(BASIC_PREFIX.length()).trim()),
          StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
    int colon = decoded.indexOf(':');
    if (colon < 0) {
      return Optional.empty();
    }
    return Optional.of(decoded.substring(colon + 1));
  }

  private static String stripPrefix(String value, String prefix) {
    return value.startsWith(prefix) ? value.substring(prefix.length()) : value;
  }

  private static Optional<String> nonEmpty(String value) {
    return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
  }
}
