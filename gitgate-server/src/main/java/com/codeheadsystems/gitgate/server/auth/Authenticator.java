package com.codeheadsystems.gitgate.server.auth;

import com.codeheadsystems.gitgate.server.model.Session;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Turns an inbound request into an authenticated {@link Session}.
 */
public interface Authenticator {

  /**
   * Authenticates the request. All-or-nothing: either a complete session is returned or an
   * exception is thrown.
   *
   * @param request the inbound request
   * @return the session
   * @throws AuthenticationException if the request cannot be authenticated
   */
  Session authenticate(HttpServletRequest request);
}
