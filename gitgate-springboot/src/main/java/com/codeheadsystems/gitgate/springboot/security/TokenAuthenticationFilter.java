package com.codeheadsystems.gitgate.springboot.security;

import com.codeheadsystems.gitgate.server.auth.AuthenticationException;
import com.codeheadsystems.gitgate.server.auth.Authenticator;
import com.codeheadsystems.gitgate.server.model.Session;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs the authenticator on every request.
 * <p>
 * A request without credentials continues anonymously. A request whose credentials fail is
 * answered with a bare 401; the cause is only logged.
 */
public class TokenAuthenticationFilter extends OncePerRequestFilter {

  /**
   * Request attribute holding the {@link Session} of an authenticated request.
   */
  public static final String SESSION_ATTRIBUTE = "gitgate.session";

  private static final Logger log = LoggerFactory.getLogger(TokenAuthenticationFilter.class);

  private final Authenticator authenticator;

  /**
   * Instantiates a new Token authentication filter.
   *
   * @param authenticator the authenticator
   */
  public TokenAuthenticationFilter(Authenticator authenticator) {
    this.authenticator = authenticator;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    Session session;
    try {
      session = authenticator.authenticate(request);
    } catch (AuthenticationException e) {
      if (e.isNoAuthData()) {
        filterChain.doFilter(request, response);
        return;
      }
      log.info("authentication failed reason={} uri={}: {}", e.reason(), request.getRequestURI(), e.getMessage());
      SecurityContextHolder.clearContext();
      response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
      return;
    }

    List<SimpleGrantedAuthority> authorities = session.metadata().grants().stream()
        .map(SimpleGrantedAuthority::new)
        .toList();
    UsernamePasswordAuthenticationToken auth =
        new UsernamePasswordAuthenticationToken(session, null, authorities);
    SecurityContextHolder.getContext().setAuthentication(auth);
    request.setAttribute(SESSION_ATTRIBUTE, session);
    filterChain.doFilter(request, response);
  }
}
