package com.codeheadsystems.gitgate.server.store;

import com.codeheadsystems.gitgate.server.model.Token;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link TokenStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired records are lazily evicted on {@link #find}. All records are lost on restart.
 * Suitable for development and integration testing only.
 */
public class InMemoryTokenStore implements TokenStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryTokenStore.class);

  private final ConcurrentHashMap<Long, Token> store = new ConcurrentHashMap<>();
  // Reverse index: principalId → token ids, kept in sync with store.
  private final ConcurrentHashMap<Long, Set<Long>> principalToTokens = new ConcurrentHashMap<>();
  private final Clock clock;

  /**
   * Instantiates a new In memory token store using the system clock.
   */
  public InMemoryTokenStore() {
    this(Clock.systemUTC());
  }

  /**
   * Instantiates a new In memory token store.
   *
   * @param clock the clock used for expiry checks
   */
  public InMemoryTokenStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void save(Token token) {
    Token previous = store.put(token.id(), token);
    if (previous != null && previous.principalId() != token.principalId()) {
      Set<Long> ids = principalToTokens.get(previous.principalId());
      if (ids != null) {
        ids.remove(token.id());
      }
    }
    principalToTokens.computeIfAbsent(token.principalId(),
        k -> ConcurrentHashMap.newKeySet()).add(token.id());
    log.debug("Stored token id={} principal={}", token.id(), token.principalId());
  }

  @Override
  public Optional<Token> find(long id) {
    Token token = store.get(id);
    if (token == null) {
      return Optional.empty();
    }
    if (token.isExpired(clock.instant())) {
      delete(id);
      return Optional.empty();
    }
    return Optional.of(token);
  }

  @Override
  public void delete(long id) {
    Token token = store.remove(id);
    if (token != null) {
      Set<Long> ids = principalToTokens.get(token.principalId());
      if (ids != null) {
        ids.remove(id);
      }
    }
    log.debug("Deleted token id={}", id);
  }

  @Override
  public int deleteByPrincipal(long principalId) {
    Set<Long> ids = principalToTokens.remove(principalId);
    if (ids == null) {
      return 0;
    }
    int deleted = 0;
    for (Long id : ids) {
      // Only records the principal still owns.
      Token token = store.get(id);
      if (token != null && token.principalId() == principalId && store.remove(id, token)) {
        deleted++;
      }
    }
    log.debug("Deleted {} token(s) for principal={}", deleted, principalId);
    return deleted;
  }
}
