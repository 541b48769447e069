package com.codeheadsystems.gitgate.server.store;

import com.codeheadsystems.gitgate.server.model.User;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent in-memory {@link UserStore}. Suitable for development and testing only.
 */
public class InMemoryUserStore implements UserStore {

  private final ConcurrentHashMap<Long, User> store = new ConcurrentHashMap<>();

  /**
   * Adds or replaces a user.
   *
   * @param user the user
   */
  public void save(User user) {
    store.put(user.id(), user);
  }

  /**
   * Removes a user.
   *
   * @param id the user id
   */
  public void delete(long id) {
    store.remove(id);
  }

  @Override
  public Optional<User> find(long id) {
    return Optional.ofNullable(store.get(id));
  }
}
