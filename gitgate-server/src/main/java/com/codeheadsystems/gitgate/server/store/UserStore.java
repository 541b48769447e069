package com.codeheadsystems.gitgate.server.store;

import com.codeheadsystems.gitgate.server.model.User;
import java.util.Optional;

/**
 * Read access to users. Implementations must be thread-safe.
 */
public interface UserStore {

  /**
   * Finds a user by id.
   *
   * @param id the user id
   * @return the user, or empty if none exists
   */
  Optional<User> find(long id);
}
