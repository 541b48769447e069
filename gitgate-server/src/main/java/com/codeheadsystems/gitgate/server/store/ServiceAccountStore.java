package com.codeheadsystems.gitgate.server.store;

import com.codeheadsystems.gitgate.server.model.ServiceAccount;
import java.util.Optional;

/**
 * Read access to service accounts. Implementations must be thread-safe.
 */
public interface ServiceAccountStore {

  /**
   * Finds a service account by id.
   *
   * @param id the service account id
   * @return the service account, or empty if none exists
   */
  Optional<ServiceAccount> find(long id);
}
