package com.codeheadsystems.gitgate.server.store;

import com.codeheadsystems.gitgate.server.model.ServiceAccount;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent in-memory {@link ServiceAccountStore}. Suitable for development and testing only.
 */
public class InMemoryServiceAccountStore implements ServiceAccountStore {

  private final ConcurrentHashMap<Long, ServiceAccount> store = new ConcurrentHashMap<>();

  /**
   * Adds or replaces a service account.
   *
   * @param serviceAccount the service account
   */
  public void save(ServiceAccount serviceAccount) {
    store.put(serviceAccount.id(), serviceAccount);
  }

  @Override
  public Optional<ServiceAccount> find(long id) {
    return Optional.ofNullable(store.get(id));
  }
}
