package com.codeheadsystems.gitgate.server.auth;

import com.codeheadsystems.gitgate.server.model.Principal;
import com.codeheadsystems.gitgate.server.model.PrincipalType;
import com.codeheadsystems.gitgate.server.store.ServiceAccountStore;
import com.codeheadsystems.gitgate.server.store.UserStore;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Fetches a principal from the store that holds its class.
 */
@Singleton
public class PrincipalResolver {

  private final UserStore userStore;
  private final ServiceAccountStore serviceAccountStore;

  /**
   * Instantiates a new Principal resolver.
   *
   * @param userStore           the user store
   * @param serviceAccountStore the service account store
   */
  @Inject
  public PrincipalResolver(final UserStore userStore,
                           final ServiceAccountStore serviceAccountStore) {
    this.userStore = userStore;
    this.serviceAccountStore = serviceAccountStore;
  }

  /**
   * Resolves a principal by class and id.
   *
   * @param type the principal class
   * @param id   the principal id
   * @return the principal, or empty if the class's store has no such id
   */
  public Optional<Principal> resolve(final PrincipalType type, final long id) {
    return switch (type) {
      case USER -> userStore.find(id).map(Principal::fromUser);
      case SERVICE_ACCOUNT -> serviceAccountStore.find(id).map(Principal::fromServiceAccount);
    };
  }
}
