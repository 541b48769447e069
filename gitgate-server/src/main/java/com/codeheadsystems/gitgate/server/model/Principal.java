package com.codeheadsystems.gitgate.server.model;

/**
 * An authenticated identity, independent of which store it came from.
 * <p>
 * The salt is the symmetric key for tokens issued to this principal. It is unique per principal
 * and rotates on its own, so revoking one principal's key never affects another's. It is
 * excluded from {@link #toString()}.
 *
 * @param id          numeric id, unique across all principal classes
 * @param type        the principal class
 * @param uid         unique name
 * @param email       email address, may be null for service accounts
 * @param displayName display name
 * @param admin       whether the principal is a system administrator
 * @param blocked     whether the principal is blocked
 * @param salt        per-principal signing secret
 */
public record Principal(
    long id,
    PrincipalType type,
    String uid,
    String email,
    String displayName,
    boolean admin,
    boolean blocked,
    String salt) {

  /**
   * Principal view of a user.
   *
   * @param user the user
   * @return the principal
   */
  public static Principal fromUser(User user) {
    return new Principal(user.id(), PrincipalType.USER, user.uid(), user.email(),
        user.displayName(), user.admin(), user.blocked(), user.salt());
  }

  /**
   * Principal view of a service account. Service accounts are never administrators.
   *
   * @param serviceAccount the service account
   * @return the principal
   */
  public static Principal fromServiceAccount(ServiceAccount serviceAccount) {
    return new Principal(serviceAccount.id(), PrincipalType.SERVICE_ACCOUNT, serviceAccount.uid(),
        null, serviceAccount.displayName(), false, false, serviceAccount.salt());
  }

  @Override
  public String toString() {
    return "Principal[id=" + id + ", type=" + type + ", uid=" + uid + "]";
  }
}
