package com.codeheadsystems.gitgate.server.store;

import com.codeheadsystems.gitgate.server.model.Token;
import java.util.Optional;

/**
 * Storage for token records.
 * <p>
 * Implementations must be thread-safe.
 * <p>
 * <strong>Revocation contract:</strong> a token is valid only while its record can be found.
 * {@link #find(long)} must return empty for deleted and expired records, so that credentials
 * that are still cryptographically valid stop being accepted as soon as their record is gone.
 */
public interface TokenStore {

  /**
   * Stores a token record, replacing any record with the same id.
   *
   * @param token the token
   */
  void save(Token token);

  /**
   * Finds a live token record by id.
   *
   * @param id the token id
   * @return the token, or empty if not found, deleted, or expired
   */
  Optional<Token> find(long id);

  /**
   * Deletes a single token record, revoking every credential that references it.
   *
   * @param id the token id
   */
  void delete(long id);

  /**
   * Deletes <em>all</em> token records owned by the given principal.
   * <p>
   * Called when a principal is removed or its salt is rotated. Implementations must handle a
   * principal without tokens without throwing.
   *
   * @param principalId the owning principal id
   * @return the number of records deleted
   */
  int deleteByPrincipal(long principalId);
}
