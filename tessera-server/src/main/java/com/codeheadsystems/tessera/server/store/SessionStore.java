package com.codeheadsystems.tessera.server.store;

import com.codeheadsystems.tessera.server.exceptions.PersistenceException;
import com.codeheadsystems.tessera.server.model.Session;
import com.codeheadsystems.tessera.server.model.SessionId;
import com.codeheadsystems.tessera.server.model.UserId;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for {@link Session} records.
 * <p>
 * Implementations must be thread-safe. The store is the only path through which a session may be
 * mutated; it never sees a raw secret, only {@link Session#secretHash()}.
 * <p>
 * <strong>User revocation contract:</strong> {@link #deleteAllForUser(UserId)} must remove every
 * session of the user, so implementations must keep whatever index makes that efficient; a
 * full-store scan per call is not acceptable under load.
 */
public interface SessionStore {

  /**
   * Inserts or replaces the session keyed by {@link Session#id()}.
   * <p>
   * Upsert semantics: saving a session whose id already exists replaces the stored record.
   *
   * @param session the session
   * @throws PersistenceException if the write did not become durable
   */
  void save(Session session);

  /**
   * Replaces a stored session only if the current record still equals {@code expected}.
   * <p>
   * Updates to an existing session go through here so that a concurrent delete is never undone.
   *
   * @param expected the record the caller read
   * @param updated  the new record, with the same id and user
   * @return true if the record was replaced, false if it was deleted or changed since it was read
   * @throws PersistenceException if the write did not become durable
   */
  boolean replace(Session expected, Session updated);

  /**
   * Loads a session by id.
   *
   * @param id the session id
   * @return the session, or empty if none is stored under {@code id}
   */
  Optional<Session> get(SessionId id);

  /**
   * Removes a session, if present.
   *
   * @param id the session id
   * @throws PersistenceException if the delete did not become durable
   */
  void delete(SessionId id);

  /**
   * All sessions currently stored for a user, in no particular order.
   *
   * @param userId the owner
   * @return the sessions, possibly empty
   */
  List<Session> findByUser(UserId userId);

  /**
   * Removes every session belonging to a user. Must not throw when the user has none.
   *
   * @param userId the owner
   * @return the number of sessions removed
   * @throws PersistenceException if the delete did not become durable
   */
  int deleteAllForUser(UserId userId);
}
