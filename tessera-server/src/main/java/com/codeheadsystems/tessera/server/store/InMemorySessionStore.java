package com.codeheadsystems.tessera.server.store;

import com.codeheadsystems.tessera.server.model.Session;
import com.codeheadsystems.tessera.server.model.SessionId;
import com.codeheadsystems.tessera.server.model.UserId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All sessions are lost on restart. Suitable for development and integration testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<SessionId, Session> store = new ConcurrentHashMap<>();
  // Reverse index: user → session ids, kept in sync with store.
  private final ConcurrentHashMap<UserId, Set<SessionId>> userToSessions = new ConcurrentHashMap<>();

  @Override
  public void save(Session session) {
    Objects.requireNonNull(session, "session");
    // Written under the user's index entry so deleteAllForUser never detaches a fresh id.
    userToSessions.compute(session.userId(), (userId, ids) -> {
      Set<SessionId> updated = ids == null ? ConcurrentHashMap.newKeySet() : ids;
      store.put(session.id(), session);
      updated.add(session.id());
      return updated;
    });
    log.debug("Saved session id={}", session.id());
  }

  @Override
  public boolean replace(Session expected, Session updated) {
    Objects.requireNonNull(expected, "expected");
    Objects.requireNonNull(updated, "updated");
    if (!expected.id().equals(updated.id()) || !expected.userId().equals(updated.userId())) {
      throw new IllegalArgumentException("replace may not change a session's id or user");
    }
    boolean replaced = store.replace(expected.id(), expected, updated);
    log.debug("Replace session id={}: {}", expected.id(), replaced);
    return replaced;
  }

  @Override
  public Optional<Session> get(SessionId id) {
    return Optional.ofNullable(store.get(id));
  }

  @Override
  public void delete(SessionId id) {
    Session removed = store.remove(id);
    if (removed != null) {
      userToSessions.computeIfPresent(removed.userId(), (userId, ids) -> {
        ids.remove(id);
        return ids.isEmpty() ? null : ids;
      });
    }
    log.debug("Deleted session id={}", id);
  }

  @Override
  public List<Session> findByUser(UserId userId) {
    Set<SessionId> ids = userToSessions.get(userId);
    if (ids == null) {
      return List.of();
    }
    return ids.stream()
        .map(store::get)
        .filter(Objects::nonNull)
        .toList();
  }

  @Override
  public int deleteAllForUser(UserId userId) {
    Set<SessionId> ids = userToSessions.remove(userId);
    if (ids == null) {
      return 0;
    }
    int removed = 0;
    for (SessionId id : ids) {
      if (store.remove(id) != null) {
        removed++;
      }
    }
    log.debug("Deleted {} session(s) for user={}", removed, userId);
    return removed;
  }

  /**
   * Number of stored sessions.
   *
   * @return the count
   */
  public int size() {
    return store.size();
  }
}
