package com.codeheadsystems.tessera.server.store;

import com.codeheadsystems.tessera.server.model.UserId;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link PermissionLookup} over a mutable in-memory grant table. Dev/test only.
 */
public class InMemoryPermissionLookup implements PermissionLookup {

  private final ConcurrentHashMap<UserId, Set<String>> grants = new ConcurrentHashMap<>();

  public InMemoryPermissionLookup() {
  }

  /**
   * Creates a lookup pre-populated with the given grants.
   *
   * @param initial user → permissions
   */
  public InMemoryPermissionLookup(Map<UserId, Set<String>> initial) {
    initial.forEach(this::grant);
  }

  /**
   * Replaces the permissions of a user.
   *
   * @param userId      the user
   * @param permissions the new permission set
   */
  public void grant(UserId userId, Set<String> permissions) {
    grants.put(userId, Set.copyOf(permissions));
  }

  @Override
  public Set<String> permissionsFor(UserId userId) {
    return grants.getOrDefault(userId, Set.of());
  }
}
