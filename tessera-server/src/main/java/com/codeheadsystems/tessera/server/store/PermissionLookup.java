package com.codeheadsystems.tessera.server.store;

import com.codeheadsystems.tessera.server.exceptions.PermissionLookupException;
import com.codeheadsystems.tessera.server.model.UserId;
import java.util.Set;

/**
 * Resolves a user's current permission set.
 */
@FunctionalInterface
public interface PermissionLookup {

  /**
   * Current permissions of a user.
   *
   * @param userId the user
   * @return the permissions, empty if none are granted
   * @throws PermissionLookupException if the permission source could not be consulted
   */
  Set<String> permissionsFor(UserId userId);
}
