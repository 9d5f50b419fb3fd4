package com.codeheadsystems.tessera.server.manager;

/**
 * What to do when the permission lookup fails while an access token is being minted.
 */
public enum PermissionLookupFailurePolicy {

  /**
   * Issue the token with an empty permission set and log a warning. A session still opens, but
   * its access token authorizes nothing until it is refreshed.
   */
  GRANT_NONE,

  /**
   * Propagate the failure. When opening a session nothing is persisted.
   */
  FAIL
}
