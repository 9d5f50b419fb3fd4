package com.codeheadsystems.tessera.server.token;

import com.codeheadsystems.tessera.server.exceptions.GenerationException;
import com.codeheadsystems.tessera.server.model.SessionId;

/**
 * Produces globally unique identifiers for new sessions.
 */
@FunctionalInterface
public interface IdentifierGenerator {

  /**
   * Next identifier.
   *
   * @return a session id never returned before
   * @throws GenerationException if no identifier can be produced
   */
  SessionId next();
}
