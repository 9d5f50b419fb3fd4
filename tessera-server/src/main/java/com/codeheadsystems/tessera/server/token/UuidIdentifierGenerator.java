package com.codeheadsystems.tessera.server.token;

import com.codeheadsystems.tessera.server.exceptions.GenerationException;
import com.codeheadsystems.tessera.server.model.SessionId;
import java.util.UUID;

/**
 * Random (version 4) UUID session identifiers.
 */
public class UuidIdentifierGenerator implements IdentifierGenerator {

  @Override
  public SessionId next() {
    try {
      return new SessionId(UUID.randomUUID().toString());
    } catch (RuntimeException e) {
      throw new GenerationException("Unable to generate session id", e);
    }
  }
}
