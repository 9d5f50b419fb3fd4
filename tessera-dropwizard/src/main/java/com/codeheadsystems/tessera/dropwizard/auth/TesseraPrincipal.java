package com.codeheadsystems.tessera.dropwizard.auth;

import java.security.Principal;
import java.util.Set;

/**
 * Principal representing the bearer of a verified access token.
 *
 * @param userId      the token subject
 * @param permissions permissions carried by the token
 */
public record TesseraPrincipal(String userId, Set<String> permissions) implements Principal {

  public TesseraPrincipal {
    permissions = Set.copyOf(permissions);
  }

  @Override
  public String getName() {
    return userId;
  }
}
