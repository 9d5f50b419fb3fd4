package com.codeheadsystems.tessera.dropwizard.auth;

import io.dropwizard.auth.Authorizer;
import jakarta.ws.rs.container.ContainerRequestContext;

/**
 * Treats each {@code @RolesAllowed} role as a permission name that must be present in the token.
 */
public class TesseraAuthorizer implements Authorizer<TesseraPrincipal> {

  @Override
  public boolean authorize(TesseraPrincipal principal, String role, ContainerRequestContext requestContext) {
    return principal.permissions().contains(role);
  }
}
