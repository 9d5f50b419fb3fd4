package com.codeheadsystems.tessera.dropwizard;

import com.codeheadsystems.tessera.server.model.UserId;
import com.codeheadsystems.tessera.server.store.InMemoryPermissionLookup;
import com.codeheadsystems.tessera.server.store.InMemorySessionStore;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.util.Map;
import java.util.Set;

/**
 * Minimal Dropwizard application used only in integration tests.
 * Not part of the library's public API.
 */
public class TesseraTestApplication extends Application<TesseraConfiguration> {

  private final TesseraBundle<TesseraConfiguration> bundle = new TesseraBundle<>(
      new InMemorySessionStore(),
      new InMemoryPermissionLookup(Map.of(
          new UserId("alice"), Set.of("read"),
          new UserId("bob"), Set.of())));

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new TesseraTestApplication().run(args);
  }

  @Override
  public String getName() {
    return "tessera-test";
  }

  @Override
  public void initialize(Bootstrap<TesseraConfiguration> bootstrap) {
    bootstrap.addBundle(bundle);
  }

  @Override
  public void run(TesseraConfiguration configuration, Environment environment) {
    // Test-only endpoints; a real application opens sessions after its own login step.
    environment.jersey().register(new SessionResource(bundle));
    environment.jersey().register(new WhoAmIResource());
  }
}
