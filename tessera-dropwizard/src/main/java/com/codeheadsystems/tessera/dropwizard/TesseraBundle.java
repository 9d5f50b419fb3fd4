package com.codeheadsystems.tessera.dropwizard;

import com.codeheadsystems.tessera.dropwizard.auth.TesseraAuthenticator;
import com.codeheadsystems.tessera.dropwizard.auth.TesseraAuthorizer;
import com.codeheadsystems.tessera.dropwizard.auth.TesseraPrincipal;
import com.codeheadsystems.tessera.dropwizard.health.SigningKeyHealthCheck;
import com.codeheadsystems.tessera.server.auth.JwtSignedTokenCodec;
import com.codeheadsystems.tessera.server.auth.SignedTokenCodec;
import com.codeheadsystems.tessera.server.hash.Argon2idSecretHasher;
import com.codeheadsystems.tessera.server.hash.DigestSecretHasher;
import com.codeheadsystems.tessera.server.hash.SecretHasher;
import com.codeheadsystems.tessera.server.manager.AccessTokenFactory;
import com.codeheadsystems.tessera.server.manager.SessionIssuer;
import com.codeheadsystems.tessera.server.manager.SessionIssuerConfig;
import com.codeheadsystems.tessera.server.manager.SessionManager;
import com.codeheadsystems.tessera.server.store.InMemoryPermissionLookup;
import com.codeheadsystems.tessera.server.store.InMemorySessionStore;
import com.codeheadsystems.tessera.server.store.PermissionLookup;
import com.codeheadsystems.tessera.server.store.SessionStore;
import com.codeheadsystems.tessera.server.token.SecureRandomTokenGenerator;
import com.codeheadsystems.tessera.server.token.SessionTokenCodec;
import com.codeheadsystems.tessera.server.token.UuidIdentifierGenerator;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.ExecutorService;
import org.glassfish.jersey.server.filter.RolesAllowedDynamicFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the tessera session issuer into an existing Dropwizard application.
 * <p>
 * Registers the access-token authentication filter, {@code @RolesAllowed} permission checks and
 * the signing key health check. Requires a {@link TesseraConfiguration} block in the application's
 * YAML config. After {@code run}, the application reaches the issuer and manager through
 * {@link #getSessionIssuer()} and {@link #getSessionManager()}.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new TesseraBundle<>());
 * }</pre>
 * <p>
 * Or supply a persistent store and a real permission source:
 * <pre>{@code
 *   bootstrap.addBundle(new TesseraBundle<>(mySessionStore, myPermissionLookup));
 * }</pre>
 */
@Singleton
public class TesseraBundle<C extends TesseraConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(TesseraBundle.class);
  private static final int MIN_JWT_SECRET_BYTES = 32;

  private final SessionStore sessionStore;
  private final PermissionLookup permissionLookup;

  private SessionIssuer sessionIssuer;
  private SessionManager sessionManager;
  private SignedTokenCodec signedTokenCodec;

  /**
   * Creates a bundle backed by an in-memory session store and an empty permission table.
   * <p>
   * For dev/test only: all sessions are lost on restart and every token carries no permissions.
   */
  public TesseraBundle() {
    this(new InMemorySessionStore(), new InMemoryPermissionLookup());
    log.warn("""
        #################################################################
        # WARNING: Using an ephemeral in-memory session store and an    #
        # empty permission table. All sessions are lost on restart.     #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied session store and permission source.
   *
   * @param sessionStore     where sessions are persisted
   * @param permissionLookup where user permissions are resolved
   */
  @Inject
  public TesseraBundle(SessionStore sessionStore, PermissionLookup permissionLookup) {
    this.sessionStore = sessionStore;
    this.permissionLookup = permissionLookup;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    Clock clock = Clock.systemUTC();
    SecretHasher secretHasher = buildSecretHasher(configuration);
    signedTokenCodec = new JwtSignedTokenCodec(jwtSecret(configuration), configuration.getJwtIssuer(), clock);

    SessionIssuerConfig issuerConfig = new SessionIssuerConfig(
        Duration.ofSeconds(configuration.getAccessTokenTtlSeconds()),
        configuration.getSessionSecretBits(),
        configuration.getPermissionLookupFailurePolicy());
    AccessTokenFactory accessTokenFactory = new AccessTokenFactory(
        permissionLookup, signedTokenCodec, issuerConfig.accessTokenTtl(), issuerConfig.lookupFailurePolicy());
    SessionTokenCodec sessionTokenCodec = new SessionTokenCodec();

    ExecutorService executor = environment.lifecycle()
        .executorService("tessera-session-%d")
        .minThreads(configuration.getHashingThreads())
        .maxThreads(configuration.getHashingThreads())
        .build();

    sessionIssuer = new SessionIssuer(clock, new UuidIdentifierGenerator(), new SecureRandomTokenGenerator(),
        secretHasher, sessionStore, accessTokenFactory, sessionTokenCodec, issuerConfig, executor);
    sessionManager = new SessionManager(clock, secretHasher, sessionStore, accessTokenFactory, sessionTokenCodec);

    environment.healthChecks().register("tessera-signing-key", new SigningKeyHealthCheck(signedTokenCodec, clock));

    // Access token auth filter; @RolesAllowed names are permissions.
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<TesseraPrincipal>()
            .setAuthenticator(new TesseraAuthenticator(signedTokenCodec))
            .setAuthorizer(new TesseraAuthorizer())
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(RolesAllowedDynamicFeature.class);
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(TesseraPrincipal.class));
  }

  /**
   * The issuer wired by {@link #run}.
   *
   * @return the session issuer
   * @throws IllegalStateException if the bundle has not run yet
   */
  public SessionIssuer getSessionIssuer() {
    return requireRun(sessionIssuer);
  }

  /**
   * The manager wired by {@link #run}.
   *
   * @return the session manager
   * @throws IllegalStateException if the bundle has not run yet
   */
  public SessionManager getSessionManager() {
    return requireRun(sessionManager);
  }

  /**
   * The access token codec wired by {@link #run}.
   *
   * @return the codec
   * @throws IllegalStateException if the bundle has not run yet
   */
  public SignedTokenCodec getSignedTokenCodec() {
    return requireRun(signedTokenCodec);
  }

  private static <T> T requireRun(T component) {
    if (component == null) {
      throw new IllegalStateException("TesseraBundle has not been run yet");
    }
    return component;
  }

  private SecretHasher buildSecretHasher(C configuration) {
    if (configuration.getArgon2MemoryKib() == 0) {
      log.warn("Argon2 disabled, hashing session secrets with plain SHA-256. Do not use in production.");
      return new DigestSecretHasher();
    }
    return new Argon2idSecretHasher(
        configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(),
        configuration.getArgon2Parallelism(),
        new SecureRandom());
  }

  private byte[] jwtSecret(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Access tokens will be invalidated on restart. Do not use in production.");
      byte[] secret = new byte[MIN_JWT_SECRET_BYTES];
      new SecureRandom().nextBytes(secret);
      return secret;
    }
    byte[] secret = HexFormat.of().parseHex(secretHex);
    if (secret.length < MIN_JWT_SECRET_BYTES) {
      throw new IllegalStateException(
          "jwtSecretHex must decode to at least " + MIN_JWT_SECRET_BYTES + " bytes, got " + secret.length);
    }
    return secret;
  }
}
