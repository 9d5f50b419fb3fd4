package com.codeheadsystems.tessera.server.manager;

import com.codeheadsystems.tessera.server.exceptions.GenerationException;
import com.codeheadsystems.tessera.server.exceptions.HashException;
import com.codeheadsystems.tessera.server.exceptions.PermissionLookupException;
import com.codeheadsystems.tessera.server.exceptions.PersistenceException;
import com.codeheadsystems.tessera.server.hash.SecretHasher;
import com.codeheadsystems.tessera.server.model.AccessToken;
import com.codeheadsystems.tessera.server.model.RawSecret;
import com.codeheadsystems.tessera.server.model.Session;
import com.codeheadsystems.tessera.server.model.SessionId;
import com.codeheadsystems.tessera.server.model.SessionTokenPayload;
import com.codeheadsystems.tessera.server.model.TokenPair;
import com.codeheadsystems.tessera.server.model.UserId;
import com.codeheadsystems.tessera.server.store.SessionStore;
import com.codeheadsystems.tessera.server.token.IdentifierGenerator;
import com.codeheadsystems.tessera.server.token.SessionTokenCodec;
import com.codeheadsystems.tessera.server.token.TokenGenerator;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens sessions: creates the session record and mints both bearer tokens for the caller.
 * <p>
 * Everything that can fail, short of persistence, runs before {@link SessionStore#save}. The save
 * is the commit point: a call either returns tokens backed by exactly one stored session, or
 * throws and leaves nothing stored. The raw secret exists only inside a call and inside the
 * returned session token.
 * <p>
 * <strong>Exception contract:</strong>
 * <ul>
 *   <li>{@link GenerationException}: no secret or session id could be produced</li>
 *   <li>{@link HashException}: the hasher failed</li>
 *   <li>{@link PersistenceException}: the store rejected the session</li>
 *   <li>{@link PermissionLookupException}: only under {@link PermissionLookupFailurePolicy#FAIL}</li>
 *   <li>{@link CancellationException}: the calling thread was interrupted before the commit point</li>
 * </ul>
 * Nothing is retried here.
 */
@Singleton
public class SessionIssuer {

  private static final Logger log = LoggerFactory.getLogger(SessionIssuer.class);

  private final Clock clock;
  private final IdentifierGenerator identifierGenerator;
  private final TokenGenerator tokenGenerator;
  private final SecretHasher secretHasher;
  private final SessionStore sessionStore;
  private final AccessTokenFactory accessTokenFactory;
  private final SessionTokenCodec sessionTokenCodec;
  private final SessionIssuerConfig config;
  private final Executor executor;

  @Inject
  public SessionIssuer(Clock clock,
                       IdentifierGenerator identifierGenerator,
                       TokenGenerator tokenGenerator,
                       SecretHasher secretHasher,
                       SessionStore sessionStore,
                       AccessTokenFactory accessTokenFactory,
                       SessionTokenCodec sessionTokenCodec,
                       SessionIssuerConfig config,
                       Executor executor) {
    this.clock = clock;
    this.identifierGenerator = identifierGenerator;
    this.tokenGenerator = tokenGenerator;
    this.secretHasher = secretHasher;
    this.sessionStore = sessionStore;
    this.accessTokenFactory = accessTokenFactory;
    this.sessionTokenCodec = sessionTokenCodec;
    this.config = config;
    this.executor = executor;
    log.info("SessionIssuer(accessTokenTtl={}, secretBits={}, lookupFailurePolicy={})",
        config.accessTokenTtl(), config.secretBits(), config.lookupFailurePolicy());
  }

  /**
   * Opens a new session for an already-authenticated user.
   *
   * @param userId the user
   * @return the access token and session token
   */
  public TokenPair openSession(UserId userId) {
    Objects.requireNonNull(userId, "userId");
    log.debug("openSession(user={})", userId);
    Instant now = clock.instant();

    RawSecret secret = tokenGenerator.generate(config.secretBits());
    SessionId sessionId = identifierGenerator.next();
    Session session = Session.open(sessionId, userId, now, secretHasher.hash(secret.encoded()));

    AccessToken accessToken = accessTokenFactory.mint(userId, now);
    String sessionToken = sessionTokenCodec.encode(new SessionTokenPayload(sessionId, secret));

    if (Thread.currentThread().isInterrupted()) {
      log.debug("openSession(user={}) interrupted before commit; nothing persisted", userId);
      throw new CancellationException("Session open cancelled before commit");
    }
    commit(session);
    log.debug("Opened session id={} for user={}", sessionId, userId);
    return new TokenPair(accessToken.token(), sessionToken, sessionId, accessToken.claims().expiresAt());
  }

  /**
   * Runs {@link #openSession} on the issuer's executor, keeping secret hashing off the caller's
   * thread. The returned future completes exceptionally with the same exceptions.
   *
   * @param userId the user
   * @return the pending token pair
   */
  public CompletableFuture<TokenPair> openSessionAsync(UserId userId) {
    Objects.requireNonNull(userId, "userId");
    return CompletableFuture.supplyAsync(() -> openSession(userId), executor);
  }

  private void commit(Session session) {
    try {
      sessionStore.save(session);
    } catch (RuntimeException e) {
      PersistenceException failure = e instanceof PersistenceException pe
          ? pe
          : new PersistenceException("Unable to persist session " + session.id(), e);
      // Remove any partial write left by the failed save.
      try {
        sessionStore.delete(session.id());
      } catch (RuntimeException cleanup) {
        failure.addSuppressed(cleanup);
      }
      log.warn("Failed to persist session id={}: {}", session.id(), e.getMessage());
      throw failure;
    }
  }
}
