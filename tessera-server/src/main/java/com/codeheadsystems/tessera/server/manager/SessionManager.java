package com.codeheadsystems.tessera.server.manager;

import com.codeheadsystems.tessera.server.exceptions.InvalidSessionException;
import com.codeheadsystems.tessera.server.exceptions.MalformedTokenException;
import com.codeheadsystems.tessera.server.hash.SecretHasher;
import com.codeheadsystems.tessera.server.model.AccessToken;
import com.codeheadsystems.tessera.server.model.Session;
import com.codeheadsystems.tessera.server.model.SessionTokenPayload;
import com.codeheadsystems.tessera.server.model.UserId;
import com.codeheadsystems.tessera.server.store.SessionStore;
import com.codeheadsystems.tessera.server.token.SessionTokenCodec;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uses, refreshes and revokes sessions opened by {@link SessionIssuer}.
 * <p>
 * A session token is trusted only after its embedded secret verifies against the stored hash.
 * Unknown sessions, wrong secrets and malformed tokens all surface as the same
 * {@link InvalidSessionException}.
 */
@Singleton
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);
  private static final String AUTH_FAILED = "Session not found or secret mismatch";

  private final Clock clock;
  private final SecretHasher secretHasher;
  private final SessionStore sessionStore;
  private final AccessTokenFactory accessTokenFactory;
  private final SessionTokenCodec sessionTokenCodec;

  @Inject
  public SessionManager(Clock clock,
                        SecretHasher secretHasher,
                        SessionStore sessionStore,
                        AccessTokenFactory accessTokenFactory,
                        SessionTokenCodec sessionTokenCodec) {
    this.clock = clock;
    this.secretHasher = secretHasher;
    this.sessionStore = sessionStore;
    this.accessTokenFactory = accessTokenFactory;
    this.sessionTokenCodec = sessionTokenCodec;
  }

  /**
   * Verifies a session token and records the use.
   * <p>
   * On success the session's last use advances to now, and a hash made under weaker parameters
   * than the hasher's current policy is replaced with a fresh one.
   *
   * @param sessionToken the bearer string
   * @return the session as stored after this use
   * @throws InvalidSessionException if the token does not match a live session
   */
  public Session authenticate(String sessionToken) {
    SessionTokenPayload payload;
    try {
      payload = sessionTokenCodec.decode(sessionToken);
    } catch (MalformedTokenException e) {
      throw new InvalidSessionException(AUTH_FAILED, e);
    }
    String candidate = payload.secret().encoded();
    // Retry only when another use changed the record between our read and our write.
    while (true) {
      Session session = sessionStore.get(payload.sessionId())
          .orElseThrow(() -> {
            log.debug("authenticate(): no session id={}", payload.sessionId());
            return new InvalidSessionException(AUTH_FAILED);
          });
      if (!secretHasher.verify(candidate, session.secretHash())) {
        log.debug("authenticate(): secret mismatch for session id={}", session.id());
        throw new InvalidSessionException(AUTH_FAILED);
      }

      Session updated = session.withLastUseAt(clock.instant());
      boolean rehashed = secretHasher.needsRehash(session.secretHash());
      if (rehashed) {
        updated = updated.withSecretHash(secretHasher.hash(candidate));
      }
      if (updated.equals(session)) {
        return session;
      }
      if (sessionStore.replace(session, updated)) {
        if (rehashed) {
          log.info("Upgraded secret hash for session id={}", session.id());
        }
        return updated;
      }
      log.debug("authenticate(): session id={} changed concurrently, re-reading", session.id());
    }
  }

  /**
   * Mints a new access token for the owner of a valid session, with freshly resolved permissions.
   *
   * @param sessionToken the bearer string
   * @return the new access token
   * @throws InvalidSessionException if the token does not match a live session
   */
  public AccessToken refreshAccessToken(String sessionToken) {
    Session session = authenticate(sessionToken);
    log.debug("refreshAccessToken(session={})", session.id());
    return accessTokenFactory.mint(session.userId(), clock.instant());
  }

  /**
   * Ends the session the token belongs to. Already-issued access tokens stay valid until expiry.
   *
   * @param sessionToken the bearer string
   * @throws InvalidSessionException if the token does not match a live session
   */
  public void revoke(String sessionToken) {
    Session session = authenticate(sessionToken);
    sessionStore.delete(session.id());
    log.debug("Revoked session id={}", session.id());
  }

  /**
   * Ends every session of a user.
   *
   * @param userId the user
   * @return the number of sessions removed
   */
  public int revokeAllForUser(UserId userId) {
    Objects.requireNonNull(userId, "userId");
    int removed = sessionStore.deleteAllForUser(userId);
    log.debug("Revoked {} session(s) for user={}", removed, userId);
    return removed;
  }
}
