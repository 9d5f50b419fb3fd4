package com.codeheadsystems.tessera.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.server.MutableClock;
import com.codeheadsystems.tessera.server.auth.JwtSignedTokenCodec;
import com.codeheadsystems.tessera.server.exceptions.InvalidSessionException;
import com.codeheadsystems.tessera.server.hash.Argon2idSecretHasher;
import com.codeheadsystems.tessera.server.hash.DigestSecretHasher;
import com.codeheadsystems.tessera.server.hash.SecretHasher;
import com.codeheadsystems.tessera.server.model.AccessToken;
import com.codeheadsystems.tessera.server.model.RawSecret;
import com.codeheadsystems.tessera.server.model.Session;
import com.codeheadsystems.tessera.server.model.SessionId;
import com.codeheadsystems.tessera.server.model.SessionTokenPayload;
import com.codeheadsystems.tessera.server.model.TokenPair;
import com.codeheadsystems.tessera.server.model.UserId;
import com.codeheadsystems.tessera.server.store.InMemoryPermissionLookup;
import com.codeheadsystems.tessera.server.store.InMemorySessionStore;
import com.codeheadsystems.tessera.server.token.SecureRandomTokenGenerator;
import com.codeheadsystems.tessera.server.token.SessionTokenCodec;
import com.codeheadsystems.tessera.server.token.UuidIdentifierGenerator;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionManagerTest {

  private static final byte[] JWT_SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes();
  private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
  private static final Duration TTL = Duration.ofMinutes(15);
  private static final UserId ALICE = new UserId("alice");
  private static final UserId BOB = new UserId("bob");

  private final SessionTokenCodec sessionTokenCodec = new SessionTokenCodec();

  private MutableClock clock;
  private InMemorySessionStore store;
  private InMemoryPermissionLookup permissions;
  private JwtSignedTokenCodec accessTokenCodec;
  private AccessTokenFactory accessTokenFactory;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new InMemorySessionStore();
    permissions = new InMemoryPermissionLookup();
    permissions.grant(ALICE, Set.of("read"));
    accessTokenCodec = new JwtSignedTokenCodec(JWT_SECRET, "test-issuer", clock);
    accessTokenFactory = new AccessTokenFactory(permissions, accessTokenCodec, TTL,
        PermissionLookupFailurePolicy.GRANT_NONE);
  }

  @Test
  void authenticate_validToken_recordsUse() {
    SecretHasher hasher = new DigestSecretHasher();
    TokenPair tokens = issuer(hasher).openSession(ALICE);
    clock.advance(Duration.ofMinutes(5));

    Session session = manager(hasher).authenticate(tokens.sessionToken());

    assertThat(session.userId()).isEqualTo(ALICE);
    assertThat(session.createdAt()).isEqualTo(START);
    assertThat(session.lastUseAt()).isEqualTo(START.plus(Duration.ofMinutes(5)));
    assertThat(store.get(tokens.sessionId()).orElseThrow().lastUseAt())
        .isEqualTo(START.plus(Duration.ofMinutes(5)));
  }

  @Test
  void authenticate_clockMovedBack_keepsLaterLastUse() {
    SecretHasher hasher = new DigestSecretHasher();
    TokenPair tokens = issuer(hasher).openSession(ALICE);
    SessionManager manager = manager(hasher);
    clock.advance(Duration.ofMinutes(5));
    manager.authenticate(tokens.sessionToken());
    clock.set(START.plus(Duration.ofMinutes(1)));

    assertThat(manager.authenticate(tokens.sessionToken()).lastUseAt())
        .isEqualTo(START.plus(Duration.ofMinutes(5)));
  }

  @Test
  void authenticate_wrongSecret_throws() {
    SecretHasher hasher = new DigestSecretHasher();
    TokenPair tokens = issuer(hasher).openSession(ALICE);
    String forged = sessionTokenCodec.encode(new SessionTokenPayload(
        tokens.sessionId(), new RawSecret(new byte[16])));

    assertThatThrownBy(() -> manager(hasher).authenticate(forged))
        .isInstanceOf(InvalidSessionException.class)
        .hasMessage("Session not found or secret mismatch");
  }

  @Test
  void authenticate_unknownSession_throwsSameFailure() {
    SecretHasher hasher = new DigestSecretHasher();
    TokenPair tokens = issuer(hasher).openSession(ALICE);
    store.delete(tokens.sessionId());

    assertThatThrownBy(() -> manager(hasher).authenticate(tokens.sessionToken()))
        .isInstanceOf(InvalidSessionException.class)
        .hasMessage("Session not found or secret mismatch");
  }

  @Test
  void authenticate_sessionRevokedMidUse_staysRevoked() {
    SecretHasher hasher = new DigestSecretHasher();
    AtomicBoolean revokeOnRead = new AtomicBoolean(false);
    store = new InMemorySessionStore() {
      @Override
      public Optional<Session> get(SessionId id) {
        Optional<Session> read = super.get(id);
        if (revokeOnRead.getAndSet(false)) {
          read.ifPresent(session -> deleteAllForUser(session.userId()));
        }
        return read;
      }
    };
    TokenPair tokens = issuer(hasher).openSession(ALICE);
    clock.advance(Duration.ofMinutes(1));
    revokeOnRead.set(true);

    assertThatThrownBy(() -> manager(hasher).authenticate(tokens.sessionToken()))
        .isInstanceOf(InvalidSessionException.class)
        .hasMessage("Session not found or secret mismatch");
    assertThat(store.size()).isZero();
    assertThat(store.findByUser(ALICE)).isEmpty();
  }

  @Test
  void authenticate_concurrentUseOfSameSession_bothSucceed() {
    SecretHasher hasher = new DigestSecretHasher();
    AtomicBoolean touchOnRead = new AtomicBoolean(false);
    store = new InMemorySessionStore() {
      @Override
      public Optional<Session> get(SessionId id) {
        Optional<Session> read = super.get(id);
        if (touchOnRead.getAndSet(false)) {
          // Another caller records a later use between this read and the write.
          read.ifPresent(session -> save(session.withLastUseAt(START.plus(Duration.ofMinutes(10)))));
        }
        return read;
      }
    };
    TokenPair tokens = issuer(hasher).openSession(ALICE);
    clock.advance(Duration.ofMinutes(5));
    touchOnRead.set(true);

    Session session = manager(hasher).authenticate(tokens.sessionToken());

    assertThat(session.lastUseAt()).isEqualTo(START.plus(Duration.ofMinutes(10)));
    assertThat(store.get(tokens.sessionId()).orElseThrow().lastUseAt())
        .isEqualTo(START.plus(Duration.ofMinutes(10)));
  }

  @Test
  void authenticate_malformedToken_throws() {
    assertThatThrownBy(() -> manager(new DigestSecretHasher()).authenticate("not a session token"))
        .isInstanceOf(InvalidSessionException.class);
  }

  @Test
  void authenticate_weakHash_isUpgradedInPlace() {
    Argon2idSecretHasher weak = new Argon2idSecretHasher(32, 1, 1, new SecureRandom());
    Argon2idSecretHasher current = new Argon2idSecretHasher(64, 1, 1, new SecureRandom());
    TokenPair tokens = issuer(weak).openSession(ALICE);
    SessionManager manager = manager(current);

    manager.authenticate(tokens.sessionToken());

    Session stored = store.get(tokens.sessionId()).orElseThrow();
    assertThat(stored.secretHash().value()).startsWith("$argon2id$v=19$m=64,t=1,p=1$");
    assertThat(current.needsRehash(stored.secretHash())).isFalse();
    assertThat(manager.authenticate(tokens.sessionToken()).id()).isEqualTo(tokens.sessionId());
  }

  @Test
  void refreshAccessToken_carriesCurrentPermissions() {
    SecretHasher hasher = new DigestSecretHasher();
    TokenPair tokens = issuer(hasher).openSession(ALICE);
    permissions.grant(ALICE, Set.of("read", "write"));
    clock.advance(Duration.ofMinutes(20));

    AccessToken refreshed = manager(hasher).refreshAccessToken(tokens.sessionToken());

    assertThat(accessTokenCodec.decode(refreshed.token()).permissions()).containsExactlyInAnyOrder("read", "write");
    assertThat(refreshed.claims().issuedAt()).isEqualTo(START.plus(Duration.ofMinutes(20)));
  }

  @Test
  void revoke_endsSession() {
    SecretHasher hasher = new DigestSecretHasher();
    TokenPair tokens = issuer(hasher).openSession(ALICE);
    SessionManager manager = manager(hasher);

    manager.revoke(tokens.sessionToken());

    assertThat(store.get(tokens.sessionId())).isEmpty();
    assertThatThrownBy(() -> manager.authenticate(tokens.sessionToken()))
        .isInstanceOf(InvalidSessionException.class);
  }

  @Test
  void revokeAllForUser_endsEverySessionOfThatUserOnly() {
    SecretHasher hasher = new DigestSecretHasher();
    SessionIssuer issuer = issuer(hasher);
    TokenPair alice1 = issuer.openSession(ALICE);
    TokenPair alice2 = issuer.openSession(ALICE);
    TokenPair bob = issuer.openSession(BOB);
    SessionManager manager = manager(hasher);

    assertThat(manager.revokeAllForUser(ALICE)).isEqualTo(2);

    assertThatThrownBy(() -> manager.authenticate(alice1.sessionToken()))
        .isInstanceOf(InvalidSessionException.class);
    assertThatThrownBy(() -> manager.authenticate(alice2.sessionToken()))
        .isInstanceOf(InvalidSessionException.class);
    assertThat(manager.authenticate(bob.sessionToken()).userId()).isEqualTo(BOB);
  }

  private SessionIssuer issuer(SecretHasher hasher) {
    return new SessionIssuer(clock, new UuidIdentifierGenerator(), new SecureRandomTokenGenerator(),
        hasher, store, accessTokenFactory, sessionTokenCodec,
        new SessionIssuerConfig(TTL, 128, PermissionLookupFailurePolicy.GRANT_NONE), Runnable::run);
  }

  private SessionManager manager(SecretHasher hasher) {
    return new SessionManager(clock, hasher, store, accessTokenFactory, sessionTokenCodec);
  }
}
