package com.codeheadsystems.tessera.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.server.auth.JwtSignedTokenCodec;
import com.codeheadsystems.tessera.server.model.AccessToken;
import com.codeheadsystems.tessera.server.model.UserId;
import com.codeheadsystems.tessera.server.store.InMemoryPermissionLookup;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AccessTokenFactoryTest {

  private static final byte[] JWT_SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes();
  private static final Instant NOW_WITH_MILLIS = Instant.parse("2026-03-01T12:00:00.100Z");
  private static final UserId U1 = new UserId("u-1");

  private final JwtSignedTokenCodec codec =
      new JwtSignedTokenCodec(JWT_SECRET, "test-issuer", Clock.fixed(NOW_WITH_MILLIS, ZoneOffset.UTC));
  private final InMemoryPermissionLookup permissions = new InMemoryPermissionLookup(Map.of(U1, Set.of("read")));

  @Test
  void mint_subSecondClock_claimsMatchWhatDecodes() {
    AccessTokenFactory factory = new AccessTokenFactory(permissions, codec, Duration.ofMinutes(15),
        PermissionLookupFailurePolicy.GRANT_NONE);

    AccessToken token = factory.mint(U1, NOW_WITH_MILLIS);

    assertThat(codec.decode(token.token())).isEqualTo(token.claims());
    assertThat(token.claims().issuedAt()).isEqualTo(Instant.parse("2026-03-01T12:00:00Z"));
    assertThat(token.claims().expiresAt()).isEqualTo(Instant.parse("2026-03-01T12:15:00Z"));
  }

  @Test
  void mint_shortestTtl_decodesRightAfterIssue() {
    AccessTokenFactory factory = new AccessTokenFactory(permissions, codec, Duration.ofSeconds(1),
        PermissionLookupFailurePolicy.GRANT_NONE);

    AccessToken token = factory.mint(U1, NOW_WITH_MILLIS);

    assertThat(codec.decode(token.token()).permissions()).containsExactly("read");
  }

  @Test
  void subSecondTtl_isRejected() {
    assertThatThrownBy(() -> new SessionIssuerConfig(Duration.ofMillis(500), 128,
        PermissionLookupFailurePolicy.GRANT_NONE))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SessionIssuerConfig(Duration.ofMillis(1500), 128,
        PermissionLookupFailurePolicy.GRANT_NONE))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new AccessTokenFactory(permissions, codec, Duration.ofMillis(500),
        PermissionLookupFailurePolicy.GRANT_NONE))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatCode(() -> new SessionIssuerConfig(Duration.ofSeconds(1), 128,
        PermissionLookupFailurePolicy.GRANT_NONE))
        .doesNotThrowAnyException();
  }
}
