package com.codeheadsystems.tessera.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tessera.server.auth.SignedTokenCodec;
import com.codeheadsystems.tessera.server.exceptions.TesseraException;
import com.codeheadsystems.tessera.server.model.AccessTokenClaims;
import com.codeheadsystems.tessera.server.model.UserId;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Health check that signs a probe token and verifies it back with the configured key.
 */
public class SigningKeyHealthCheck extends HealthCheck {

  private static final UserId PROBE_USER = new UserId("tessera-health-probe");

  private final SignedTokenCodec signedTokenCodec;
  private final Clock clock;

  /**
   * Instantiates a new Signing key health check.
   *
   * @param signedTokenCodec the codec under check
   * @param clock            the clock the codec validates against
   */
  public SigningKeyHealthCheck(SignedTokenCodec signedTokenCodec, Clock clock) {
    this.signedTokenCodec = signedTokenCodec;
    this.clock = clock;
  }

  @Override
  protected Result check() {
    Instant now = clock.instant();
    AccessTokenClaims probe = new AccessTokenClaims(PROBE_USER, Set.of(), now, now.plus(Duration.ofMinutes(1)));
    try {
      AccessTokenClaims decoded = signedTokenCodec.decode(signedTokenCodec.encode(probe));
      if (!PROBE_USER.equals(decoded.userId())) {
        return Result.unhealthy("Probe token decoded to a different subject");
      }
    } catch (TesseraException e) {
      return Result.unhealthy(e);
    }
    return Result.healthy("signing key round-trip ok");
  }
}
