package com.codeheadsystems.tessera.dropwizard;

import com.codeheadsystems.tessera.server.manager.PermissionLookupFailurePolicy;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Dropwizard configuration for the tessera session issuer.
 * <p>
 * For production, supply {@code jwtSecretHex} (a hex-encoded random value of at least 32 bytes)
 * so that access tokens survive restarts and verify on every node. Omitting it causes a random
 * secret on each startup (dev/test only).
 * <p>
 * Generate the secret with: {@code openssl rand -hex 32}
 */
public class TesseraConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for access tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * Issuer claim written into and required of every access token.
   */
  @NotEmpty
  private String jwtIssuer = "tessera";

  /**
   * Access token time-to-live in seconds.
   */
  @Min(1)
  private long accessTokenTtlSeconds = 900;

  /**
   * Strength of each session secret in bits.
   */
  @Min(128)
  private int sessionSecretBits = 256;

  /**
   * Argon2id memory cost in kibibytes. 0 switches to an unsalted SHA-256 digest (dev only).
   */
  @Min(0)
  private int argon2MemoryKib = 65536;

  /**
   * Argon2id iteration count. Ignored when argon2MemoryKib == 0.
   */
  @Min(1)
  private int argon2Iterations = 3;

  /**
   * Argon2id parallelism. Ignored when argon2MemoryKib == 0.
   */
  @Min(1)
  private int argon2Parallelism = 1;

  /**
   * What to do when the permission source cannot be consulted while minting an access token.
   */
  @NotNull
  private PermissionLookupFailurePolicy permissionLookupFailurePolicy = PermissionLookupFailurePolicy.GRANT_NONE;

  /**
   * Size of the managed pool that runs asynchronous session opens.
   */
  @Min(1)
  private int hashingThreads = 4;

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets access token ttl seconds.
   *
   * @return the access token ttl seconds
   */
  @JsonProperty
  public long getAccessTokenTtlSeconds() {
    return accessTokenTtlSeconds;
  }

  /**
   * Sets access token ttl seconds.
   *
   * @param accessTokenTtlSeconds the access token ttl seconds
   */
  @JsonProperty
  public void setAccessTokenTtlSeconds(long accessTokenTtlSeconds) {
    this.accessTokenTtlSeconds = accessTokenTtlSeconds;
  }

  /**
   * Gets session secret bits.
   *
   * @return the session secret bits
   */
  @JsonProperty
  public int getSessionSecretBits() {
    return sessionSecretBits;
  }

  /**
   * Sets session secret bits.
   *
   * @param sessionSecretBits the session secret bits
   */
  @JsonProperty
  public void setSessionSecretBits(int sessionSecretBits) {
    this.sessionSecretBits = sessionSecretBits;
  }

  /**
   * Gets argon 2 memory kib.
   *
   * @return the argon 2 memory kib
   */
  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  /**
   * Sets argon 2 memory kib.
   *
   * @param argon2MemoryKib the argon 2 memory kib
   */
  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  /**
   * Gets argon 2 iterations.
   *
   * @return the argon 2 iterations
   */
  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  /**
   * Sets argon 2 iterations.
   *
   * @param argon2Iterations the argon 2 iterations
   */
  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  /**
   * Gets argon 2 parallelism.
   *
   * @return the argon 2 parallelism
   */
  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  /**
   * Sets argon 2 parallelism.
   *
   * @param argon2Parallelism the argon 2 parallelism
   */
  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  /**
   * Gets permission lookup failure policy.
   *
   * @return the permission lookup failure policy
   */
  @JsonProperty
  public PermissionLookupFailurePolicy getPermissionLookupFailurePolicy() {
    return permissionLookupFailurePolicy;
  }

  /**
   * Sets permission lookup failure policy.
   *
   * @param permissionLookupFailurePolicy the permission lookup failure policy
   */
  @JsonProperty
  public void setPermissionLookupFailurePolicy(PermissionLookupFailurePolicy permissionLookupFailurePolicy) {
    this.permissionLookupFailurePolicy = permissionLookupFailurePolicy;
  }

  /**
   * Gets hashing threads.
   *
   * @return the hashing threads
   */
  @JsonProperty
  public int getHashingThreads() {
    return hashingThreads;
  }

  /**
   * Sets hashing threads.
   *
   * @param hashingThreads the hashing threads
   */
  @JsonProperty
  public void setHashingThreads(int hashingThreads) {
    this.hashingThreads = hashingThreads;
  }
}
