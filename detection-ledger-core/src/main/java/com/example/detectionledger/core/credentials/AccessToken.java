package com.example.detectionledger.core.credentials;

import java.time.Instant;
import java.util.Objects;

/**
 * Short-lived bearer credential used in place of a database password. Held in memory only.
 *
 * @param value the token presented as the connection password
 * @param expiresAt absolute instant after which the identity backend rejects the token
 */
public record AccessToken(String value, Instant expiresAt) {

  public AccessToken {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  @Override
  public String toString() {
    return "AccessToken[value=****, expiresAt=" + expiresAt + "]";
  }
}
