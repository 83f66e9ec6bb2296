package com.example.detectionledger.core.credentials;

import static java.lang.System.Logger.Level.*;

import com.example.detectionledger.core.AuthRenewalException;
import com.example.detectionledger.core.AuthenticationException;
import java.lang.System.Logger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches a database token and renews it before it expires.
 *
 * <p>A token counts as valid while {@code now < expiresAt - renewalMargin}. Callers that need a
 * session ask for {@link #currentToken()}, which renews synchronously when the cached token is no
 * longer valid. Renewal is serialized: threads that observe an invalid token while another thread
 * is renewing wait for that renewal and reuse its result.
 *
 * <pre>{@code
 * var provider = CredentialProvider.builder()
 *     .tokenSource(new AzureCliTokenSource())
 *     .identity(clientId)
 *     .renewalMargin(Duration.ofMinutes(5))
 *     .build();
 *
 * var password = provider.currentToken().value();
 * }</pre>
 */
public final class CredentialProvider {

  public static final Duration DEFAULT_RENEWAL_MARGIN = Duration.ofMinutes(5);

  private static final Logger logger = System.getLogger(CredentialProvider.class.getName());

  private final TokenSource tokenSource;
  private final String identity;
  private final Duration renewalMargin;
  private final Clock clock;

  private final ReentrantLock renewalLock = new ReentrantLock();
  private final AtomicLong acquisitions = new AtomicLong();
  private volatile AccessToken token;

  private CredentialProvider(final Builder builder) {
    this.tokenSource = builder.tokenSource;
    this.identity = builder.identity;
    this.renewalMargin = builder.renewalMargin;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link CredentialProvider}. */
  public static class Builder {
    private TokenSource tokenSource;
    private String identity;
    private Duration renewalMargin = DEFAULT_RENEWAL_MARGIN;
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Sets the identity backend (required).
     *
     * @param tokenSource backend issuing tokens
     * @return this builder
     */
    public Builder tokenSource(final TokenSource tokenSource) {
      this.tokenSource = tokenSource;
      return this;
    }

    /**
     * Sets the identity reference passed to the backend (required).
     *
     * @param identity client id of the managed identity
     * @return this builder
     */
    public Builder identity(final String identity) {
      this.identity = identity;
      return this;
    }

    /**
     * Sets how long before the real expiry a token stops counting as valid.
     *
     * <p>Default: 5 minutes
     *
     * @param renewalMargin safety margin before expiry
     * @return this builder
     */
    public Builder renewalMargin(final Duration renewalMargin) {
      this.renewalMargin = renewalMargin;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    public CredentialProvider build() {
      if (tokenSource == null) throw new IllegalStateException("tokenSource is required");
      if (identity == null || identity.isBlank())
        throw new IllegalStateException("identity is required");
      if (renewalMargin == null || renewalMargin.isNegative())
        throw new IllegalArgumentException("renewalMargin must be non-negative");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      return new CredentialProvider(this);
    }
  }

  /**
   * Fetches a new token from the backend unconditionally and caches it.
   *
   * @return the new token
   * @throws AuthenticationException if the backend fails
   */
  public AccessToken acquire() {
    renewalLock.lock();
    try {
      return fetch();
    } finally {
      renewalLock.unlock();
    }
  }

  /**
   * Checks the cached token against the clock.
   *
   * @return true iff a token is cached and is outside the renewal margin
   */
  public boolean isValid() {
    return isValid(clock.instant());
  }

  /**
   * Checks the cached token against the given instant.
   *
   * @param now instant to evaluate at
   * @return true iff a token is cached and {@code now < expiresAt - renewalMargin}
   */
  public boolean isValid(final Instant now) {
    return isValid(token, now);
  }

  /**
   * Returns the cached token, renewing it first if it is missing or inside the renewal margin.
   *
   * @return a token valid at the time of the call
   * @throws AuthenticationException if no token was ever issued and the first acquisition fails
   * @throws AuthRenewalException if a previously issued token could not be renewed
   */
  public AccessToken currentToken() {
    final var cached = token;
    if (isValid(cached, clock.instant())) return cached;

    renewalLock.lock();
    try {
      final var afterWait = token;
      if (isValid(afterWait, clock.instant())) {
        logger.log(DEBUG, "Token renewed by another caller, reusing it");
        return afterWait;
      }
      if (afterWait == null) return fetch();

      logger.log(INFO, "Database token for identity {0} expires at {1}, renewing", identity,
          afterWait.expiresAt());
      try {
        final var renewed = fetch();
        logger.log(INFO, "Database token renewed");
        return renewed;
      } catch (final RuntimeException e) {
        logger.log(ERROR, "Failed to renew database token", e);
        throw new AuthRenewalException("Failed to renew database token for " + identity, e);
      }
    } finally {
      renewalLock.unlock();
    }
  }

  /** Drops the cached token so the next {@link #currentToken()} fetches a new one. */
  public void invalidate() {
    token = null;
  }

  /**
   * Number of successful backend acquisitions so far.
   *
   * @return acquisition count
   */
  public long acquisitionCount() {
    return acquisitions.get();
  }

  public Duration renewalMargin() {
    return renewalMargin;
  }

  private AccessToken fetch() {
    final var issued = tokenSource.acquire(identity);
    if (issued == null) throw new AuthenticationException("Token source returned no token");
    if (!isValid(issued, clock.instant())) {
      logger.log(WARNING, "Issued token already inside renewal margin (expires {0})",
          issued.expiresAt());
    }
    token = issued;
    acquisitions.incrementAndGet();
    return issued;
  }

  private boolean isValid(final AccessToken candidate, final Instant now) {
    return candidate != null && now.isBefore(candidate.expiresAt().minus(renewalMargin));
  }
}
