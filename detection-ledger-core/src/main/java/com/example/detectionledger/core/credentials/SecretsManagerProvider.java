package com.example.detectionledger.core.credentials;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

/**
 * Lazily configured AWS Secrets Manager client used to read static database logins.
 *
 * <p>Configuration can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 *   <li>aws.sm.cache.ttl.millis / AWS_SM_CACHE_TTL_MILLIS (optional, default 0 = disabled)
 * </ul>
 */
public class SecretsManagerProvider implements AutoCloseable {

  private final ConcurrentHashMap<String, CacheEntry> cache = new ConcurrentHashMap<>();
  private final long ttlMillis;
  private final Clock clock;
  private SecretsManagerClient client;

  public SecretsManagerProvider() {
    this(initTtlMillis(), Clock.systemUTC());
  }

  public SecretsManagerProvider(final long ttlMillis, final Clock clock) {
    this.ttlMillis = Math.max(0L, ttlMillis);
    this.clock = Optional.ofNullable(clock).orElse(Clock.systemUTC());
  }

  /** Creates a provider around an existing client, which {@link #close()} closes. */
  SecretsManagerProvider(final SecretsManagerClient client, final long ttlMillis, final Clock clock) {
    this(ttlMillis, clock);
    this.client = client;
  }

  private static long initTtlMillis() {
    return setting("aws.sm.cache.ttl.millis", "AWS_SM_CACHE_TTL_MILLIS")
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .flatMap(
            val -> {
              try {
                return Optional.of(Long.parseLong(val));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            })
        .orElse(0L);
  }

  private static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)));
  }

  private static SecretsManagerClient buildClient() {
    final var builder = SecretsManagerClient.builder();

    builder.region(
        setting("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1));

    setting("aws.sm.endpoint", "AWS_SM_ENDPOINT")
        .map(URI::create)
        .ifPresent(builder::endpointOverride);

    setting("aws.accessKeyId", "AWS_ACCESS_KEY_ID")
        .flatMap(
            accessKey ->
                setting("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY")
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .map(StaticCredentialsProvider::create)
        .ifPresentOrElse(
            builder::credentialsProvider,
            () -> builder.credentialsProvider(DefaultCredentialsProvider.create()));

    return builder.build();
  }

  private synchronized SecretsManagerClient getClient() {
    return Optional.ofNullable(client).orElseGet(() -> client = buildClient());
  }

  /**
   * Retrieves the raw secret string, from the cache when a TTL is configured.
   *
   * @param secretId the Secrets Manager secret ID or name
   * @return the secret string as stored in Secrets Manager
   */
  public String getSecret(final String secretId) {
    if (ttlMillis == 0) return fetchSecret(secretId);

    final var now = Instant.now(clock).toEpochMilli();
    return Optional.ofNullable(cache.get(secretId))
        .filter(cached -> cached.expiresAtMillis() >= now)
        .map(CacheEntry::secretString)
        .orElseGet(
            () -> {
              final var secret = fetchSecret(secretId);
              cache.put(secretId, new CacheEntry(secret, now + ttlMillis));
              return secret;
            });
  }

  /** Clears the in-memory cache. */
  public void resetCache() {
    cache.clear();
  }

  private String fetchSecret(final String secretId) {
    final var request = GetSecretValueRequest.builder().secretId(secretId).build();
    return getClient().getSecretValue(request).secretString();
  }

  @Override
  public synchronized void close() {
    if (client != null) client.close();
    client = null;
    cache.clear();
  }

  private record CacheEntry(String secretString, long expiresAtMillis) {}
}
