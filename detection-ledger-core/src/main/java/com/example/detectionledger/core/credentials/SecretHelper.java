package com.example.detectionledger.core.credentials;

import com.example.detectionledger.core.ConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/** Reads a {@link DbSecret} from AWS Secrets Manager and deserializes it with Jackson. */
public final class SecretHelper {

  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private SecretHelper() {}

  /**
   * Retrieves a database login and converts it into a {@link DbSecret}.
   *
   * @param provider Secrets Manager access
   * @param secretId the identifier/name of the secret
   * @return the parsed {@link DbSecret}
   * @throws ConfigurationException if the secret cannot be fetched or parsed
   */
  public static DbSecret getDbSecret(final SecretsManagerProvider provider, final String secretId) {
    try {
      return parse(provider.getSecret(secretId));
    } catch (final ConfigurationException e) {
      throw e;
    } catch (final Exception e) {
      throw new ConfigurationException("Failed to load DB secret " + secretId, e);
    }
  }

  static DbSecret parse(final String json) {
    try {
      final var secret = MAPPER.readValue(json, DbSecret.class);
      if (secret.host() == null || secret.username() == null || secret.password() == null)
        throw new ConfigurationException("DB secret must contain host, username and password");
      return secret;
    } catch (final IOException e) {
      throw new ConfigurationException("DB secret is not valid JSON", e);
    }
  }
}
