package com.example.detectionledger.core.credentials;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.detectionledger.core.ConfigurationException;
import org.junit.jupiter.api.*;

public class SecretHelperTest {

  private static final String SECRET_JSON =
      """
      {
        "username": "ledger",
        "password": "s3cr3t",
        "engine": "postgres",
        "host": "db.internal",
        "port": 6432,
        "dbname": "detections",
        "dbInstanceIdentifier": "ignored"
      }
      """;

  @Test
  @DisplayName("Should read an RDS-style secret and ignore unknown fields")
  void parsesRdsSecret() {
    final var secret = SecretHelper.parse(SECRET_JSON);

    assertEquals("ledger", secret.username());
    assertEquals("s3cr3t", secret.password());
    assertEquals("db.internal", secret.host());
    assertEquals(6432, secret.port());
    assertEquals("detections", secret.dbname());
    assertFalse(secret.toString().contains("s3cr3t"));
  }

  @Test
  @DisplayName("Should require host, username and password")
  void rejectsIncompleteSecret() {
    assertThrows(
        ConfigurationException.class,
        () -> SecretHelper.parse("{\"username\": \"ledger\", \"host\": \"db\"}"));
  }

  @Test
  @DisplayName("Should reject a secret that is not JSON")
  void rejectsNonJson() {
    assertThrows(ConfigurationException.class, () -> SecretHelper.parse("user=ledger"));
  }

  @Test
  @DisplayName("Should wrap provider failures in ConfigurationException")
  void wrapsProviderFailure() {
    final var provider = mock(SecretsManagerProvider.class);
    final var cause = new RuntimeException("access denied");
    when(provider.getSecret("db/secret")).thenThrow(cause);

    final var thrown =
        assertThrows(
            ConfigurationException.class, () -> SecretHelper.getDbSecret(provider, "db/secret"));
    assertSame(cause, thrown.getCause());
  }

  @Test
  @DisplayName("Should fetch and parse through the provider")
  void fetchesThroughProvider() {
    final var provider = mock(SecretsManagerProvider.class);
    when(provider.getSecret("db/secret")).thenReturn(SECRET_JSON);

    assertEquals("db.internal", SecretHelper.getDbSecret(provider, "db/secret").host());
  }
}
