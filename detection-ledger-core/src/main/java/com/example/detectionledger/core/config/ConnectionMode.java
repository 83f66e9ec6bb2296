package com.example.detectionledger.core.config;

import com.example.detectionledger.core.ConfigurationException;
import java.util.Arrays;
import java.util.Locale;

/** How the database login is obtained, selected with {@code ledger.db.mode}. */
public enum ConnectionMode {
  /** Username and password from settings. */
  STATIC("static"),
  /** Login read from an AWS Secrets Manager secret. */
  SECRETS_MANAGER("secrets-manager"),
  /** Token issued to an Azure managed identity, used as the password. */
  MANAGED_IDENTITY("managed-identity");

  private final String settingValue;

  ConnectionMode(final String settingValue) {
    this.settingValue = settingValue;
  }

  public String settingValue() {
    return settingValue;
  }

  static ConnectionMode parse(final String value) {
    final var normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(mode -> mode.settingValue.equals(normalized))
        .findFirst()
        .orElseThrow(
            () ->
                new ConfigurationException(
                    "Unknown ledger.db.mode '%s'; expected static, secrets-manager or managed-identity"
                        .formatted(value)));
  }
}
