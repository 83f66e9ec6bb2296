package com.example.detectionledger.core;

/**
 * Raised before any work starts when required settings are missing or invalid, for example when
 * run reporting is required but no database is configured.
 */
public class ConfigurationException extends LedgerException {

  public ConfigurationException(final String message) {
    super(message);
  }

  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
