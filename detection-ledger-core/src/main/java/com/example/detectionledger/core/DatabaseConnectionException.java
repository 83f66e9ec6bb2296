package com.example.detectionledger.core;

/** Pool creation or connection acquisition failed. Never retried automatically. */
public class DatabaseConnectionException extends LedgerException {

  public DatabaseConnectionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
