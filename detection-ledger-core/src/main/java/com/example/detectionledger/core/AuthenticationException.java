package com.example.detectionledger.core;

/** The identity backend refused or failed to issue a database token. */
public class AuthenticationException extends LedgerException {

  public AuthenticationException(final String message) {
    super(message);
  }

  public AuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
