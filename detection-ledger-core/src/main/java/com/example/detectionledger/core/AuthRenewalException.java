package com.example.detectionledger.core;

/**
 * Renewing an expired or expiring token failed. Fatal for the unit of work that needed a fresh
 * session.
 */
public class AuthRenewalException extends AuthenticationException {

  public AuthRenewalException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
