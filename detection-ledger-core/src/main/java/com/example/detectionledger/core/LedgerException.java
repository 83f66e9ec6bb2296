package com.example.detectionledger.core;

/** Base type for every failure raised by the detection ledger. */
public class LedgerException extends RuntimeException {

  public LedgerException(final String message) {
    super(message);
  }

  public LedgerException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
