package com.example.detectionledger.core;

/**
 * A statement or the commit of a unit of work failed. The unit of work is rolled back and nothing
 * it wrote becomes visible.
 */
public class TransactionException extends LedgerException {

  public TransactionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
