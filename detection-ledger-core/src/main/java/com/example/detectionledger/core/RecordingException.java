package com.example.detectionledger.core;

/**
 * Writing a run audit record failed. Logged and attached as suppressed: the error that triggered
 * the audit write is what callers see.
 */
public class RecordingException extends LedgerException {

  public RecordingException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
