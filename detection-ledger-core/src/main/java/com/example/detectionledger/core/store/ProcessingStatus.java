package com.example.detectionledger.core.store;

/** Persisted state of a claimed image. An image with no row has not been claimed. */
public enum ProcessingStatus {
  IN_PROGRESS("in_progress"),
  PROCESSED("processed");

  private final String dbValue;

  ProcessingStatus(final String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public static ProcessingStatus fromDbValue(final String value) {
    for (final var status : values()) if (status.dbValue.equals(value)) return status;
    throw new IllegalArgumentException("Unknown processing status: " + value);
  }
}
