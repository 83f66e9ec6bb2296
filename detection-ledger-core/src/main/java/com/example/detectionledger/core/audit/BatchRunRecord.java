package com.example.detectionledger.core.audit;

import java.time.OffsetDateTime;

/**
 * Terminal outcome of a run as stored in {@code batch_run_information}. {@code errorCode} is null
 * exactly when the run succeeded.
 */
public record BatchRunRecord(
    String runId,
    OffsetDateTime startTime,
    OffsetDateTime endTime,
    String model,
    boolean success,
    String errorCode) {

  public BatchRunRecord {
    if (success && errorCode != null)
      throw new IllegalArgumentException("a successful run has no error code");
    if (!success && errorCode == null)
      throw new IllegalArgumentException("a failed run needs an error code");
  }

  public static BatchRunRecord succeeded(final RunMetadata run, final OffsetDateTime endTime) {
    return new BatchRunRecord(run.runId(), run.startTime(), endTime, run.model(), true, null);
  }

  /**
   * Failure record whose error code is the error's string form.
   *
   * @param run the failed run
   * @param endTime when the failure was observed
   * @param error what made the run fail
   * @return the record to insert
   */
  public static BatchRunRecord failed(
      final RunMetadata run, final OffsetDateTime endTime, final Throwable error) {
    return new BatchRunRecord(
        run.runId(), run.startTime(), endTime, run.model(), false, String.valueOf(error));
  }
}
