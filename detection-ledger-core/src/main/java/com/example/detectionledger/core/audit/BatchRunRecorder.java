package com.example.detectionledger.core.audit;

import static java.lang.System.Logger.Level.*;

import com.example.detectionledger.core.ConfigurationException;
import com.example.detectionledger.core.RecordingException;
import com.example.detectionledger.core.jdbc.SessionManager;
import java.lang.System.Logger;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a job and leaves a failure record in {@code batch_run_information} when it throws.
 *
 * <p>The error that escaped the job is always the one the caller sees. When the failure record
 * cannot be written, that secondary error is logged as a {@link RecordingException} and attached
 * to the job's error as a suppressed exception. Successful runs write nothing here; the caller
 * records success once its own bookkeeping is done.
 *
 * <pre>{@code
 * var recorder = BatchRunRecorder.builder()
 *     .metadata(new RunMetadata(runId, OffsetDateTime.now(), "yolov8n.pt", true))
 *     .sessions(sessions)
 *     .build();
 * var summary = recorder.run(() -> orchestrator.run(images));
 * }</pre>
 */
public final class BatchRunRecorder {

  private static final Logger logger = System.getLogger(BatchRunRecorder.class.getName());

  private final RunMetadata metadata;
  private final SessionManager sessions;
  private final BatchRunRepository repository;
  private final Clock clock;
  private final AtomicReference<RunState> state = new AtomicReference<>(RunState.NOT_STARTED);

  private BatchRunRecorder(final Builder builder) {
    this.metadata = builder.metadata;
    this.sessions = builder.sessions;
    this.repository = builder.repository;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Body of a run. */
  @FunctionalInterface
  public interface Job<T, E extends Exception> {
    T run() throws E;
  }

  /** Builder for {@link BatchRunRecorder}. */
  public static class Builder {
    private RunMetadata metadata;
    private SessionManager sessions;
    private BatchRunRepository repository = new BatchRunRepository();
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Sets the run being recorded (required).
     *
     * @param metadata run identity and reporting flag
     * @return this builder
     */
    public Builder metadata(final RunMetadata metadata) {
      this.metadata = metadata;
      return this;
    }

    /**
     * Sets where failure records are written. Required when the run requires reporting.
     *
     * @param sessions open session manager, or null when running without a database
     * @return this builder
     */
    public Builder sessions(final SessionManager sessions) {
      this.sessions = sessions;
      return this;
    }

    public Builder repository(final BatchRunRepository repository) {
      this.repository = repository;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Validates the configuration before any work starts.
     *
     * @return the recorder
     * @throws IllegalStateException if metadata is not set
     * @throws ConfigurationException if reporting is required and no sessions are configured
     */
    public BatchRunRecorder build() {
      if (metadata == null) throw new IllegalStateException("metadata is required");
      if (repository == null) throw new IllegalStateException("repository is required");
      if (clock == null) throw new IllegalStateException("clock is required");
      if (metadata.reportingRequired() && sessions == null)
        throw new ConfigurationException(
            "Run " + metadata.runId() + " requires reporting but no database is configured");
      return new BatchRunRecorder(this);
    }
  }

  /**
   * Runs the job once.
   *
   * @param job body of the run
   * @param <T> result type
   * @param <E> checked exception type of the job
   * @return the job's result, unchanged
   * @throws E whatever the job threw, unchanged, after the failure record was attempted
   * @throws IllegalStateException if this recorder already ran a job
   */
  public <T, E extends Exception> T run(final Job<T, E> job) throws E {
    if (!state.compareAndSet(RunState.NOT_STARTED, RunState.RUNNING))
      throw new IllegalStateException("Run " + metadata.runId() + " already started");

    logger.log(INFO, "Run {0} started with model {1}", metadata.runId(), metadata.model());
    final T result;
    try {
      result = job.run();
    } catch (final Throwable t) {
      state.set(RunState.FAILED);
      recordFailure(t);
      throw t;
    }
    state.set(RunState.SUCCESS);
    logger.log(INFO, "Run {0} finished", metadata.runId());
    return result;
  }

  public RunState state() {
    return state.get();
  }

  public RunMetadata metadata() {
    return metadata;
  }

  private void recordFailure(final Throwable error) {
    logger.log(ERROR, "Run " + metadata.runId() + " failed", error);
    if (!metadata.reportingRequired() || sessions == null) {
      logger.log(DEBUG, "Reporting disabled for run {0}; no failure record written", metadata.runId());
      return;
    }

    final var record = BatchRunRecord.failed(metadata, OffsetDateTime.now(clock), error);
    try {
      sessions.inTransaction(
          conn -> {
            repository.insert(conn, record);
            return null;
          });
      logger.log(INFO, "Failure of run {0} recorded", metadata.runId());
    } catch (final Throwable secondary) {
      final var recording =
          new RecordingException(
              "Failed to record failure of run " + metadata.runId(), secondary);
      logger.log(ERROR, recording.getMessage(), recording);
      error.addSuppressed(recording);
    }
  }
}
