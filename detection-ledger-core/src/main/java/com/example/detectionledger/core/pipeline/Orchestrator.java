package com.example.detectionledger.core.pipeline;

import static java.lang.System.Logger.Level.*;

import com.example.detectionledger.core.ConfigurationException;
import com.example.detectionledger.core.audit.BatchRunRecord;
import com.example.detectionledger.core.audit.BatchRunRepository;
import com.example.detectionledger.core.audit.RunMetadata;
import com.example.detectionledger.core.detection.InferenceResult;
import com.example.detectionledger.core.jdbc.SessionManager;
import com.example.detectionledger.core.store.ClaimConflictException;
import com.example.detectionledger.core.store.CompletedImage;
import com.example.detectionledger.core.store.ImageKey;
import com.example.detectionledger.core.store.JobStateStore;
import com.example.detectionledger.core.store.ProcessingStatus;
import java.io.IOException;
import java.lang.System.Logger;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Drives one run over an {@link ImageSource}.
 *
 * <p>With resumability on, each image goes through claim, inference and completion:
 *
 * <ol>
 *   <li>images already {@code processed} for the customer are skipped;
 *   <li>the image is claimed in its own unit of work;
 *   <li>the model runs outside any transaction;
 *   <li>the detection rows and the {@code processed} status are written in one unit of work.
 * </ol>
 *
 * <p>A failure between the claim and the completion leaves the image {@code in_progress}; the next
 * resumable run processes it again. Without resumability the model runs over every image and
 * nothing is written per image.
 *
 * <p>When the run requires reporting, a success record is written after the last image. Failure
 * records are the job of {@link com.example.detectionledger.core.audit.BatchRunRecorder}.
 */
public final class Orchestrator {

  private static final Logger logger = System.getLogger(Orchestrator.class.getName());

  private final SessionManager sessions;
  private final JobStateStore store;
  private final BatchRunRepository runRepository;
  private final InferenceClient inference;
  private final RunMetadata metadata;
  private final boolean resumable;
  private final Clock clock;

  private Orchestrator(final Builder builder) {
    this.sessions = builder.sessions;
    this.store = builder.store;
    this.runRepository = builder.runRepository;
    this.inference = builder.inference;
    this.metadata = builder.metadata;
    this.resumable = builder.resumable;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link Orchestrator}. */
  public static class Builder {
    private SessionManager sessions;
    private JobStateStore store = new JobStateStore();
    private BatchRunRepository runRepository = new BatchRunRepository();
    private InferenceClient inference;
    private RunMetadata metadata;
    private boolean resumable = true;
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    public Builder sessions(final SessionManager sessions) {
      this.sessions = sessions;
      return this;
    }

    public Builder store(final JobStateStore store) {
      this.store = store;
      return this;
    }

    public Builder runRepository(final BatchRunRepository runRepository) {
      this.runRepository = runRepository;
      return this;
    }

    public Builder inference(final InferenceClient inference) {
      this.inference = inference;
      return this;
    }

    public Builder metadata(final RunMetadata metadata) {
      this.metadata = metadata;
      return this;
    }

    /**
     * Whether per-image state is tracked so an interrupted run can be resumed.
     *
     * <p>Default: true
     *
     * @param resumable false for evaluation runs that leave no per-image rows
     * @return this builder
     */
    public Builder resumable(final boolean resumable) {
      this.resumable = resumable;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @return the orchestrator
     * @throws IllegalStateException if a required collaborator is missing
     * @throws ConfigurationException if the run needs a database and none is configured
     */
    public Orchestrator build() {
      if (inference == null) throw new IllegalStateException("inference is required");
      if (metadata == null) throw new IllegalStateException("metadata is required");
      if (store == null) throw new IllegalStateException("store is required");
      if (runRepository == null) throw new IllegalStateException("runRepository is required");
      if (clock == null) throw new IllegalStateException("clock is required");
      if (sessions == null && (resumable || metadata.reportingRequired()))
        throw new ConfigurationException(
            "Run " + metadata.runId() + " tracks state but no database is configured");
      return new Orchestrator(this);
    }
  }

  /**
   * Processes every image of the source.
   *
   * @param source images of one customer
   * @return counts for the run
   * @throws IOException if the model cannot read an image
   */
  public RunSummary run(final ImageSource source) throws IOException {
    final Set<CompletedImage> done =
        resumable ? completedImages(source.customer()) : Set.of();
    logger.log(
        INFO,
        "Run {0}: {1} images of {2} already processed",
        metadata.runId(), done.size(), source.customer());

    int seen = 0, skipped = 0, contended = 0, processed = 0, positive = 0, negative = 0;
    for (final var image : source) {
      seen++;
      final var key = image.key();
      if (done.contains(new CompletedImage(key.uploadDate(), key.filename()))) {
        skipped++;
        logger.log(DEBUG, "Skipping processed image {0}", key);
        continue;
      }

      if (resumable && !claim(key)) {
        contended++;
        continue;
      }

      final var result = inference.detect(image);
      if (resumable) record(key, result);

      processed++;
      if (result.recordable().isEmpty()) negative++;
      else positive++;
    }

    final var summary = new RunSummary(seen, skipped, contended, processed, positive, negative);
    if (metadata.reportingRequired()) recordSuccess();
    logger.log(INFO, "Run {0} done: {1}", metadata.runId(), summary);
    return summary;
  }

  private Set<CompletedImage> completedImages(final String customer) {
    return sessions.inTransaction(
        conn -> store.queryCompleted(conn, customer, EnumSet.of(ProcessingStatus.PROCESSED)));
  }

  private boolean claim(final ImageKey key) {
    try {
      sessions.inTransaction(
          conn -> {
            store.claim(conn, key);
            return null;
          });
      return true;
    } catch (final ClaimConflictException e) {
      logger.log(
          INFO,
          "Skipping {0}: already claimed ({1})",
          key, e.existing().map(ProcessingStatus::dbValue).orElse("unknown"));
      return false;
    }
  }

  private void record(final ImageKey key, final InferenceResult result) {
    final int rows =
        sessions.inTransaction(
            conn -> {
              final var written = store.recordDetection(conn, key, metadata.runId(), result);
              store.complete(conn, key);
              return written;
            });
    logger.log(DEBUG, "Recorded {0} detection rows for {1}", rows, key);
  }

  private void recordSuccess() {
    final var record = BatchRunRecord.succeeded(metadata, OffsetDateTime.now(clock));
    sessions.inTransaction(
        conn -> {
          runRepository.insert(conn, record);
          return null;
        });
  }
}
