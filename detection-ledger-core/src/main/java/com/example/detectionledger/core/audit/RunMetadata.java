package com.example.detectionledger.core.audit;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Identity of one run of the batch pipeline.
 *
 * @param runId identifier assigned by the scheduler that launched the run
 * @param startTime when the run started
 * @param model identifier of the detection model, usually the weights file name
 * @param reportingRequired whether the run must leave an audit record in the database
 */
public record RunMetadata(
    String runId, OffsetDateTime startTime, String model, boolean reportingRequired) {

  public RunMetadata {
    if (runId == null || runId.isBlank()) throw new IllegalArgumentException("runId is required");
    if (model == null || model.isBlank()) throw new IllegalArgumentException("model is required");
    Objects.requireNonNull(startTime, "startTime");
  }

  /**
   * Model identifier for a weights file: its file name without directories.
   *
   * @param weights path to the model weights
   * @return the file name
   */
  public static String modelName(final Path weights) {
    final var name = weights.getFileName();
    if (name == null) throw new IllegalArgumentException("weights path has no file name: " + weights);
    return name.toString();
  }
}
