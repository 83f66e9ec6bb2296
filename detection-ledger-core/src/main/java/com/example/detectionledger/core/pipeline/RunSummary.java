package com.example.detectionledger.core.pipeline;

/**
 * Counts for one orchestrated run.
 *
 * @param seen images yielded by the source
 * @param skipped images already processed by an earlier run
 * @param contended images another worker held when an exclusive claim was attempted
 * @param processed images run through the model
 * @param positive processed images with at least one recorded detection
 * @param negative processed images with none
 */
public record RunSummary(
    int seen, int skipped, int contended, int processed, int positive, int negative) {

  @Override
  public String toString() {
    return "seen=%d skipped=%d contended=%d processed=%d positive=%d negative=%d"
        .formatted(seen, skipped, contended, processed, positive, negative);
  }
}
