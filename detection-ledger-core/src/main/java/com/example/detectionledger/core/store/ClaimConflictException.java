package com.example.detectionledger.core.store;

import com.example.detectionledger.core.LedgerException;
import java.util.Optional;

/** An exclusive claim found the image already claimed or processed. */
public class ClaimConflictException extends LedgerException {

  private final transient ImageKey key;
  private final ProcessingStatus existing;

  /**
   * @param key image that could not be claimed
   * @param existing status found on the image, or null if another worker's insert won a race
   */
  public ClaimConflictException(final ImageKey key, final ProcessingStatus existing) {
    super(
        "Image %s is already %s"
            .formatted(key, existing == null ? "claimed" : existing.dbValue()));
    this.key = key;
    this.existing = existing;
  }

  public ImageKey key() {
    return key;
  }

  public Optional<ProcessingStatus> existing() {
    return Optional.ofNullable(existing);
  }
}
