package com.example.detectionledger.core.store;

/** How {@link JobStateStore#claim} treats an image that already has a status row. */
public enum ClaimPolicy {
  /**
   * Overwrite whatever is there. Two workers claiming the same image both succeed and the later
   * write wins; there is no lock and no lease.
   */
  LAST_WRITE_WINS,

  /**
   * Claim only images without a row. An existing row, in progress or processed, raises {@link
   * ClaimConflictException}.
   */
  EXCLUSIVE
}
