package com.example.detectionledger.core.pipeline;

/**
 * Finite sequence of one customer's images. Iteration may be lazy; it is traversed once per run.
 */
public interface ImageSource extends Iterable<ImageRef> {

  /** Customer whose images this source yields. */
  String customer();
}
