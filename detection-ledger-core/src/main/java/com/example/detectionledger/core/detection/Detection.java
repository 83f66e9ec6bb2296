package com.example.detectionledger.core.detection;

import java.util.Objects;

/**
 * One object found by the detection model.
 *
 * @param classId model class index
 * @param box location in pixel coordinates
 * @param confidence model confidence in {@code [0, 1]}
 */
public record Detection(int classId, BoundingBox box, double confidence) {

  public Detection {
    Objects.requireNonNull(box, "box");
  }
}
