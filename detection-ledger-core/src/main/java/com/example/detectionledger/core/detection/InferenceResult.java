package com.example.detectionledger.core.detection;

import java.util.List;

/**
 * What the detection model returned for one image. An empty detection list is a valid outcome and
 * is recorded as a negative result; a failed inference throws instead of returning.
 *
 * @param imageWidth width of the original image in pixels
 * @param imageHeight height of the original image in pixels
 * @param detections detected objects, possibly empty
 */
public record InferenceResult(int imageWidth, int imageHeight, List<Detection> detections) {

  public InferenceResult {
    if (imageWidth <= 0 || imageHeight <= 0)
      throw new IllegalArgumentException(
          "image size must be positive, was %dx%d".formatted(imageWidth, imageHeight));
    detections = detections == null ? List.of() : List.copyOf(detections);
  }

  public static InferenceResult empty(final int imageWidth, final int imageHeight) {
    return new InferenceResult(imageWidth, imageHeight, List.of());
  }

  /** Detections worth recording: those whose box covers at least one pixel. */
  public List<Detection> recordable() {
    return detections.stream().filter(d -> d.box().hasPositiveArea()).toList();
  }
}
