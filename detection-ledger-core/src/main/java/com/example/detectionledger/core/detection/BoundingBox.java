package com.example.detectionledger.core.detection;

/**
 * Axis-aligned box in pixel coordinates of the original image, corners {@code (x1, y1)} top-left
 * and {@code (x2, y2)} bottom-right.
 */
public record BoundingBox(double x1, double y1, double x2, double y2) {

  /** Whether the box covers any pixels; degenerate boxes are not recorded. */
  public boolean hasPositiveArea() {
    return x2 > x1 && y2 > y1;
  }

  /**
   * Converts to YOLO-style normalized centre coordinates.
   *
   * @param imageWidth image width in pixels
   * @param imageHeight image height in pixels
   * @return centre x, centre y, width and height, each divided by the image size
   */
  public NormalizedBox normalize(final int imageWidth, final int imageHeight) {
    return new NormalizedBox(
        (x1 + x2) / 2.0 / imageWidth,
        (y1 + y2) / 2.0 / imageHeight,
        (x2 - x1) / imageWidth,
        (y2 - y1) / imageHeight);
  }

  /** Box relative to the image size, centre based. */
  public record NormalizedBox(double x, double y, double w, double h) {}
}
