package com.example.detectionledger.core.pipeline;

import com.example.detectionledger.core.detection.InferenceResult;
import java.io.IOException;

/**
 * Detection model seen from the pipeline. Implementations are found with {@link
 * java.util.ServiceLoader} by the application.
 */
public interface InferenceClient {

  /**
   * Runs the model on one image.
   *
   * @param image image to scan
   * @return the detections, possibly none
   * @throws IOException if the image cannot be read
   */
  InferenceResult detect(ImageRef image) throws IOException;

  /** Identifier recorded as the run's model. */
  String modelName();
}
