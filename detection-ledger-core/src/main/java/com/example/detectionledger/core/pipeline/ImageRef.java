package com.example.detectionledger.core.pipeline;

import com.example.detectionledger.core.store.ImageKey;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One image to process: its ledger key and where its bytes are.
 *
 * @param key ledger identity of the image
 * @param path location of the image file
 */
public record ImageRef(ImageKey key, Path path) {

  public ImageRef {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(path, "path");
  }
}
