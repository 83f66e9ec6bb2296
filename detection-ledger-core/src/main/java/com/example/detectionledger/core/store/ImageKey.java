package com.example.detectionledger.core.store;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Identity of one uploaded image.
 *
 * @param customer customer the image belongs to
 * @param uploadDate day the image was uploaded
 * @param filename file name within that day's upload
 */
public record ImageKey(String customer, LocalDate uploadDate, String filename) {

  public ImageKey {
    Objects.requireNonNull(customer, "customer");
    Objects.requireNonNull(uploadDate, "uploadDate");
    Objects.requireNonNull(filename, "filename");
  }

  @Override
  public String toString() {
    return customer + "/" + uploadDate + "/" + filename;
  }
}
