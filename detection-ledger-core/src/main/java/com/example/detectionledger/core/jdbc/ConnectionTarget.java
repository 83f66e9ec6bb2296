package com.example.detectionledger.core.jdbc;

import java.util.Optional;

/**
 * Where and how to connect. Either a fixed login ({@link StaticCredentials}) or a login whose
 * password is a renewable token ({@link ManagedIdentity}).
 */
public interface ConnectionTarget {

  /**
   * Resolves the parameters needed to open connections right now.
   *
   * @return resolved connection parameters
   */
  ConnectionDescriptor resolve();

  /**
   * Re-resolves if the credential behind {@code current} is no longer usable.
   *
   * @param current parameters the pool was built with
   * @return new parameters when the credential changed, empty when {@code current} is still good
   */
  default Optional<ConnectionDescriptor> refresh(final ConnectionDescriptor current) {
    return Optional.empty();
  }
}
