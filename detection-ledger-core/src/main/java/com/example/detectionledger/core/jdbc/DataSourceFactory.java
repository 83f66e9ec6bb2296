package com.example.detectionledger.core.jdbc;

import javax.sql.DataSource;

/**
 * Creates a {@link DataSource} from resolved connection parameters. Implementations typically
 * configure a connection pool; a pool that is {@link AutoCloseable} is closed when it is retired.
 */
@FunctionalInterface
public interface DataSourceFactory {
  /**
   * Creates a new {@link DataSource} for the given parameters.
   *
   * @param descriptor resolved host, database and login
   * @return a new {@link DataSource}
   */
  DataSource create(final ConnectionDescriptor descriptor);
}
