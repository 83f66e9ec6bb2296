package com.example.detectionledger.core.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import javax.sql.DataSource;

/** Builds a HikariCP pool for a {@link ConnectionDescriptor}. */
public final class HikariDataSourceFactory implements DataSourceFactory {

  private final int maximumPoolSize;
  private final Duration connectionTimeout;
  private final String sslMode;
  private final String poolName;

  /**
   * @param maximumPoolSize upper bound on open connections
   * @param connectionTimeout how long a caller waits for a connection before failing
   * @param sslMode PostgreSQL {@code sslmode}, or null to leave the driver default
   * @param poolName name shown in pool logs and metrics
   */
  public HikariDataSourceFactory(
      final int maximumPoolSize,
      final Duration connectionTimeout,
      final String sslMode,
      final String poolName) {
    this.maximumPoolSize = maximumPoolSize;
    this.connectionTimeout = connectionTimeout;
    this.sslMode = sslMode;
    this.poolName = poolName;
  }

  @Override
  public DataSource create(final ConnectionDescriptor descriptor) {
    final var config = new HikariConfig();
    config.setJdbcUrl(descriptor.jdbcUrl());
    config.setUsername(descriptor.username());
    config.setPassword(descriptor.password());
    config.setMaximumPoolSize(maximumPoolSize);
    config.setConnectionTimeout(connectionTimeout.toMillis());
    config.setPoolName(poolName);
    config.setAutoCommit(true);
    if (sslMode != null && !sslMode.isBlank()) config.addDataSourceProperty("sslmode", sslMode);
    return new HikariDataSource(config);
  }
}
