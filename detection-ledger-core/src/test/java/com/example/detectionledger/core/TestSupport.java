package com.example.detectionledger.core;

import com.example.detectionledger.core.jdbc.DataSourceFactory;
import com.example.detectionledger.core.jdbc.StaticCredentials;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/** Test-only utilities shared by the core tests. */
public final class TestSupport {

  public static final DockerImageName POSTGRES_IMAGE = DockerImageName.parse("postgres:17");

  private TestSupport() {}

  /** Simple Docker availability probe using Testcontainers. */
  public static boolean dockerAvailable() {
    try {
      DockerClientFactory.instance().client();
      return true;
    } catch (final Throwable t) {
      return false;
    }
  }

  public static PostgreSQLContainer<?> startPostgres() {
    final var postgres =
        new PostgreSQLContainer<>(POSTGRES_IMAGE)
            .withDatabaseName("ledger")
            .withUsername("ledger")
            .withPassword("ledger");
    postgres.start();
    return postgres;
  }

  public static StaticCredentials staticTarget(final PostgreSQLContainer<?> postgres) {
    return new StaticCredentials(
        postgres.getHost(),
        postgres.getFirstMappedPort(),
        postgres.getDatabaseName(),
        postgres.getUsername(),
        postgres.getPassword());
  }

  /** Small Hikari pool with a short connection timeout so failures surface quickly. */
  public static DataSourceFactory hikariFactory() {
    return descriptor -> {
      final var cfg = new HikariConfig();
      cfg.setJdbcUrl(descriptor.jdbcUrl());
      cfg.setUsername(descriptor.username());
      cfg.setPassword(descriptor.password());
      cfg.setMaximumPoolSize(2);
      cfg.setConnectionTimeout(2_000);
      return new HikariDataSource(cfg);
    };
  }

  /** Clock whose time only moves when a test moves it. */
  public static final class MutableClock extends Clock {
    private volatile Instant now;

    public MutableClock(final Instant start) {
      this.now = start;
    }

    public void advance(final Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(final ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
