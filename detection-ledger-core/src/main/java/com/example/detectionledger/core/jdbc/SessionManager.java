package com.example.detectionledger.core.jdbc;

import static java.lang.System.Logger.Level.*;

import com.example.detectionledger.core.DatabaseConnectionException;
import com.example.detectionledger.core.TransactionException;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.sql.DataSource;

/**
 * Owns the connection pool for one process and runs transactional units of work against it.
 *
 * <p>Each {@link #inTransaction(UnitOfWork)} call:
 *
 * <ol>
 *   <li>re-resolves the {@link ConnectionTarget} if its credential went stale, rebuilding the pool
 *       with the new token before any statement runs;
 *   <li>takes one connection from the pool and turns auto-commit off;
 *   <li>runs the body, commits on normal return, and rolls back and rethrows the identical
 *       throwable otherwise;
 *   <li>returns the connection to the pool on every path.
 * </ol>
 *
 * <p>Pools replaced by a credential refresh stay open for a grace period so that units of work
 * already running on other threads can finish, then they are closed.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (var sessions = SessionManager.builder()
 *         .target(new ManagedIdentity(host, 5432, user, db, credentials))
 *         .factory(new HikariDataSourceFactory(4, Duration.ofSeconds(30), "require", "ledger"))
 *         .build()) {
 *   sessions.inTransaction(conn -> store.claim(conn, key));
 * }
 * }</pre>
 */
public final class SessionManager implements AutoCloseable {

  private static final Logger logger = System.getLogger(SessionManager.class.getName());

  private final ConnectionTarget target;
  private final DataSourceFactory factory;
  private final Duration gracePeriod;

  private final AtomicReference<DataSource> dataSource = new AtomicReference<>();
  private final AtomicReference<ConnectionDescriptor> descriptor = new AtomicReference<>();
  private final AtomicBoolean disposed = new AtomicBoolean(false);
  private final Queue<Retirement> retiring = new ConcurrentLinkedQueue<>();
  private final Object refreshLock = new Object();

  private SessionManager(final Builder builder) {
    this.target = builder.target;
    this.factory = builder.factory;
    this.gracePeriod = builder.gracePeriod;

    final var resolved = target.resolve();
    descriptor.set(resolved);
    dataSource.set(createDataSource(resolved));
    logger.log(INFO, "Connection pool created for {0}", resolved.jdbcUrl());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Resolves the target and builds the pool in one step.
   *
   * @param target connection target
   * @param factory pool factory
   * @return a ready session manager
   * @throws DatabaseConnectionException if the pool cannot be created
   */
  public static SessionManager create(
      final ConnectionTarget target, final DataSourceFactory factory) {
    return builder().target(target).factory(factory).build();
  }

  /** Builder for {@link SessionManager}. */
  public static class Builder {
    private ConnectionTarget target;
    private DataSourceFactory factory;
    private Duration gracePeriod = Duration.ofSeconds(60);

    private Builder() {}

    /**
     * Sets the connection target (required).
     *
     * @param target static login or managed identity
     * @return this builder
     */
    public Builder target(final ConnectionTarget target) {
      this.target = target;
      return this;
    }

    /**
     * Sets the pool factory (required).
     *
     * @param factory function that creates a pooled DataSource from resolved parameters
     * @return this builder
     */
    public Builder factory(final DataSourceFactory factory) {
      this.factory = factory;
      return this;
    }

    /**
     * Sets how long a pool replaced by a credential refresh stays open.
     *
     * <p>Default: 60 seconds
     *
     * @param gracePeriod delay before closing the old pool
     * @return this builder
     */
    public Builder gracePeriod(final Duration gracePeriod) {
      this.gracePeriod = gracePeriod;
      return this;
    }

    /**
     * Resolves the target and creates the pool. No retry is attempted.
     *
     * @return a ready session manager
     * @throws IllegalStateException if required fields are not set
     * @throws DatabaseConnectionException if the pool cannot be created
     */
    public SessionManager build() {
      if (target == null) throw new IllegalStateException("target is required");
      if (factory == null) throw new IllegalStateException("factory is required");
      if (gracePeriod == null || gracePeriod.isNegative())
        throw new IllegalArgumentException("gracePeriod must be non-negative");
      return new SessionManager(this);
    }
  }

  /**
   * Runs {@code work} in its own transaction.
   *
   * @param work body of the transaction
   * @param <T> result type
   * @param <E> checked exception type of the body
   * @return the body's result, after a successful commit
   * @throws E whatever the body threw, unchanged, after rollback
   * @throws com.example.detectionledger.core.AuthRenewalException if the credential could not be
   *     renewed; nothing has run
   * @throws DatabaseConnectionException if no connection could be obtained
   * @throws TransactionException if the commit failed; the transaction was rolled back
   * @throws IllegalStateException after {@link #dispose()}
   */
  public <T, E extends Exception> T inTransaction(final UnitOfWork<T, E> work) throws E {
    ensureOpen();
    refreshIfStale();

    final var conn = openConnection();
    try {
      final T result;
      try {
        result = work.execute(conn);
      } catch (final Throwable t) {
        rollbackQuietly(conn);
        throw t;
      }
      commit(conn);
      return result;
    } finally {
      closeQuietly(conn);
    }
  }

  /**
   * Closes the pool and any pool still inside its grace period. Safe to call more than once; later
   * calls do nothing.
   */
  public void dispose() {
    if (!disposed.compareAndSet(false, true)) {
      logger.log(DEBUG, "SessionManager already disposed");
      return;
    }

    Retirement pending;
    while ((pending = retiring.poll()) != null) {
      pending.cleanup().cancel(false);
      closeDataSource(pending.dataSource());
    }
    closeDataSource(dataSource.getAndSet(null));
    logger.log(INFO, "Connection pool disposed");
  }

  @Override
  public void close() {
    dispose();
  }

  public boolean isDisposed() {
    return disposed.get();
  }

  DataSource currentDataSource() {
    return dataSource.get();
  }

  int retiringPools() {
    return retiring.size();
  }

  private void ensureOpen() {
    if (disposed.get()) throw new IllegalStateException("SessionManager has been disposed");
  }

  private void refreshIfStale() {
    final var current = descriptor.get();
    final var refreshed = target.refresh(current);
    if (refreshed.isEmpty()) return;

    synchronized (refreshLock) {
      ensureOpen();
      if (descriptor.get() != current) {
        logger.log(DEBUG, "Pool already rebuilt by another caller");
        return;
      }
      final var next = refreshed.get();
      final var newDs = createDataSource(next);
      final var oldDs = dataSource.getAndSet(newDs);
      descriptor.set(next);
      retire(oldDs);
      logger.log(INFO, "Connection pool rebuilt with renewed credentials");
    }
  }

  private void retire(final DataSource oldDs) {
    if (oldDs == null) return;
    if (gracePeriod.isZero()) {
      closeDataSource(oldDs);
      return;
    }
    final var cleanup =
        CompletableFuture.runAsync(
            () -> {
              closeDataSource(oldDs);
              retiring.removeIf(r -> r.dataSource() == oldDs);
              logger.log(INFO, "Closed old connection pool after grace period");
            },
            CompletableFuture.delayedExecutor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS));
    retiring.add(new Retirement(oldDs, cleanup));
  }

  private DataSource createDataSource(final ConnectionDescriptor resolved) {
    try {
      return factory.create(resolved);
    } catch (final RuntimeException e) {
      logger.log(ERROR, "Failed to create connection pool for {0}", resolved.jdbcUrl());
      throw new DatabaseConnectionException(
          "Failed to create connection pool for " + resolved.jdbcUrl(), e);
    }
  }

  private Connection openConnection() {
    final Connection conn;
    try {
      conn = dataSource.get().getConnection();
    } catch (final SQLException | RuntimeException e) {
      throw new DatabaseConnectionException("Failed to obtain a database connection", e);
    }
    try {
      conn.setAutoCommit(false);
      return conn;
    } catch (final SQLException e) {
      closeQuietly(conn);
      throw new DatabaseConnectionException("Failed to start a transaction", e);
    }
  }

  private void commit(final Connection conn) {
    try {
      conn.commit();
    } catch (final SQLException e) {
      rollbackQuietly(conn);
      throw new TransactionException("Commit failed; unit of work rolled back", e);
    }
  }

  private void rollbackQuietly(final Connection conn) {
    try {
      conn.rollback();
    } catch (final SQLException | RuntimeException e) {
      logger.log(WARNING, "Rollback failed", e);
    }
  }

  private void closeQuietly(final Connection conn) {
    try {
      conn.close();
    } catch (final SQLException | RuntimeException e) {
      logger.log(WARNING, "Failed to release connection", e);
    }
  }

  private void closeDataSource(final DataSource ds) {
    if (ds instanceof AutoCloseable ac) {
      try {
        ac.close();
      } catch (final Exception e) {
        logger.log(WARNING, "Failed to close connection pool", e);
      }
    }
  }

  private record Retirement(DataSource dataSource, CompletableFuture<Void> cleanup) {}
}
