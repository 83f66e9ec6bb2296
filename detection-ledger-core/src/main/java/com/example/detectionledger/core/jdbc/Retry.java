package com.example.detectionledger.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Opt-in retry for callers that decide a failure is worth another attempt.
 *
 * <p>Nothing in the ledger retries on its own: {@link SessionManager} reports a failed pool
 * creation once and leaves the policy to the caller. A caller that wants to ride out a database
 * restart wraps the creation explicitly:
 *
 * <pre>{@code
 * var sessions = Retry.onException(
 *     () -> SessionManager.create(target, factory),
 *     Retry::isTransientConnectionError,
 *     () -> {},
 *     Retry.Policy.exponential(5, 500L));
 * }</pre>
 *
 * @see Policy
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());
  private static final String[] TRANSIENT_CONN_KEYWORDS =
      new String[] {
        "connection refused",
        "connection reset",
        "i/o error",
        "socket closed",
        "broken pipe",
        "timeout",
        "timed out"
      };

  private Retry() {}

  /**
   * Runs the supplier, retrying failures accepted by {@code shouldRetry} according to the policy.
   *
   * @param supplier operation to execute
   * @param shouldRetry predicate deciding whether a failure is retryable
   * @param beforeRetry hook run before each retry (not before the first attempt)
   * @param policy attempts and delays
   * @param <T> result type
   * @return the supplier result
   * @throws RuntimeException the last failure when attempts run out or the failure is not
   *     retryable
   */
  public static <T> T onException(
      final Supplier<? extends T> supplier,
      final Predicate<? super RuntimeException> shouldRetry,
      final Runnable beforeRetry,
      final Policy policy) {
    var attempt = 0;
    while (true) {
      attempt++;
      try {
        return supplier.get();
      } catch (final RuntimeException ex) {
        if (!shouldRetry.test(ex) || attempt >= policy.maxAttempts()) {
          if (attempt > 1) LOGGER.log(WARNING, "Giving up after {0} attempts", attempt);
          throw ex;
        }

        LOGGER.log(DEBUG, "Attempt {0} failed, retrying: {1}", attempt, ex.getMessage());
        beforeRetry.run();

        final var delay = policy.calculateDelay(attempt + 1);
        if (delay > 0) {
          try {
            Thread.sleep(delay);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw ex;
          }
        }
      }
    }
  }

  /**
   * Finds the last SQLException in a throwable cause chain, following {@code getNextException}.
   *
   * @param t the throwable to search
   * @return the innermost SQLException, or null if none found
   */
  static SQLException findSqlException(final Throwable t) {
    Throwable cur = t;
    SQLException last = null;
    while (cur != null) {
      if (cur instanceof SQLException sql) {
        last = sql;
        SQLException next = sql.getNextException();
        while (next != null) {
          last = next;
          next = next.getNextException();
        }
      }
      cur = cur.getCause();
    }
    return last;
  }

  /**
   * Detects connection failures likely to recover on retry: SQLState class 08, {@link
   * SQLTransientException}, or well-known network error messages anywhere in the cause chain.
   *
   * @param t the failure to check
   * @return true if transient connection error
   */
  public static boolean isTransientConnectionError(final Throwable t) {
    final var e = findSqlException(t);
    if (e == null) return false;

    final var state = e.getSQLState();
    if (state != null && state.startsWith("08")) return true;

    if (e instanceof SQLTransientException) return true;

    final var msg = e.getMessage();
    if (msg != null) {
      final var lower = msg.toLowerCase(Locale.ROOT);
      for (final var keyword : TRANSIENT_CONN_KEYWORDS) if (lower.contains(keyword)) return true;
    }

    return false;
  }

  /**
   * Retry policy with fixed or exponential backoff.
   *
   * <pre>{@code
   * // Fixed: exactly 500ms between attempts
   * var fixed = Policy.fixed(3, 500L);
   *
   * // Exponential: 100ms, ~200ms, ~400ms with jitter
   * var exponential = Policy.exponential(5, 100L);
   * }</pre>
   *
   * @param maxAttempts total attempts (first + retries), must be ≥ 1
   * @param initialDelayMillis starting delay, must be ≥ 0
   * @param maxDelayMillis cap for exponential growth, must be ≥ initialDelayMillis
   * @param backoffMultiplier growth factor (1.0 = fixed), must be ≥ 1.0
   * @param jitter whether to add up to 25% randomness to delays
   */
  public record Policy(
      int maxAttempts,
      long initialDelayMillis,
      long maxDelayMillis,
      double backoffMultiplier,
      boolean jitter) {

    public Policy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (initialDelayMillis < 0)
        throw new IllegalArgumentException("initialDelayMillis must be >= 0");
      if (maxDelayMillis < initialDelayMillis)
        throw new IllegalArgumentException("maxDelayMillis must be >= initialDelayMillis");
      if (backoffMultiplier < 1.0)
        throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }

    /** A single attempt: the failure propagates immediately. */
    public static Policy none() {
      return fixed(1, 0L);
    }

    public static Policy fixed(final int attempts, final long delayMillis) {
      return new Policy(attempts, delayMillis, delayMillis, 1.0, false);
    }

    /**
     * Doubles the delay after each attempt up to 60 seconds, with jitter.
     *
     * @param attempts number of attempts (including first)
     * @param initialDelay delay before the first retry in milliseconds
     * @return exponential backoff policy
     */
    public static Policy exponential(final int attempts, final long initialDelay) {
      return new Policy(attempts, initialDelay, 60_000L, 2.0, true);
    }

    /**
     * Delay to wait before the given attempt. The first attempt never waits.
     *
     * @param attempt attempt about to run (1-based)
     * @return delay in milliseconds
     */
    long calculateDelay(final int attempt) {
      if (attempt <= 1) return 0L;

      var delay = initialDelayMillis;
      if (backoffMultiplier > 1.0) {
        delay = (long) (initialDelayMillis * Math.pow(backoffMultiplier, attempt - 2));
        delay = Math.min(delay, maxDelayMillis);
      }

      if (jitter) delay += (long) (delay * 0.25 * Math.random());

      return delay;
    }
  }
}
