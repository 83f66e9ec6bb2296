package com.example.detectionledger.core.jdbc;

import java.sql.Connection;

/**
 * Body of one transaction. Everything it writes through the connection commits together or not at
 * all.
 *
 * @param <T> result type
 * @param <E> checked exception the body may throw; rethrown unchanged after rollback
 */
@FunctionalInterface
public interface UnitOfWork<T, E extends Exception> {
  /**
   * Runs the body against a connection whose auto-commit is off.
   *
   * @param conn connection owned by this unit of work only
   * @return body result
   * @throws E on failure, which rolls the transaction back
   */
  T execute(final Connection conn) throws E;
}
