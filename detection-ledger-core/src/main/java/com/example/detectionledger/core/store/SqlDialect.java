package com.example.detectionledger.core.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/** How upserts are spelled for the connected database. */
public enum SqlDialect {
  /** {@code INSERT ... ON CONFLICT ... DO UPDATE} in one statement. */
  POSTGRESQL,

  /** {@code UPDATE}, then {@code INSERT} when no row was updated. */
  ANSI;

  /**
   * Picks the dialect from the driver's product name.
   *
   * @param conn open connection
   * @return {@link #POSTGRESQL} for PostgreSQL, {@link #ANSI} otherwise
   * @throws SQLException if the metadata cannot be read
   */
  public static SqlDialect detect(final Connection conn) throws SQLException {
    final var product = conn.getMetaData().getDatabaseProductName();
    return product != null && product.toLowerCase(Locale.ROOT).contains("postgres")
        ? POSTGRESQL
        : ANSI;
  }
}
