package com.example.detectionledger.core.store;

import static java.lang.System.Logger.Level.INFO;

import com.example.detectionledger.core.ConfigurationException;
import com.example.detectionledger.core.TransactionException;
import java.io.IOException;
import java.io.InputStream;
import java.lang.System.Logger;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Creates the ledger tables if they do not exist yet. */
public final class LedgerSchema {

  static final String RESOURCE = "/detection-ledger/schema.sql";

  private static final Logger logger = System.getLogger(LedgerSchema.class.getName());

  private LedgerSchema() {}

  /**
   * Runs the bundled DDL on the caller's connection. Every statement is idempotent.
   *
   * @param conn connection of the caller's unit of work
   */
  public static void create(final Connection conn) {
    final var statements = statements();
    try (var st = conn.createStatement()) {
      for (final var sql : statements) st.execute(sql);
    } catch (final SQLException e) {
      throw new TransactionException("Failed to create ledger tables", e);
    }
    logger.log(INFO, "Ledger schema ensured ({0} statements)", statements.size());
  }

  static List<String> statements() {
    try (InputStream in = LedgerSchema.class.getResourceAsStream(RESOURCE)) {
      if (in == null) throw new ConfigurationException("Missing resource " + RESOURCE);
      final var script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      return Arrays.stream(script.split(";"))
          .map(LedgerSchema::stripComments)
          .filter(s -> !s.isEmpty())
          .toList();
    } catch (final IOException e) {
      throw new ConfigurationException("Cannot read " + RESOURCE, e);
    }
  }

  private static String stripComments(final String statement) {
    return statement
        .lines()
        .filter(line -> !line.strip().startsWith("--"))
        .collect(Collectors.joining("\n"))
        .strip();
  }
}
