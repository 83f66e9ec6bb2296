package com.example.detectionledger.core.store;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.detectionledger.core.TransactionException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.*;

public class LedgerSchemaTest {

  @Test
  @DisplayName("Should split the bundled script into idempotent statements without comments")
  void parsesBundledScript() {
    final var statements = LedgerSchema.statements();

    assertEquals(4, statements.size());
    assertTrue(statements.get(0).startsWith("CREATE TABLE IF NOT EXISTS image_processing_status"));
    assertTrue(statements.get(1).startsWith("CREATE TABLE IF NOT EXISTS detection_information"));
    assertTrue(statements.get(2).startsWith("CREATE INDEX IF NOT EXISTS"));
    assertTrue(statements.get(3).startsWith("CREATE TABLE IF NOT EXISTS batch_run_information"));
    statements.forEach(sql -> assertFalse(sql.contains("--"), sql));
  }

  @Test
  @DisplayName("Should execute every statement on the given connection")
  void executesStatements() throws SQLException {
    final var conn = mock(Connection.class);
    final var st = mock(Statement.class);
    when(conn.createStatement()).thenReturn(st);

    LedgerSchema.create(conn);

    verify(st, times(4)).execute(anyString());
    verify(st).close();
  }

  @Test
  @DisplayName("Should wrap DDL failures in TransactionException")
  void wrapsFailures() throws SQLException {
    final var conn = mock(Connection.class);
    final var st = mock(Statement.class);
    when(conn.createStatement()).thenReturn(st);
    when(st.execute(anyString())).thenThrow(new SQLException("permission denied", "42501"));

    final var thrown = assertThrows(TransactionException.class, () -> LedgerSchema.create(conn));
    assertEquals("42501", ((SQLException) thrown.getCause()).getSQLState());
  }
}
