package com.example.detectionledger.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

import com.example.detectionledger.core.AuthRenewalException;
import com.example.detectionledger.core.AuthenticationException;
import com.example.detectionledger.core.DatabaseConnectionException;
import com.example.detectionledger.core.TestSupport.MutableClock;
import com.example.detectionledger.core.TransactionException;
import com.example.detectionledger.core.credentials.AccessToken;
import com.example.detectionledger.core.credentials.CredentialProvider;
import com.example.detectionledger.core.credentials.TokenSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import javax.sql.DataSource;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class SessionManagerTest {

  private static final StaticCredentials TARGET =
      new StaticCredentials("db.internal", 5432, "ledger", "ledger", "secret");

  private DataSource dataSource;
  private Connection connection;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = pooledDataSource();
    connection = mock(Connection.class);
    when(dataSource.getConnection()).thenReturn(connection);
  }

  private static DataSource pooledDataSource() {
    return mock(DataSource.class, withSettings().extraInterfaces(AutoCloseable.class));
  }

  private SessionManager sessions() {
    return SessionManager.create(TARGET, descriptor -> dataSource);
  }

  @Nested
  @DisplayName("Unit of work")
  class UnitOfWorkBehaviour {

    @Test
    @DisplayName("Should commit on normal return and release the connection")
    void commitsOnSuccess() throws Exception {
      try (var sessions = sessions()) {
        final var result = sessions.inTransaction(conn -> "done");

        assertEquals("done", result);
        final var order = inOrder(connection);
        order.verify(connection).setAutoCommit(false);
        order.verify(connection).commit();
        order.verify(connection).close();
        verify(connection, never()).rollback();
      }
    }

    @Test
    @DisplayName("Should roll back and rethrow the identical runtime exception")
    void rollsBackOnRuntimeException() throws Exception {
      final var failure = new IllegalArgumentException("x");
      try (var sessions = sessions()) {
        final var thrown =
            assertThrows(
                IllegalArgumentException.class,
                () ->
                    sessions.inTransaction(
                        conn -> {
                          throw failure;
                        }));

        assertSame(failure, thrown);
        verify(connection).rollback();
        verify(connection, never()).commit();
        verify(connection).close();
      }
    }

    @Test
    @DisplayName("Should rethrow a checked exception from the body unchanged")
    void rethrowsCheckedException() throws Exception {
      final var failure = new SQLException("constraint", "23505");
      try (var sessions = sessions()) {
        final var thrown =
            assertThrows(
                SQLException.class,
                () ->
                    sessions.inTransaction(
                        (UnitOfWork<Object, SQLException>)
                            conn -> {
                              throw failure;
                            }));

        assertSame(failure, thrown);
        verify(connection).rollback();
        verify(connection).close();
      }
    }

    @Test
    @DisplayName("Should rethrow an Error from the body after rollback")
    void rethrowsError() throws Exception {
      final var failure = new AssertionError("boom");
      try (var sessions = sessions()) {
        final var thrown =
            assertThrows(
                AssertionError.class,
                () ->
                    sessions.inTransaction(
                        conn -> {
                          throw failure;
                        }));

        assertSame(failure, thrown);
        verify(connection).rollback();
        verify(connection).close();
      }
    }

    @Test
    @DisplayName("Should keep the original error when rollback also fails")
    void rollbackFailureDoesNotReplaceOriginal() throws Exception {
      doThrow(new SQLException("connection lost")).when(connection).rollback();
      final var failure = new IllegalStateException("original");
      try (var sessions = sessions()) {
        final var thrown =
            assertThrows(
                IllegalStateException.class,
                () ->
                    sessions.inTransaction(
                        conn -> {
                          throw failure;
                        }));

        assertSame(failure, thrown);
        verify(connection).close();
      }
    }

    @Test
    @DisplayName("Should raise TransactionException when commit fails, after a rollback")
    void commitFailure() throws Exception {
      final var cause = new SQLException("serialization failure", "40001");
      doThrow(cause).when(connection).commit();
      try (var sessions = sessions()) {
        final var thrown =
            assertThrows(TransactionException.class, () -> sessions.inTransaction(conn -> 1));

        assertSame(cause, thrown.getCause());
        verify(connection).rollback();
        verify(connection).close();
      }
    }

    @Test
    @DisplayName("Should raise DatabaseConnectionException when no connection is available")
    void connectionFailure() throws Exception {
      when(dataSource.getConnection()).thenThrow(new SQLException("pool exhausted", "08001"));
      try (var sessions = sessions()) {
        assertThrows(DatabaseConnectionException.class, () -> sessions.inTransaction(conn -> 1));
      }
    }

    @Test
    @DisplayName("Should use a fresh connection per unit of work")
    void oneConnectionPerUnitOfWork() throws Exception {
      final var second = mock(Connection.class);
      when(dataSource.getConnection()).thenReturn(connection, second);
      try (var sessions = sessions()) {
        final var first = sessions.inTransaction(conn -> conn);
        final var next = sessions.inTransaction(conn -> conn);

        assertSame(connection, first);
        assertSame(second, next);
        verify(connection).close();
        verify(second).close();
      }
    }
  }

  @Nested
  @DisplayName("Creation")
  class Creation {

    @Test
    @DisplayName("Should wrap pool creation failures in DatabaseConnectionException")
    void poolCreationFailure() {
      final var cause = new IllegalStateException("host unreachable");
      final var thrown =
          assertThrows(
              DatabaseConnectionException.class,
              () ->
                  SessionManager.create(
                      TARGET,
                      descriptor -> {
                        throw cause;
                      }));
      assertSame(cause, thrown.getCause());
    }

    @Test
    @DisplayName("Should not retry a failed creation")
    void noAutomaticRetry() {
      final DataSourceFactory factory = mock(DataSourceFactory.class);
      when(factory.create(any())).thenThrow(new RuntimeException("down"));

      assertThrows(DatabaseConnectionException.class, () -> SessionManager.create(TARGET, factory));
      verify(factory, times(1)).create(any());
    }

    @Test
    @DisplayName("Should pass authentication failures through unchanged")
    void authenticationFailure() {
      final var failure = new AuthenticationException("az login failed");
      final var credentials =
          CredentialProvider.builder()
              .tokenSource(
                  id -> {
                    throw failure;
                  })
              .identity("client-id")
              .build();
      final var target = new ManagedIdentity("db", 5432, "ledger", "ledger", credentials);

      final var thrown =
          assertThrows(
              AuthenticationException.class,
              () -> SessionManager.create(target, descriptor -> dataSource));
      assertSame(failure, thrown);
    }

    @Test
    @DisplayName("Should require a target and a factory")
    void builderValidation() {
      assertThrows(
          IllegalStateException.class,
          () -> SessionManager.builder().factory(descriptor -> dataSource).build());
      assertThrows(IllegalStateException.class, () -> SessionManager.builder().target(TARGET).build());
      assertThrows(
          IllegalArgumentException.class,
          () ->
              SessionManager.builder()
                  .target(TARGET)
                  .factory(descriptor -> dataSource)
                  .gracePeriod(Duration.ofSeconds(-1))
                  .build());
    }
  }

  @Nested
  @DisplayName("Disposal")
  class Disposal {

    @Test
    @DisplayName("Should close the pool once and ignore later calls")
    void disposeIsIdempotent() throws Exception {
      final var sessions = sessions();

      sessions.dispose();
      sessions.dispose();
      sessions.close();

      assertTrue(sessions.isDisposed());
      verify((AutoCloseable) dataSource, times(1)).close();
    }

    @Test
    @DisplayName("Should refuse units of work after dispose")
    void inTransactionAfterDispose() throws Exception {
      final var sessions = sessions();
      sessions.dispose();

      assertThrows(IllegalStateException.class, () -> sessions.inTransaction(conn -> 1));
      verify(dataSource, never()).getConnection();
    }

    @Test
    @DisplayName("Should tolerate a pool whose close fails")
    void closeFailureIsLogged() throws Exception {
      doThrow(new IllegalStateException("already closed")).when((AutoCloseable) dataSource).close();
      final var sessions = sessions();

      assertDoesNotThrow(sessions::dispose);
      assertTrue(sessions.isDisposed());
    }
  }

  @Nested
  @DisplayName("Credential renewal")
  class CredentialRenewal {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private TokenSource tokenSource;
    private DataSourceFactory factory;
    private DataSource renewedDataSource;

    @BeforeEach
    void setUpIdentity() throws SQLException {
      clock = new MutableClock(T0);
      tokenSource = mock(TokenSource.class);
      when(tokenSource.acquire(anyString()))
          .thenReturn(new AccessToken("token-1", T0.plus(Duration.ofMinutes(10))))
          .thenReturn(new AccessToken("token-2", T0.plus(Duration.ofHours(2))));
      renewedDataSource = pooledDataSource();
      when(renewedDataSource.getConnection()).thenReturn(connection);
      factory = mock(DataSourceFactory.class);
      when(factory.create(any())).thenReturn(dataSource, renewedDataSource);
    }

    private SessionManager identitySessions(final Duration grace) {
      final var credentials =
          CredentialProvider.builder()
              .tokenSource(tokenSource)
              .identity("client-id")
              .clock(clock)
              .build();
      return SessionManager.builder()
          .target(new ManagedIdentity("db.internal", 5432, "ledger", "ledger", credentials))
          .factory(factory)
          .gracePeriod(grace)
          .build();
    }

    @Test
    @DisplayName("Should connect with the token as password")
    void usesTokenAsPassword() {
      try (var sessions = identitySessions(Duration.ZERO)) {
        verify(factory).create(argThat(d -> d.password().equals("token-1")));
        assertSame(dataSource, sessions.currentDataSource());
      }
    }

    @Test
    @DisplayName("Should renew an expiring token exactly once before the database is touched")
    void renewsBeforeDatabaseAccess() throws Exception {
      try (var sessions = identitySessions(Duration.ZERO)) {
        clock.advance(Duration.ofMinutes(6));

        sessions.inTransaction(conn -> 1);
        sessions.inTransaction(conn -> 2);

        verify(tokenSource, times(2)).acquire("client-id");
        final var order = inOrder(factory, renewedDataSource);
        order.verify(factory).create(argThat(d -> d.password().equals("token-2")));
        order.verify(renewedDataSource, times(2)).getConnection();
        verify(dataSource, never()).getConnection();
        verify((AutoCloseable) dataSource).close();
        assertSame(renewedDataSource, sessions.currentDataSource());
      }
    }

    @Test
    @DisplayName("Should keep the replaced pool open during the grace period")
    void retiresOldPoolAfterGracePeriod() throws Exception {
      final var sessions = identitySessions(Duration.ofMinutes(5));
      clock.advance(Duration.ofMinutes(6));

      sessions.inTransaction(conn -> 1);

      assertEquals(1, sessions.retiringPools());
      verify((AutoCloseable) dataSource, never()).close();

      sessions.dispose();
      assertEquals(0, sessions.retiringPools());
      verify((AutoCloseable) dataSource).close();
      verify((AutoCloseable) renewedDataSource).close();
    }

    @Test
    @DisplayName("Should fail the unit of work with AuthRenewalException when renewal fails")
    void renewalFailure() throws Exception {
      reset(tokenSource);
      when(tokenSource.acquire(anyString()))
          .thenReturn(new AccessToken("token-1", T0.plus(Duration.ofMinutes(10))))
          .thenThrow(new AuthenticationException("identity endpoint down"));
      try (var sessions = identitySessions(Duration.ZERO)) {
        clock.advance(Duration.ofMinutes(6));

        assertThrows(AuthRenewalException.class, () -> sessions.inTransaction(conn -> 1));
        verify(dataSource, never()).getConnection();
      }
    }
  }
}
