package com.example.detectionledger.app;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.example.detectionledger.core.config.LedgerSettings;
import com.example.detectionledger.core.pipeline.RunSummary;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Runs whole batches against a real PostgreSQL: a first run records every image, a second run
 * resumes and skips them, and a failing run leaves its failure record behind.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@DisabledIfSystemProperty(named = "tests.integration.disable", matches = "true")
public class AppIntegrationTest {

  private PostgreSQLContainer<?> postgres;
  private final Map<String, String> values = new HashMap<>();

  @TempDir Path input;

  @BeforeAll
  void setup() {
    assumeTrue(dockerAvailable(), "Docker not available, skipping integration test");

    postgres =
        new PostgreSQLContainer<>(DockerImageName.parse("postgres:17"))
            .withDatabaseName("ledger")
            .withUsername("ledger")
            .withPassword("ledger");
    postgres.start();

    values.put("ledger.db.mode", "static");
    values.put("ledger.db.host", postgres.getHost());
    values.put("ledger.db.port", String.valueOf(postgres.getFirstMappedPort()));
    values.put("ledger.db.name", postgres.getDatabaseName());
    values.put("ledger.db.user", postgres.getUsername());
    values.put("ledger.db.password", postgres.getPassword());
    values.put("ledger.pool.connection-timeout.millis", "2000");
    values.put("ledger.schema.create", "true");
  }

  @AfterAll
  void cleanup() {
    if (postgres != null) postgres.stop();
  }

  private static boolean dockerAvailable() {
    try {
      DockerClientFactory.instance().client();
      return true;
    } catch (final Throwable t) {
      return false;
    }
  }

  private App app() {
    return new App(LedgerSettings.from(values::get, name -> null), new FixedInferenceClient());
  }

  private void image(final String relative) throws IOException {
    final var file = input.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.write(file, new byte[] {1});
  }

  private int count(final String sql) throws SQLException {
    try (var conn =
            DriverManager.getConnection(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        var st = conn.createStatement();
        var rs = st.executeQuery(sql)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  @Test
  void resumesAndRecordsFailures() throws Exception {
    image("2024-01-01/cat-1.jpg");
    image("2024-01-01/street.jpg");
    image("2024-01-02/cat-2.jpg");
    final var customer = new DirectoryImageSource(input, "acme");

    final var first = app().run(customer, "run-1", "fixed-model", OffsetDateTime.now());

    assertEquals(new RunSummary(3, 0, 0, 3, 2, 1), first);
    assertEquals(3, count("SELECT count(*) FROM image_processing_status WHERE status = 'processed'"));
    assertEquals(2, count("SELECT count(*) FROM detection_information WHERE has_detection"));
    assertEquals(1, count("SELECT count(*) FROM detection_information WHERE NOT has_detection"));
    assertEquals(1, count("SELECT count(*) FROM batch_run_information WHERE run_id = 'run-1' AND success"));

    image("2024-01-02/corrupt.jpg");
    final var thrown =
        assertThrows(
            IOException.class,
            () -> app().run(customer, "run-2", "fixed-model", OffsetDateTime.now()));

    assertEquals("cannot decode corrupt.jpg", thrown.getMessage());
    assertEquals(
        1,
        count(
            """
            SELECT count(*) FROM batch_run_information
            WHERE run_id = 'run-2' AND NOT success
              AND error_code = 'java.io.IOException: cannot decode corrupt.jpg'
            """));
    assertEquals(
        1, count("SELECT count(*) FROM image_processing_status WHERE status = 'in_progress'"));

    Files.delete(input.resolve("2024-01-02/corrupt.jpg"));
    final var third = app().run(customer, "run-3", "fixed-model", OffsetDateTime.now());

    assertEquals(new RunSummary(3, 3, 0, 0, 0, 0), third);
    assertEquals(3, count("SELECT count(*) FROM detection_information"));
  }
}
