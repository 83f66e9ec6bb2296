package com.example.detectionledger.app;

import static java.lang.System.Logger.Level.*;

import com.example.detectionledger.core.ConfigurationException;
import com.example.detectionledger.core.audit.BatchRunRecorder;
import com.example.detectionledger.core.audit.RunMetadata;
import com.example.detectionledger.core.config.LedgerSettings;
import com.example.detectionledger.core.jdbc.SessionManager;
import com.example.detectionledger.core.pipeline.ImageSource;
import com.example.detectionledger.core.pipeline.InferenceClient;
import com.example.detectionledger.core.pipeline.Orchestrator;
import com.example.detectionledger.core.pipeline.RunSummary;
import com.example.detectionledger.core.store.LedgerSchema;
import java.io.IOException;
import java.lang.System.Logger;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ServiceLoader;

/**
 * Runs one batch: every image under an input directory goes through the model, with its state and
 * detections kept in the ledger database described by {@link LedgerSettings}.
 *
 * <p>The database is opened only when the run is resumable or must be reported; an evaluation run
 * with both switched off needs no database at all.
 */
public class App {

  private static final Logger logger = System.getLogger(App.class.getName());

  private final LedgerSettings settings;
  private final InferenceClient inference;

  /**
   * @param settings ledger configuration
   * @param inference the detection model
   */
  public App(final LedgerSettings settings, final InferenceClient inference) {
    this.settings = settings;
    this.inference = inference;
  }

  /**
   * Entry point.
   *
   * <p>Usage: {@code App <input-dir> <customer> <run-id> [<model-weights>]}. Without weights the
   * model name reported by the {@link InferenceClient} is recorded.
   *
   * @param args CLI args
   * @throws Exception the first error of the run, unchanged
   */
  public static void main(final String[] args) throws Exception {
    if (args.length < 3 || args.length > 4) {
      System.err.println("usage: App <input-dir> <customer> <run-id> [<model-weights>]");
      System.exit(2);
    }

    final var inference = loadInferenceClient();
    final var model =
        args.length == 4 ? RunMetadata.modelName(Path.of(args[3])) : inference.modelName();
    final var app = new App(LedgerSettings.load(), inference);
    final var summary =
        app.run(
            new DirectoryImageSource(Path.of(args[0]), args[1]),
            args[2],
            model,
            OffsetDateTime.now());

    logger.log(INFO, "Batch finished: {0}", summary);
  }

  /**
   * Finds the detection model on the class path.
   *
   * @return the first registered {@link InferenceClient}
   * @throws ConfigurationException if none is registered
   */
  static InferenceClient loadInferenceClient() {
    return ServiceLoader.load(InferenceClient.class)
        .findFirst()
        .orElseThrow(
            () ->
                new ConfigurationException(
                    "No " + InferenceClient.class.getName() + " registered on the class path"));
  }

  /**
   * Processes every image of the source as one run.
   *
   * @param source images to process
   * @param runId identifier of the run
   * @param model identifier of the model
   * @param startTime when the run started
   * @return counts for the run
   * @throws IOException if an image cannot be read; the failure was recorded when reporting is on
   */
  public RunSummary run(
      final ImageSource source,
      final String runId,
      final String model,
      final OffsetDateTime startTime)
      throws IOException {
    final var metadata = new RunMetadata(runId, startTime, model, settings.reportingRequired());

    if (!settings.resumable() && !metadata.reportingRequired()) {
      logger.log(INFO, "Run {0} keeps no state; database not opened", runId);
      return execute(metadata, source, null);
    }

    try (var sessions = settings.openSessions(settings.connectionTarget())) {
      if (settings.createSchema()) {
        sessions.inTransaction(
            conn -> {
              LedgerSchema.create(conn);
              return null;
            });
      }
      return execute(metadata, source, sessions);
    }
  }

  private RunSummary execute(
      final RunMetadata metadata, final ImageSource source, final SessionManager sessions)
      throws IOException {
    final var recorder = BatchRunRecorder.builder().metadata(metadata).sessions(sessions).build();
    final var orchestrator =
        Orchestrator.builder()
            .sessions(sessions)
            .store(settings.jobStateStore())
            .inference(inference)
            .metadata(metadata)
            .resumable(settings.resumable())
            .build();
    return recorder.run(() -> orchestrator.run(source));
  }
}
