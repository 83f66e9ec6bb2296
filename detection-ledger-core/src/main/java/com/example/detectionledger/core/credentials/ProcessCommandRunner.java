package com.example.detectionledger.core.credentials;

import static java.lang.System.Logger.Level.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.System.Logger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Both output streams are drained on
 * separate threads so a chatty process cannot block on a full pipe, and at most {@value
 * #MAX_CAPTURE_CHARS} characters of each stream are kept.
 */
public final class ProcessCommandRunner implements CommandRunner {

  private static final Logger logger = System.getLogger(ProcessCommandRunner.class.getName());
  private static final int MAX_CAPTURE_CHARS = 16 * 1024;
  private static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

  private final Duration drainTimeout;

  public ProcessCommandRunner() {
    this(DEFAULT_DRAIN_TIMEOUT);
  }

  /**
   * @param drainTimeout how long to wait for the output streams to close once the process exited
   */
  ProcessCommandRunner(final Duration drainTimeout) {
    this.drainTimeout = drainTimeout;
  }

  @Override
  public Result run(final List<String> command, final Duration timeout)
      throws IOException, InterruptedException {
    final var process = new ProcessBuilder(command).start();
    final var stdout = new StringBuilder();
    final var stderr = new StringBuilder();

    final ExecutorService drains =
        Executors.newFixedThreadPool(
            2,
            r -> {
              final var t = new Thread(r, "command-output-" + command.get(0));
              t.setDaemon(true);
              return t;
            });
    try {
      drains.submit(() -> drain(process.getInputStream(), stdout));
      drains.submit(() -> drain(process.getErrorStream(), stderr));

      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new IOException(
            "%s timed out after %d ms".formatted(command.get(0), timeout.toMillis()));
      }
    } finally {
      drains.shutdown();
    }
    if (!drains.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
      drains.shutdownNow();
      throw new IOException("output of %s not fully read".formatted(command.get(0)));
    }

    synchronized (stdout) {
      synchronized (stderr) {
        return new Result(process.exitValue(), stdout.toString().trim(), stderr.toString().trim());
      }
    }
  }

  private static void drain(final InputStream stream, final StringBuilder capture) {
    try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        synchronized (capture) {
          if (capture.length() < MAX_CAPTURE_CHARS) capture.append(line).append('\n');
        }
      }
    } catch (final IOException e) {
      logger.log(WARNING, "Error reading process output", e);
    }
  }
}
