package com.example.detectionledger.core.credentials;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/** Runs an external command and captures its output. */
@FunctionalInterface
public interface CommandRunner {

  /**
   * Runs the command to completion or until the timeout elapses.
   *
   * @param command executable and arguments
   * @param timeout maximum time to wait for the process
   * @return exit code and captured output
   * @throws IOException if the process cannot start, times out or its output cannot be read
   * @throws InterruptedException if the waiting thread is interrupted
   */
  Result run(final List<String> command, final Duration timeout)
      throws IOException, InterruptedException;

  /**
   * Captured outcome of a finished process.
   *
   * @param exitCode process exit code, 0 on success
   * @param stdout captured standard output, truncated to a safe size
   * @param stderr captured standard error, truncated to a safe size
   */
  record Result(int exitCode, String stdout, String stderr) {}
}
