package com.example.detectionledger.core.credentials;

import static java.lang.System.Logger.Level.*;

import com.example.detectionledger.core.AuthenticationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.lang.System.Logger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Obtains Azure Database for PostgreSQL tokens for a user-assigned managed identity through the
 * Azure CLI.
 *
 * <p>Runs {@code az login --identity --username <clientId>} followed by {@code az account
 * get-access-token --resource-type oss-rdbms} and reads {@code accessToken} plus the expiry from
 * the JSON output. The numeric {@code expires_on} field (epoch seconds) is preferred; older CLI
 * versions only print {@code expiresOn} as a local timestamp.
 */
public final class AzureCliTokenSource implements TokenSource {

  public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);

  private static final Logger logger = System.getLogger(AzureCliTokenSource.class.getName());
  private static final DateTimeFormatter EXPIRES_ON_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

  private final CommandRunner runner;
  private final Duration timeout;
  private final ZoneId cliZone;
  private final ObjectMapper mapper;

  public AzureCliTokenSource() {
    this(new ProcessCommandRunner(), DEFAULT_TIMEOUT, ZoneId.systemDefault(), new ObjectMapper());
  }

  /**
   * @param runner runs the {@code az} commands
   * @param timeout limit for each {@code az} invocation
   * @param cliZone zone the CLI uses when printing {@code expiresOn}
   * @param mapper JSON mapper for the CLI output
   */
  public AzureCliTokenSource(
      final CommandRunner runner,
      final Duration timeout,
      final ZoneId cliZone,
      final ObjectMapper mapper) {
    this.runner = runner;
    this.timeout = timeout;
    this.cliZone = cliZone;
    this.mapper = mapper;
  }

  @Override
  public AccessToken acquire(final String clientId) {
    run(List.of("az", "login", "--identity", "--username", clientId), "az login --identity");
    final var output =
        run(
            List.of("az", "account", "get-access-token", "--resource-type", "oss-rdbms"),
            "az account get-access-token");
    final var token = parse(output);
    logger.log(DEBUG, "Obtained database token expiring at {0}", token.expiresAt());
    return token;
  }

  AccessToken parse(final String json) {
    final JsonNode node;
    try {
      node = mapper.readTree(json);
    } catch (final IOException e) {
      throw new AuthenticationException("Unreadable token response from Azure CLI", e);
    }
    final var accessToken = node.path("accessToken").asText(null);
    if (accessToken == null || accessToken.isBlank())
      throw new AuthenticationException("Azure CLI response has no accessToken");
    return new AccessToken(accessToken, expiry(node));
  }

  private Instant expiry(final JsonNode node) {
    final var epochSeconds = node.path("expires_on");
    if (epochSeconds.canConvertToLong()) return Instant.ofEpochSecond(epochSeconds.asLong());
    if (epochSeconds.isTextual() && epochSeconds.asText().matches("\\d+"))
      return Instant.ofEpochSecond(Long.parseLong(epochSeconds.asText()));

    final var expiresOn = node.path("expiresOn").asText(null);
    if (expiresOn == null) throw new AuthenticationException("Azure CLI response has no expiry");
    try {
      return LocalDateTime.parse(expiresOn, EXPIRES_ON_FORMAT).atZone(cliZone).toInstant();
    } catch (final DateTimeParseException e) {
      throw new AuthenticationException("Unrecognised token expiry: " + expiresOn, e);
    }
  }

  private String run(final List<String> command, final String description) {
    final CommandRunner.Result result;
    try {
      result = runner.run(command, timeout);
    } catch (final IOException e) {
      throw new AuthenticationException(description + " failed: " + e.getMessage(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AuthenticationException(description + " interrupted", e);
    }
    if (result.exitCode() != 0) {
      logger.log(ERROR, "{0} exited with {1}: {2}", description, result.exitCode(),
          result.stderr());
      throw new AuthenticationException(
          "%s exited with code %d".formatted(description, result.exitCode()));
    }
    return result.stdout();
  }
}
