package com.example.detectionledger.core.config;

import static java.lang.System.Logger.Level.*;

import com.example.detectionledger.core.ConfigurationException;
import com.example.detectionledger.core.credentials.AzureCliTokenSource;
import com.example.detectionledger.core.credentials.CredentialProvider;
import com.example.detectionledger.core.credentials.ProcessCommandRunner;
import com.example.detectionledger.core.credentials.SecretHelper;
import com.example.detectionledger.core.credentials.SecretsManagerProvider;
import com.example.detectionledger.core.credentials.TokenSource;
import com.example.detectionledger.core.jdbc.ConnectionTarget;
import com.example.detectionledger.core.jdbc.DataSourceFactory;
import com.example.detectionledger.core.jdbc.HikariDataSourceFactory;
import com.example.detectionledger.core.jdbc.ManagedIdentity;
import com.example.detectionledger.core.jdbc.Retry;
import com.example.detectionledger.core.jdbc.SessionManager;
import com.example.detectionledger.core.jdbc.StaticCredentials;
import com.example.detectionledger.core.store.ClaimPolicy;
import com.example.detectionledger.core.store.JobStateStore;
import com.example.detectionledger.core.store.SqlDialect;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.System.Logger;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ledger configuration read from system properties, then environment variables.
 *
 * <p>Each setting has a property name such as {@code ledger.db.host}; the matching environment
 * variable is the upper-cased name with dots and dashes turned into underscores ({@code
 * LEDGER_DB_HOST}). A system property wins over the environment.
 *
 * <table>
 *   <caption>Settings</caption>
 *   <tr><th>Property</th><th>Default</th></tr>
 *   <tr><td>ledger.db.mode</td><td>static</td></tr>
 *   <tr><td>ledger.db.host, ledger.db.name, ledger.db.user</td><td>required unless read from a secret</td></tr>
 *   <tr><td>ledger.db.port</td><td>5432</td></tr>
 *   <tr><td>ledger.db.password</td><td>required in static mode</td></tr>
 *   <tr><td>ledger.db.secret.id</td><td>required in secrets-manager mode</td></tr>
 *   <tr><td>ledger.db.sslmode</td><td>require for managed identities, driver default otherwise</td></tr>
 *   <tr><td>ledger.db.dialect</td><td>detected</td></tr>
 *   <tr><td>ledger.identity.client-id</td><td>required in managed-identity mode</td></tr>
 *   <tr><td>ledger.identity.renewal-margin.seconds</td><td>300</td></tr>
 *   <tr><td>ledger.identity.az-timeout.seconds</td><td>120</td></tr>
 *   <tr><td>ledger.pool.size</td><td>4</td></tr>
 *   <tr><td>ledger.pool.connection-timeout.millis</td><td>30000</td></tr>
 *   <tr><td>ledger.pool.grace-period.seconds</td><td>60</td></tr>
 *   <tr><td>ledger.connect.retry.attempts</td><td>1</td></tr>
 *   <tr><td>ledger.connect.retry.delay.millis</td><td>500</td></tr>
 *   <tr><td>ledger.claim.policy</td><td>last-write-wins</td></tr>
 *   <tr><td>ledger.reporting.required</td><td>true</td></tr>
 *   <tr><td>ledger.resumable</td><td>true</td></tr>
 *   <tr><td>ledger.schema.create</td><td>false</td></tr>
 * </table>
 */
public final class LedgerSettings {

  private static final Logger logger = System.getLogger(LedgerSettings.class.getName());
  private static final int MIN_CONNECTION_TIMEOUT_MILLIS = 250;

  private final Function<String, String> properties;
  private final Function<String, String> environment;

  private LedgerSettings(
      final Function<String, String> properties, final Function<String, String> environment) {
    this.properties = properties;
    this.environment = environment;
  }

  /** Settings backed by {@link System#getProperty} and {@link System#getenv}. */
  public static LedgerSettings load() {
    return new LedgerSettings(System::getProperty, System::getenv);
  }

  /**
   * Settings backed by arbitrary lookups, typically maps in tests.
   *
   * @param properties lookup by property name, returning null when unset
   * @param environment lookup by environment variable name, returning null when unset
   * @return the settings
   */
  public static LedgerSettings from(
      final Function<String, String> properties, final Function<String, String> environment) {
    return new LedgerSettings(properties, environment);
  }

  static String environmentName(final String property) {
    return property.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }

  /**
   * Raw value of a setting.
   *
   * @param property property name
   * @return the trimmed value, or empty when unset or blank
   */
  public Optional<String> get(final String property) {
    return Optional.ofNullable(properties.apply(property))
        .or(() -> Optional.ofNullable(environment.apply(environmentName(property))))
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }

  public String require(final String property) {
    return get(property)
        .orElseThrow(
            () ->
                new ConfigurationException(
                    "Missing setting %s (or %s)".formatted(property, environmentName(property))));
  }

  public int getInt(final String property, final int defaultValue) {
    return get(property).map(value -> parseInt(property, value)).orElse(defaultValue);
  }

  public boolean getBoolean(final String property, final boolean defaultValue) {
    return get(property)
        .map(
            value -> {
              if (value.equalsIgnoreCase("true")) return true;
              if (value.equalsIgnoreCase("false")) return false;
              throw new ConfigurationException(
                  "Setting %s must be true or false, got '%s'".formatted(property, value));
            })
        .orElse(defaultValue);
  }

  private static int parseInt(final String property, final String value) {
    try {
      return Integer.parseInt(value);
    } catch (final NumberFormatException e) {
      throw new ConfigurationException(
          "Setting %s must be an integer, got '%s'".formatted(property, value), e);
    }
  }

  public ConnectionMode mode() {
    return get("ledger.db.mode").map(ConnectionMode::parse).orElse(ConnectionMode.STATIC);
  }

  public ClaimPolicy claimPolicy() {
    return get("ledger.claim.policy")
        .map(
            value ->
                switch (value.toLowerCase(Locale.ROOT)) {
                  case "last-write-wins" -> ClaimPolicy.LAST_WRITE_WINS;
                  case "exclusive" -> ClaimPolicy.EXCLUSIVE;
                  default -> throw new ConfigurationException(
                      "Unknown ledger.claim.policy '%s'; expected last-write-wins or exclusive"
                          .formatted(value));
                })
        .orElse(ClaimPolicy.LAST_WRITE_WINS);
  }

  /** Configured dialect, or empty to detect it from the connection. */
  public Optional<SqlDialect> dialect() {
    return get("ledger.db.dialect")
        .map(
            value -> {
              try {
                return SqlDialect.valueOf(value.toUpperCase(Locale.ROOT));
              } catch (final IllegalArgumentException e) {
                throw new ConfigurationException(
                    "Unknown ledger.db.dialect '%s'; expected postgresql or ansi".formatted(value),
                    e);
              }
            });
  }

  public boolean reportingRequired() {
    return getBoolean("ledger.reporting.required", true);
  }

  public boolean resumable() {
    return getBoolean("ledger.resumable", true);
  }

  public boolean createSchema() {
    return getBoolean("ledger.schema.create", false);
  }

  public Duration renewalMargin() {
    final var seconds =
        getInt(
            "ledger.identity.renewal-margin.seconds",
            (int) CredentialProvider.DEFAULT_RENEWAL_MARGIN.toSeconds());
    if (seconds < 0)
      throw new ConfigurationException(
          "ledger.identity.renewal-margin.seconds must not be negative");
    return Duration.ofSeconds(seconds);
  }

  public Duration azTimeout() {
    return Duration.ofSeconds(
        getInt(
            "ledger.identity.az-timeout.seconds",
            (int) AzureCliTokenSource.DEFAULT_TIMEOUT.toSeconds()));
  }

  /** Hikari rejects connection timeouts under 250 ms. */
  public Duration connectionTimeout() {
    final var millis = getInt("ledger.pool.connection-timeout.millis", 30_000);
    if (millis < MIN_CONNECTION_TIMEOUT_MILLIS)
      throw new ConfigurationException(
          "ledger.pool.connection-timeout.millis must be at least "
              + MIN_CONNECTION_TIMEOUT_MILLIS);
    return Duration.ofMillis(millis);
  }

  public Duration gracePeriod() {
    return Duration.ofSeconds(getInt("ledger.pool.grace-period.seconds", 60));
  }

  /** Retry policy for creating the pool; a single attempt unless configured. */
  public Retry.Policy connectRetryPolicy() {
    final var attempts = getInt("ledger.connect.retry.attempts", 1);
    final var delay = getInt("ledger.connect.retry.delay.millis", 500);
    try {
      return attempts <= 1 ? Retry.Policy.none() : Retry.Policy.exponential(attempts, delay);
    } catch (final IllegalArgumentException e) {
      throw new ConfigurationException("Invalid connect retry settings", e);
    }
  }

  public JobStateStore jobStateStore() {
    return new JobStateStore(dialect().orElse(null), claimPolicy());
  }

  public DataSourceFactory dataSourceFactory() {
    final var size = getInt("ledger.pool.size", 4);
    if (size < 1) throw new ConfigurationException("ledger.pool.size must be at least 1");
    final var sslMode =
        get("ledger.db.sslmode")
            .orElse(mode() == ConnectionMode.MANAGED_IDENTITY ? "require" : null);
    return new HikariDataSourceFactory(size, connectionTimeout(), sslMode, "detection-ledger");
  }

  /**
   * Builds the connection target for the configured mode, using the Azure CLI for managed
   * identities.
   *
   * @return the target
   * @throws ConfigurationException if a setting the mode needs is missing or invalid
   */
  public ConnectionTarget connectionTarget() {
    return connectionTarget(
        new AzureCliTokenSource(
            new ProcessCommandRunner(), azTimeout(), ZoneId.systemDefault(), new ObjectMapper()));
  }

  /**
   * Builds the connection target for the configured mode.
   *
   * @param tokenSource issues tokens in managed-identity mode; unused otherwise
   * @return the target
   * @throws ConfigurationException if a setting the mode needs is missing or invalid
   */
  public ConnectionTarget connectionTarget(final TokenSource tokenSource) {
    final var mode = mode();
    logger.log(INFO, "Database login mode: {0}", mode.settingValue());
    return switch (mode) {
      case STATIC -> new StaticCredentials(
          require("ledger.db.host"),
          getInt("ledger.db.port", 0),
          require("ledger.db.name"),
          require("ledger.db.user"),
          require("ledger.db.password"));
      case SECRETS_MANAGER -> secretTarget();
      case MANAGED_IDENTITY -> new ManagedIdentity(
          require("ledger.db.host"),
          getInt("ledger.db.port", 0),
          require("ledger.db.user"),
          require("ledger.db.name"),
          CredentialProvider.builder()
              .tokenSource(tokenSource)
              .identity(require("ledger.identity.client-id"))
              .renewalMargin(renewalMargin())
              .build());
    };
  }

  private ConnectionTarget secretTarget() {
    final var secretId = require("ledger.db.secret.id");
    try (var provider = new SecretsManagerProvider()) {
      final var secret = SecretHelper.getDbSecret(provider, secretId);
      final var fromSecret = StaticCredentials.fromSecret(secret);
      // settings override what the secret carries, e.g. a proxy host in front of RDS
      return new StaticCredentials(
          get("ledger.db.host").orElse(fromSecret.host()),
          getInt("ledger.db.port", fromSecret.port()),
          get("ledger.db.name")
              .or(() -> Optional.ofNullable(fromSecret.database()))
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          "Secret %s has no dbname and ledger.db.name is not set"
                              .formatted(secretId))),
          fromSecret.username(),
          fromSecret.password());
    }
  }

  /**
   * Opens the session manager for these settings, retrying transient connection failures when
   * {@code ledger.connect.retry.attempts} is above one.
   *
   * @param target where to connect
   * @return an open session manager owned by the caller
   */
  public SessionManager openSessions(final ConnectionTarget target) {
    final var factory = dataSourceFactory();
    final var grace = gracePeriod();
    return Retry.onException(
        () -> SessionManager.builder().target(target).factory(factory).gracePeriod(grace).build(),
        Retry::isTransientConnectionError,
        () -> logger.log(INFO, "Retrying connection to the ledger database"),
        connectRetryPolicy());
  }
}
