package com.example.detectionledger.core.jdbc;

import com.example.detectionledger.core.credentials.DbSecret;

/**
 * Fixed username and password, given directly or read from a Secrets Manager secret.
 *
 * @param host database host name or address
 * @param port database port, 0 for the default
 * @param database database name
 * @param username login role
 * @param password login password
 */
public record StaticCredentials(
    String host, int port, String database, String username, String password)
    implements ConnectionTarget {

  public static StaticCredentials fromSecret(final DbSecret secret) {
    return new StaticCredentials(
        secret.host(), secret.port(), secret.dbname(), secret.username(), secret.password());
  }

  @Override
  public ConnectionDescriptor resolve() {
    return new ConnectionDescriptor(host, port, database, username, password);
  }

  @Override
  public String toString() {
    return "StaticCredentials[host=%s, port=%d, database=%s, username=%s, password=****]"
        .formatted(host, port, database, username);
  }
}
