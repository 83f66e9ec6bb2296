package com.example.detectionledger.core.jdbc;

import java.util.Objects;

/**
 * Fully resolved connection parameters for one PostgreSQL database.
 *
 * @param host database host name or address
 * @param port database port number
 * @param database database name
 * @param username login role
 * @param password static password or a live bearer token
 */
public record ConnectionDescriptor(
    String host, int port, String database, String username, String password) {

  public static final int DEFAULT_PORT = 5432;

  public ConnectionDescriptor {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    if (port <= 0) port = DEFAULT_PORT;
  }

  public String jdbcUrl() {
    return "jdbc:postgresql://%s:%d/%s".formatted(host, port, database);
  }

  ConnectionDescriptor withPassword(final String newPassword) {
    return new ConnectionDescriptor(host, port, database, username, newPassword);
  }

  @Override
  public String toString() {
    return "ConnectionDescriptor[url=%s, username=%s, password=****]"
        .formatted(jdbcUrl(), username);
  }
}
