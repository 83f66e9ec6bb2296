package com.example.detectionledger.core.credentials;

/**
 * Database login stored in AWS Secrets Manager, in the layout RDS uses for managed secrets.
 *
 * @param username database username
 * @param password database password
 * @param engine database engine identifier (e.g., postgres)
 * @param host database host name or address
 * @param port database port number
 * @param dbname database name
 */
public record DbSecret(
    String username, String password, String engine, String host, int port, String dbname) {

  @Override
  public String toString() {
    return "DbSecret[username=%s, password=****, engine=%s, host=%s, port=%d, dbname=%s]"
        .formatted(username, engine, host, port, dbname);
  }
}
