package com.example.detectionledger.core.jdbc;

import com.example.detectionledger.core.credentials.CredentialProvider;
import java.util.Optional;

/**
 * Login whose password is a token issued for a managed identity. Every resolution goes through the
 * {@link CredentialProvider}, so an expiring token is renewed before it is handed out.
 *
 * @param hostname database host name
 * @param port database port, 0 for the default
 * @param username database role mapped to the identity
 * @param database database name
 * @param credentials token cache for the identity
 */
public record ManagedIdentity(
    String hostname, int port, String username, String database, CredentialProvider credentials)
    implements ConnectionTarget {

  @Override
  public ConnectionDescriptor resolve() {
    return new ConnectionDescriptor(
        hostname, port, database, username, credentials.currentToken().value());
  }

  @Override
  public Optional<ConnectionDescriptor> refresh(final ConnectionDescriptor current) {
    final var token = credentials.currentToken().value();
    if (token.equals(current.password())) return Optional.empty();
    return Optional.of(current.withPassword(token));
  }
}
