package com.example.detectionledger.core.credentials;

import com.example.detectionledger.core.AuthenticationException;

/**
 * Identity backend able to exchange an identity reference for a database token. Managed-identity
 * token exchange is the production implementation; any bearer-credential source fits.
 */
@FunctionalInterface
public interface TokenSource {
  /**
   * Obtains a fresh token for the given identity.
   *
   * @param identity client id or other reference understood by the backend
   * @return the issued token with its absolute expiry
   * @throws AuthenticationException if the backend refuses or cannot be reached
   */
  AccessToken acquire(final String identity);
}
