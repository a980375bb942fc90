package com.checkout.dwolla.client;

/**
 * Credentials and location of the Dwolla API, shared by every resource module.
 *
 * <p>Implementations must be safe for concurrent use.
 */
public interface DwollaClient {

  /**
   * Returns a bearer token valid for at least the next request, fetching or refreshing it
   * when needed.
   *
   * @throws com.checkout.dwolla.exception.AuthException if the credentials are rejected or the
   *     token endpoint cannot be reached
   */
  String token();

  /**
   * Returns the root URL of the configured environment, without a trailing slash. Fixed for
   * the lifetime of the client.
   */
  String rootUrl();
}
