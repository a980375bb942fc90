package com.checkout.dwolla.exception;

/**
 * Thrown when no bearer token can be obtained, either because the client credentials were
 * rejected or because the token endpoint could not be reached.
 */
public class AuthException extends DwollaException {

  public AuthException(String message) {
    super(message);
  }

  public AuthException(String message, Throwable cause) {
    super(message, cause);
  }
}
