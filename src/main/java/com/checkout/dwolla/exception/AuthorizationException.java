package com.checkout.dwolla.exception;

/**
 * Thrown on HTTP 403: the credentials are valid but may not perform the operation.
 */
public class AuthorizationException extends DwollaApiException {

  public AuthorizationException(String message, String responseBody) {
    super(message, 403, responseBody);
  }
}
