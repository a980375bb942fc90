package com.checkout.dwolla.exception;

/**
 * Thrown when the request never produced an HTTP response: DNS failure, refused connection,
 * timeout or a malformed request URL.
 */
public class NetworkException extends DwollaException {

  public NetworkException(String message, Throwable cause) {
    super(message, cause);
  }
}
