package com.checkout.dwolla.exception;

/**
 * Base type for every failure surfaced by the Dwolla client.
 *
 * <p>All client exceptions are unchecked. Callers that only care whether a call succeeded can
 * catch this type; callers that need to react to a specific outcome catch the subclass.
 */
public class DwollaException extends RuntimeException {

  public DwollaException(String message) {
    super(message);
  }

  public DwollaException(String message, Throwable cause) {
    super(message, cause);
  }
}
