package com.checkout.dwolla.exception;

/**
 * Thrown when a payload cannot be written to, or read from, JSON.
 */
public class SerializationException extends DwollaException {

  public SerializationException(String message) {
    super(message);
  }

  public SerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
