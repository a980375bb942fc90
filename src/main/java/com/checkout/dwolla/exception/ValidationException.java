package com.checkout.dwolla.exception;

/**
 * Thrown on HTTP 400: the resource already exists or the payload failed vendor validation.
 */
public class ValidationException extends DwollaApiException {

  public ValidationException(String message, String responseBody) {
    super(message, 400, responseBody);
  }
}
