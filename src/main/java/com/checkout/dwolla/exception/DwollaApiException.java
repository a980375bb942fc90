package com.checkout.dwolla.exception;

/**
 * Thrown when the Dwolla API answered, but not with the status the operation expects.
 *
 * <p>Carries the HTTP status code and the raw response body so callers can log the vendor's
 * own error document.
 */
public class DwollaApiException extends DwollaException {

  private final int statusCode;
  private final String responseBody;

  public DwollaApiException(String message, int statusCode, String responseBody) {
    super(message);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }
}
