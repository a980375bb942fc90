package com.checkout.dwolla.exception;

/**
 * Thrown for any status the operation has no fixed error for. The message is the raw status
 * line, e.g. {@code "500 Internal Server Error"}.
 */
public class PassthroughException extends DwollaApiException {

  private final String statusText;

  public PassthroughException(int statusCode, String statusText, String responseBody) {
    super(statusCode + " " + statusText, statusCode, responseBody);
    this.statusText = statusText;
  }

  public String getStatusText() {
    return statusText;
  }
}
