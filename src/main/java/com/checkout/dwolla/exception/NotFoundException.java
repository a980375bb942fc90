package com.checkout.dwolla.exception;

/**
 * Thrown on HTTP 404.
 *
 * <p>{@link #getResource()} names the resource the request addressed (for example
 * {@code "customer"}), independently of the message wording.
 */
public class NotFoundException extends DwollaApiException {

  private final String resource;

  public NotFoundException(String message, String resource, String responseBody) {
    super(message, 404, responseBody);
    this.resource = resource;
  }

  public String getResource() {
    return resource;
  }
}
