package com.checkout.dwolla.client;

import com.checkout.dwolla.exception.AuthorizationException;
import com.checkout.dwolla.exception.DwollaApiException;
import com.checkout.dwolla.exception.NotFoundException;
import com.checkout.dwolla.exception.PassthroughException;
import com.checkout.dwolla.exception.ValidationException;

/**
 * Fixed errors for one operation, keyed by HTTP status.
 *
 * <p>Defaults: 400 → "duplicate resource or validation error", 403 → "not authorized to
 * &lt;action&gt;", 404 → "&lt;resource&gt; not found". Anything else becomes a
 * {@link PassthroughException} carrying the raw status line. Instances are immutable.
 */
public final class StatusErrors {

  static final String DEFAULT_VALIDATION_MESSAGE = "duplicate resource or validation error";

  private final String action;
  private final String resource;
  private final String validationMessage;
  private final String notFoundMessage;

  private StatusErrors(String action, String resource, String validationMessage,
      String notFoundMessage) {
    this.action = action;
    this.resource = resource;
    this.validationMessage = validationMessage;
    this.notFoundMessage = notFoundMessage;
  }

  /**
   * @param action what the operation does, phrased to follow "not authorized to", e.g.
   *     {@code "retrieve the customer"}
   * @param resource the resource the request addresses, e.g. {@code "customer"}
   */
  public static StatusErrors of(String action, String resource) {
    return new StatusErrors(action, resource, DEFAULT_VALIDATION_MESSAGE,
        resource + " not found");
  }

  public StatusErrors validationMessage(String message) {
    return new StatusErrors(action, resource, message, notFoundMessage);
  }

  public StatusErrors notFoundMessage(String message) {
    return new StatusErrors(action, resource, validationMessage, message);
  }

  public String getAction() {
    return action;
  }

  public String getResource() {
    return resource;
  }

  DwollaApiException toException(int statusCode, String statusText, String responseBody) {
    switch (statusCode) {
      case 400:
        return new ValidationException(validationMessage, responseBody);
      case 403:
        return new AuthorizationException("not authorized to " + action, responseBody);
      case 404:
        return new NotFoundException(notFoundMessage, resource, responseBody);
      default:
        return new PassthroughException(statusCode, statusText, responseBody);
    }
  }
}
