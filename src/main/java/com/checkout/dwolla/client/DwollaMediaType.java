package com.checkout.dwolla.client;

import org.springframework.http.MediaType;

/**
 * Vendor media type used for both {@code Accept} and {@code Content-Type}.
 */
public final class DwollaMediaType {

  public static final String HAL_JSON_VALUE = "application/vnd.dwolla.v1.hal+json";
  public static final MediaType HAL_JSON = MediaType.parseMediaType(HAL_JSON_VALUE);

  private DwollaMediaType() {
  }
}
