package com.checkout.dwolla.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds the {@link ObjectMapper} used for vendor payloads. Kept separate from any
 * application-wide mapper so host settings cannot change the wire format.
 */
public final class JsonMapping {

  private JsonMapping() {
  }

  public static ObjectMapper newObjectMapper() {
    return new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }
}
