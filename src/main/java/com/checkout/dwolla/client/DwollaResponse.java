package com.checkout.dwolla.client;

import java.nio.charset.StandardCharsets;
import org.springframework.http.HttpHeaders;

/**
 * A successful response: status, headers and the raw body bytes.
 */
public final class DwollaResponse {

  private final int statusCode;
  private final HttpHeaders headers;
  private final byte[] body;

  DwollaResponse(int statusCode, HttpHeaders headers, byte[] body) {
    this.statusCode = statusCode;
    this.headers = headers;
    this.body = body == null ? new byte[0] : body;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public HttpHeaders getHeaders() {
    return headers;
  }

  public byte[] getBody() {
    return body;
  }

  public String getLocation() {
    return headers.getFirst(HttpHeaders.LOCATION);
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }
}
