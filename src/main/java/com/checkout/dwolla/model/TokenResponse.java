package com.checkout.dwolla.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code {token, _links}} wrapper returned by the funding-source and IAV token endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenResponse extends HalResource {

  private String token;

  public String getToken() {
    return token;
  }

  public void setToken(String token) {
    this.token = token;
  }
}
