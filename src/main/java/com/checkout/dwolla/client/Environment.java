package com.checkout.dwolla.client;

import java.util.Locale;

/**
 * The two Dwolla environments and the root URL each one is served from.
 */
public enum Environment {

  PRODUCTION("production", "https://api.dwolla.com"),
  SANDBOX("sandbox", "https://api-sandbox.dwolla.com");

  private final String name;
  private final String rootUrl;

  Environment(String name, String rootUrl) {
    this.name = name;
    this.rootUrl = rootUrl;
  }

  public String getName() {
    return name;
  }

  public String getRootUrl() {
    return rootUrl;
  }

  /**
   * Resolves {@code "production"} or {@code "sandbox"}, ignoring case.
   *
   * @throws IllegalArgumentException for any other name
   */
  public static Environment fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      for (Environment environment : values()) {
        if (environment.name.equals(normalized)) {
          return environment;
        }
      }
    }
    throw new IllegalArgumentException("Unknown Dwolla environment: " + name
        + " (expected 'production' or 'sandbox')");
  }
}
