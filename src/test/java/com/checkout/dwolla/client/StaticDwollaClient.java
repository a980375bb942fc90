package com.checkout.dwolla.client;

/**
 * Test {@link DwollaClient} with a fixed token and root URL.
 */
public class StaticDwollaClient implements DwollaClient {

  public static final String ROOT_URL = "https://api-sandbox.example.com";
  public static final String TOKEN = "test-token";

  private final String rootUrl;
  private final String token;

  public StaticDwollaClient() {
    this(ROOT_URL, TOKEN);
  }

  public StaticDwollaClient(String rootUrl, String token) {
    this.rootUrl = rootUrl;
    this.token = token;
  }

  @Override
  public String token() {
    return token;
  }

  @Override
  public String rootUrl() {
    return rootUrl;
  }
}
