package com.checkout.dwolla.client;

import com.checkout.dwolla.exception.AuthException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link DwollaClient} backed by the OAuth2 client-credentials grant.
 *
 * <p>Tokens are requested from {@code {rootUrl}/token} with HTTP Basic client authentication
 * and cached until {@value #REFRESH_MARGIN_SECONDS} seconds before they expire. Token reads
 * and refreshes are serialized on this instance; since tokens live for an hour, contention
 * only happens around a refresh.
 */
public class DwollaClientImpl implements DwollaClient {

  private static final Logger LOG = LoggerFactory.getLogger(DwollaClientImpl.class);

  static final long REFRESH_MARGIN_SECONDS = 60;
  private static final Duration REFRESH_MARGIN = Duration.ofSeconds(REFRESH_MARGIN_SECONDS);

  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Environment environment;
  private final String rootUrl;
  private final String clientId;
  private final String clientSecret;

  private AccessToken cachedToken;

  public DwollaClientImpl(RestTemplate restTemplate, ObjectMapper objectMapper, Clock clock,
      Environment environment, String clientId, String clientSecret) {
    this(restTemplate, objectMapper, clock, environment, null, clientId, clientSecret);
  }

  /**
   * @param rootUrlOverride replaces the environment's root URL when not blank, e.g. to go
   *     through a proxy
   */
  public DwollaClientImpl(RestTemplate restTemplate, ObjectMapper objectMapper, Clock clock,
      Environment environment, String rootUrlOverride, String clientId, String clientSecret) {
    if (environment == null) {
      throw new IllegalArgumentException("Dwolla environment is required");
    }
    if (clientId == null || clientId.isBlank()) {
      throw new IllegalArgumentException("Dwolla client ID is required");
    }
    if (clientSecret == null || clientSecret.isBlank()) {
      throw new IllegalArgumentException("Dwolla client secret is required");
    }
    this.restTemplate = restTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.environment = environment;
    this.rootUrl = stripTrailingSlash(
        rootUrlOverride == null || rootUrlOverride.isBlank()
            ? environment.getRootUrl() : rootUrlOverride);
    this.clientId = clientId;
    this.clientSecret = clientSecret;

    LOG.info("Dwolla client initialized: environment={}, rootUrl={}",
        environment.getName(), rootUrl);
  }

  @Override
  public synchronized String token() {
    Instant now = clock.instant();
    if (cachedToken == null || cachedToken.expiresWithin(now, REFRESH_MARGIN)) {
      cachedToken = requestToken(now);
    }
    return cachedToken.value();
  }

  @Override
  public String rootUrl() {
    return rootUrl;
  }

  public Environment getEnvironment() {
    return environment;
  }

  private AccessToken requestToken(Instant now) {
    HttpHeaders headers = new HttpHeaders();
    headers.setBasicAuth(clientId, clientSecret);
    headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));

    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "client_credentials");

    ResponseEntity<byte[]> response;
    try {
      response = restTemplate.exchange(URI.create(rootUrl + "/token"), HttpMethod.POST,
          new HttpEntity<>(form, headers), byte[].class);
    } catch (RestClientResponseException e) {
      int status = e.getStatusCode().value();
      LOG.warn("event=dwolla.token_rejected status={}", status);
      if (status == 400 || status == 401) {
        throw new AuthException("invalid client credentials");
      }
      throw new AuthException("token request failed: " + status + " " + e.getStatusText());
    } catch (ResourceAccessException e) {
      throw new AuthException("dwolla token endpoint is unreachable", e);
    } catch (RestClientException e) {
      throw new AuthException("failed to request auth token", e);
    }

    TokenGrant grant;
    try {
      byte[] body = response.getBody();
      grant = objectMapper.readValue(body == null ? new byte[0] : body, TokenGrant.class);
    } catch (IOException e) {
      throw new AuthException("error parsing token response", e);
    }
    if (grant.getAccessToken() == null || grant.getAccessToken().isBlank()) {
      throw new AuthException("token response carried no access_token");
    }

    LOG.info("event=dwolla.token_refreshed environment={} expiresInSeconds={}",
        environment.getName(), grant.getExpiresIn());
    return new AccessToken(grant.getAccessToken(), now.plusSeconds(grant.getExpiresIn()));
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
