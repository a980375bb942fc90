package com.checkout.dwolla.client;

import com.checkout.dwolla.exception.AuthException;
import com.checkout.dwolla.exception.DwollaApiException;
import com.checkout.dwolla.exception.DwollaException;
import com.checkout.dwolla.exception.NetworkException;
import com.checkout.dwolla.exception.SerializationException;
import com.checkout.dwolla.model.HalCollection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends {@link DwollaRequest}s and turns the outcome into a value or a typed exception.
 *
 * <p>Every call gets a fresh bearer token from the {@link DwollaClient} and the vendor
 * {@code Accept}/{@code Content-Type} headers. JSON is written and read with this executor's
 * own {@link ObjectMapper}, so the {@link RestTemplate} only ever moves bytes (or multipart
 * parts) and never decides how a payload is decoded.
 */
public class DwollaRequestExecutor {

  private static final Logger LOG = LoggerFactory.getLogger(DwollaRequestExecutor.class);

  static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

  private final DwollaClient client;
  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;

  public DwollaRequestExecutor(DwollaClient client, RestTemplate restTemplate,
      ObjectMapper objectMapper) {
    this.client = client;
    this.restTemplate = restTemplate;
    this.objectMapper = objectMapper;
  }

  /** Absolute URL for a path relative to the API root, e.g. {@code "/customers"}. */
  public String url(String path) {
    return client.rootUrl() + path;
  }

  /**
   * Sends the request and returns the response when it has the expected status.
   *
   * @throws AuthException if no token can be obtained
   * @throws DwollaApiException for any other status
   * @throws NetworkException if no response was received
   * @throws SerializationException if the body cannot be written as JSON
   */
  public DwollaResponse execute(DwollaRequest request) {
    String action = request.getErrors().getAction();

    String token;
    try {
      token = client.token();
    } catch (AuthException e) {
      throw new AuthException("failed to get auth token to " + action, e);
    }

    URI uri;
    try {
      uri = URI.create(request.getUrl());
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new NetworkException("malformed request URL to " + action + ": " + request.getUrl(),
          e);
    }

    HttpHeaders headers = new HttpHeaders();
    headers.setBearerAuth(token);
    headers.setAccept(List.of(DwollaMediaType.HAL_JSON));
    if (request.getContentType() != null) {
      headers.setContentType(request.getContentType());
    }
    if (request.getIdempotencyKey() != null) {
      headers.set(IDEMPOTENCY_KEY_HEADER, request.getIdempotencyKey());
    }
    Object body = request.getBody();
    if (body != null && !request.isMultipart()) {
      body = writeJson(body, action);
    }

    LOG.debug("event=dwolla.request action=\"{}\" method={} url={}",
        action, request.getMethod(), uri);

    ResponseEntity<byte[]> response;
    try {
      response = restTemplate.exchange(uri, request.getMethod(),
          new HttpEntity<>(body, headers), byte[].class);
    } catch (RestClientResponseException e) {
      throw failure(request, e.getStatusCode().value(), e.getStatusText(),
          e.getResponseBodyAsString());
    } catch (ResourceAccessException e) {
      throw new NetworkException("failed to make request to dwolla api to " + action, e);
    } catch (RestClientException e) {
      throw new NetworkException("error sending request to dwolla api to " + action, e);
    }

    int status = response.getStatusCode().value();
    DwollaResponse result = new DwollaResponse(status, response.getHeaders(), response.getBody());
    if (status != request.getExpectedStatus().value()) {
      HttpStatus resolved = HttpStatus.resolve(status);
      throw failure(request, status,
          resolved == null ? "Unknown Status" : resolved.getReasonPhrase(),
          result.bodyAsString());
    }
    return result;
  }

  /** Sends the request and decodes the body into {@code type}. */
  public <T> T execute(DwollaRequest request, Class<T> type) {
    DwollaResponse response = execute(request);
    return readJson(response.getBody(), objectMapper.constructType(type),
        request.getErrors().getAction());
  }

  /**
   * Sends the request and returns the entities embedded under {@code collection}. A missing
   * or empty collection yields an empty list.
   */
  public <T> List<T> executeList(DwollaRequest request, Class<T> elementType,
      String collection) {
    DwollaResponse response = execute(request);
    JavaType envelopeType = objectMapper.getTypeFactory()
        .constructParametricType(HalCollection.class, elementType);
    HalCollection<T> envelope = readJson(response.getBody(), envelopeType,
        request.getErrors().getAction());
    return envelope.embedded(collection);
  }

  /**
   * Sends a creation request and returns the new resource's ID taken from the
   * {@code Location} header: the header with {@code collectionUrl + "/"} stripped, or its last
   * path segment when it does not start with that prefix.
   */
  public String executeCreate(DwollaRequest request, String collectionUrl) {
    DwollaResponse response = execute(request);
    String id = idFromLocation(response.getLocation(), collectionUrl);
    if (id == null) {
      throw new DwollaException("response to " + request.getErrors().getAction()
          + " carried no Location header");
    }
    return id;
  }

  /**
   * Resource ID carried by a {@code Location} header, or {@code null} when the header is
   * missing or blank.
   */
  public static String idFromLocation(String location, String collectionUrl) {
    if (location == null || location.isBlank()) {
      return null;
    }
    String prefix = collectionUrl + "/";
    if (location.startsWith(prefix)) {
      return location.substring(prefix.length());
    }
    return location.substring(location.lastIndexOf('/') + 1);
  }

  private DwollaApiException failure(DwollaRequest request, int status, String statusText,
      String responseBody) {
    LOG.warn("event=dwolla.request_failed action=\"{}\" status={} url={}",
        request.getErrors().getAction(), status, request.getUrl());
    return request.getErrors().toException(status, statusText, responseBody);
  }

  private byte[] writeJson(Object body, String action) {
    try {
      return objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new SerializationException("error marshalling request body to " + action, e);
    }
  }

  private <T> T readJson(byte[] body, JavaType type, String action) {
    T value;
    try {
      value = objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new SerializationException("error parsing JSON response to " + action, e);
    }
    if (value == null) {
      throw new SerializationException("empty JSON response to " + action);
    }
    return value;
  }
}
