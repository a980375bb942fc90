package com.checkout.dwolla.client;

import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;

/**
 * One call to the Dwolla API as a resource module declares it: method, absolute URL, optional
 * body, the status that means success and the errors for the rest.
 *
 * <p>JSON bodies are any Jackson-serializable object. Multipart bodies are passed through to
 * the HTTP layer untouched.
 */
public final class DwollaRequest {

  private final HttpMethod method;
  private final String url;
  private final Object body;
  private final MediaType contentType;
  private final HttpStatus expectedStatus;
  private final StatusErrors errors;
  private final String idempotencyKey;

  private DwollaRequest(Builder builder) {
    this.method = builder.method;
    this.url = builder.url;
    this.body = builder.body;
    this.contentType = builder.contentType;
    this.expectedStatus = builder.expectedStatus;
    this.errors = builder.errors;
    this.idempotencyKey = builder.idempotencyKey;
  }

  public static Builder get(String url) {
    return new Builder(HttpMethod.GET, url, HttpStatus.OK);
  }

  /** A POST with the vendor content type; expects 200 unless told otherwise. */
  public static Builder post(String url) {
    return new Builder(HttpMethod.POST, url, HttpStatus.OK)
        .contentType(DwollaMediaType.HAL_JSON);
  }

  public HttpMethod getMethod() {
    return method;
  }

  public String getUrl() {
    return url;
  }

  public Object getBody() {
    return body;
  }

  public MediaType getContentType() {
    return contentType;
  }

  public HttpStatus getExpectedStatus() {
    return expectedStatus;
  }

  public StatusErrors getErrors() {
    return errors;
  }

  public String getIdempotencyKey() {
    return idempotencyKey;
  }

  public boolean isMultipart() {
    return contentType != null && MediaType.MULTIPART_FORM_DATA.includes(contentType);
  }

  public static final class Builder {

    private final HttpMethod method;
    private final String url;
    private Object body;
    private MediaType contentType;
    private HttpStatus expectedStatus;
    private StatusErrors errors;
    private String idempotencyKey;

    private Builder(HttpMethod method, String url, HttpStatus expectedStatus) {
      this.method = method;
      this.url = url;
      this.expectedStatus = expectedStatus;
    }

    public Builder body(Object body) {
      this.body = body;
      return this;
    }

    public Builder multipart(MultiValueMap<String, Object> parts) {
      this.body = parts;
      this.contentType = MediaType.MULTIPART_FORM_DATA;
      return this;
    }

    public Builder contentType(MediaType contentType) {
      this.contentType = contentType;
      return this;
    }

    public Builder expect(HttpStatus expectedStatus) {
      this.expectedStatus = expectedStatus;
      return this;
    }

    public Builder errors(StatusErrors errors) {
      this.errors = errors;
      return this;
    }

    public Builder idempotencyKey(String idempotencyKey) {
      this.idempotencyKey = idempotencyKey;
      return this;
    }

    public DwollaRequest build() {
      if (errors == null) {
        throw new IllegalStateException("Status errors are required for " + method + " " + url);
      }
      return new DwollaRequest(this);
    }
  }
}
