package com.checkout.dwolla.logging;

import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

/**
 * Logs every call made to Dwolla: method, URL, status and latency.
 *
 * <p>The call runs with a correlation ID in the SLF4J MDC. A correlation ID the caller already
 * put in the MDC is reused; otherwise one is generated. Only the keys added here are removed
 * afterwards, so the caller's own MDC context survives the call.
 */
public class RequestLoggingInterceptor implements ClientHttpRequestInterceptor {

  private static final Logger LOG = LoggerFactory.getLogger(RequestLoggingInterceptor.class);

  static final String CORRELATION_ID = "correlationId";

  @Override
  public ClientHttpResponse intercept(HttpRequest request, byte[] body,
      ClientHttpRequestExecution execution) throws IOException {
    boolean ownsCorrelationId = MDC.get(CORRELATION_ID) == null;
    if (ownsCorrelationId) {
      MDC.put(CORRELATION_ID, UUID.randomUUID().toString());
    }
    MDC.put("httpMethod", String.valueOf(request.getMethod()));
    MDC.put("httpUrl", request.getURI().toString());

    long startTime = System.currentTimeMillis();
    String status = "none";
    try {
      ClientHttpResponse response = execution.execute(request, body);
      status = String.valueOf(response.getStatusCode().value());
      return response;
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      MDC.put("httpStatus", status);
      MDC.put("durationMs", String.valueOf(duration));

      LOG.info("{} {} {} {}ms", request.getMethod(), request.getURI(), status, duration);

      MDC.remove("httpMethod");
      MDC.remove("httpUrl");
      MDC.remove("httpStatus");
      MDC.remove("durationMs");
      if (ownsCorrelationId) {
        MDC.remove(CORRELATION_ID);
      }
    }
  }
}
