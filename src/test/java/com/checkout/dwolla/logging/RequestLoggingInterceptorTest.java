package com.checkout.dwolla.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

@DisplayName("RequestLoggingInterceptor")
class RequestLoggingInterceptorTest {

  private static final String URL = "https://api-sandbox.example.com/customers";

  private final List<String> seenCorrelationIds = new ArrayList<>();
  private RestTemplate restTemplate;
  private MockRestServiceServer mockServer;

  @BeforeEach
  void setUp() {
    ClientHttpRequestInterceptor capture = (request, body, execution) -> {
      seenCorrelationIds.add(MDC.get(RequestLoggingInterceptor.CORRELATION_ID));
      return execution.execute(request, body);
    };
    restTemplate = new RestTemplate();
    restTemplate.getInterceptors().add(new RequestLoggingInterceptor());
    restTemplate.getInterceptors().add(capture);
    mockServer = MockRestServiceServer.bindTo(restTemplate).build();
  }

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  @DisplayName("Should run the call under a generated correlation ID and clear it afterwards")
  void shouldGenerateCorrelationId() {
    // given
    mockServer.expect(requestTo(URL)).andRespond(withSuccess());

    // when
    restTemplate.getForEntity(URL, String.class);

    // then
    assertNotNull(seenCorrelationIds.get(0));
    assertNull(MDC.get(RequestLoggingInterceptor.CORRELATION_ID));
    assertNull(MDC.get("httpMethod"));
    assertNull(MDC.get("durationMs"));
  }

  @Test
  @DisplayName("Should keep the caller's correlation ID")
  void shouldReuseCallerCorrelationId() {
    // given
    MDC.put(RequestLoggingInterceptor.CORRELATION_ID, "caller-id");
    mockServer.expect(requestTo(URL)).andRespond(withSuccess());

    // when
    restTemplate.getForEntity(URL, String.class);

    // then
    assertEquals("caller-id", seenCorrelationIds.get(0));
    assertEquals("caller-id", MDC.get(RequestLoggingInterceptor.CORRELATION_ID));
  }

  @Test
  @DisplayName("Should clean up the MDC when the call fails")
  void shouldCleanUpOnError() {
    mockServer.expect(requestTo(URL)).andRespond(withServerError());

    assertThrows(HttpServerErrorException.class,
        () -> restTemplate.getForEntity(URL, String.class));

    assertNull(MDC.get(RequestLoggingInterceptor.CORRELATION_ID));
    assertNull(MDC.get("httpStatus"));
  }
}
