package com.checkout.dwolla.resource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.checkout.dwolla.client.DwollaMediaType;
import com.checkout.dwolla.client.DwollaRequestExecutor;
import com.checkout.dwolla.client.JsonMapping;
import com.checkout.dwolla.client.StaticDwollaClient;
import com.checkout.dwolla.exception.AuthorizationException;
import com.checkout.dwolla.exception.NotFoundException;
import com.checkout.dwolla.exception.ValidationException;
import com.checkout.dwolla.model.FundingSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

@DisplayName("FundingSourceResource")
class FundingSourceResourceTest {

  private static final String SOURCE_URL = StaticDwollaClient.ROOT_URL + "/funding-sources/fs-1";

  private MockRestServiceServer mockServer;
  private FundingSourceResource fundingSources;

  @BeforeEach
  void setUp() {
    RestTemplate restTemplate = new RestTemplate();
    mockServer = MockRestServiceServer.createServer(restTemplate);
    fundingSources = new FundingSourceResource(new DwollaRequestExecutor(
        new StaticDwollaClient(), restTemplate, JsonMapping.newObjectMapper()));
  }

  @Test
  @DisplayName("Should retrieve a funding source by ID")
  void shouldGetFundingSource() {
    // given
    mockServer.expect(requestTo(SOURCE_URL))
        .andExpect(method(HttpMethod.GET))
        .andRespond(withSuccess("{\"id\":\"fs-1\",\"status\":\"verified\",\"type\":\"bank\","
            + "\"bankName\":\"SANDBOX TEST BANK\",\"channels\":[\"ach\",\"real-time-payments\"]}",
            DwollaMediaType.HAL_JSON));

    // when
    FundingSource source = fundingSources.get("fs-1");

    // then
    assertEquals("verified", source.getStatus());
    assertEquals(2, source.getChannels().size());
    mockServer.verify();
  }

  @Test
  @DisplayName("Should report a missing funding source")
  void shouldThrow_whenMissing() {
    mockServer.expect(requestTo(SOURCE_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

    NotFoundException ex = assertThrows(NotFoundException.class, () -> fundingSources.get("fs-1"));

    assertEquals("funding source not found", ex.getMessage());
  }

  @Test
  @DisplayName("Should report a forbidden funding source")
  void shouldThrow_whenForbidden() {
    mockServer.expect(requestTo(SOURCE_URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

    AuthorizationException ex = assertThrows(AuthorizationException.class,
        () -> fundingSources.get("fs-1"));

    assertEquals("not authorized to retrieve the funding source", ex.getMessage());
  }

  @Test
  @DisplayName("Should soft-remove a funding source")
  void shouldRemoveFundingSource() {
    // given
    mockServer.expect(requestTo(SOURCE_URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().json("{\"removed\":true}", true))
        .andRespond(withSuccess("{\"id\":\"fs-1\",\"removed\":true}", DwollaMediaType.HAL_JSON));

    // when
    FundingSource removed = fundingSources.remove("fs-1");

    // then
    assertTrue(removed.getRemoved());
    mockServer.verify();
  }

  @Test
  @DisplayName("Should report a funding source that cannot be removed")
  void shouldThrow_whenRemoveRejected() {
    mockServer.expect(requestTo(SOURCE_URL)).andRespond(withBadRequest());

    assertThrows(ValidationException.class, () -> fundingSources.remove("fs-1"));
  }
}
