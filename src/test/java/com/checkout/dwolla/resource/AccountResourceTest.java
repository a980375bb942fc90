package com.checkout.dwolla.resource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.checkout.dwolla.client.DwollaMediaType;
import com.checkout.dwolla.client.DwollaRequestExecutor;
import com.checkout.dwolla.client.JsonMapping;
import com.checkout.dwolla.client.StaticDwollaClient;
import com.checkout.dwolla.exception.AuthorizationException;
import com.checkout.dwolla.exception.DwollaException;
import com.checkout.dwolla.model.Account;
import com.checkout.dwolla.model.FundingSource;
import com.checkout.dwolla.model.Link;
import com.checkout.dwolla.model.Transfer;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

@DisplayName("AccountResource")
class AccountResourceTest {

  private static final String ROOT = StaticDwollaClient.ROOT_URL;
  private static final String ACCOUNT_URL = ROOT + "/accounts/acc-1";

  private MockRestServiceServer mockServer;
  private AccountResource accounts;

  @BeforeEach
  void setUp() {
    RestTemplate restTemplate = new RestTemplate();
    mockServer = MockRestServiceServer.createServer(restTemplate);
    accounts = new AccountResource(new DwollaRequestExecutor(new StaticDwollaClient(),
        restTemplate, JsonMapping.newObjectMapper()));
  }

  private Account account() {
    Account account = new Account();
    account.setId("acc-1");
    account.getLinks().put("self", Link.to(ACCOUNT_URL));
    return account;
  }

  @Nested
  @DisplayName("Retrieve")
  class Retrieve {

    @Test
    @DisplayName("Should follow the root's account link")
    void shouldFollowAccountLink() {
      // given
      mockServer.expect(requestTo(ROOT + "/"))
          .andExpect(method(HttpMethod.GET))
          .andExpect(header("Authorization", "Bearer " + StaticDwollaClient.TOKEN))
          .andRespond(withSuccess("{\"_links\":{\"account\":{\"href\":\"" + ACCOUNT_URL + "\"}}}",
              DwollaMediaType.HAL_JSON));
      mockServer.expect(requestTo(ACCOUNT_URL))
          .andRespond(withSuccess("{\"_links\":{\"self\":{\"href\":\"" + ACCOUNT_URL + "\"}},"
              + "\"id\":\"acc-1\",\"name\":\"Jane Corp\"}", DwollaMediaType.HAL_JSON));

      // when
      Account account = accounts.retrieve();

      // then
      assertEquals("acc-1", account.getId());
      assertEquals("Jane Corp", account.getName());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should fail when the root has no account link")
    void shouldFail_whenAccountLinkMissing() {
      mockServer.expect(requestTo(ROOT + "/"))
          .andRespond(withSuccess("{\"_links\":{}}", DwollaMediaType.HAL_JSON));

      assertThrows(DwollaException.class, () -> accounts.retrieve());
    }

    @Test
    @DisplayName("Should throw AuthorizationException on 403")
    void shouldThrow_whenForbidden() {
      mockServer.expect(requestTo(ROOT + "/")).andRespond(withStatus(HttpStatus.FORBIDDEN));

      AuthorizationException ex = assertThrows(AuthorizationException.class,
          () -> accounts.retrieve());

      assertEquals("not authorized to retrieve the account", ex.getMessage());
    }
  }

  @Nested
  @DisplayName("Related Collections")
  class RelatedCollections {

    @Test
    @DisplayName("Should list the account's funding sources through its self link")
    void shouldListFundingSources() {
      mockServer.expect(requestTo(ACCOUNT_URL + "/funding-sources"))
          .andRespond(withSuccess("{\"_embedded\":{\"funding-sources\":[{\"id\":\"fs-1\","
              + "\"type\":\"balance\",\"name\":\"Balance\"}]}}", DwollaMediaType.HAL_JSON));

      List<FundingSource> sources = accounts.listFundingSources(account());

      assertEquals(1, sources.size());
      assertEquals("balance", sources.get(0).getType());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should prefer the dedicated transfers link when present")
    void shouldPreferDedicatedLink() {
      Account account = account();
      account.getLinks().put("transfers", Link.to(ACCOUNT_URL + "/transfers?limit=25"));
      mockServer.expect(requestTo(ACCOUNT_URL + "/transfers?limit=25"))
          .andRespond(withSuccess("{\"_embedded\":{\"transfers\":[]}}",
              DwollaMediaType.HAL_JSON));

      List<Transfer> transfers = accounts.listTransfers(account);

      assertTrue(transfers.isEmpty());
      mockServer.verify();
    }
  }
}
