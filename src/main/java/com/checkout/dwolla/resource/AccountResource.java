package com.checkout.dwolla.resource;

import com.checkout.dwolla.client.DwollaRequest;
import com.checkout.dwolla.client.DwollaRequestExecutor;
import com.checkout.dwolla.client.StatusErrors;
import com.checkout.dwolla.exception.DwollaException;
import com.checkout.dwolla.model.Account;
import com.checkout.dwolla.model.ApiRoot;
import com.checkout.dwolla.model.FundingSource;
import com.checkout.dwolla.model.Transfer;
import java.util.List;

/**
 * The master account tied to the API credentials.
 */
public class AccountResource {

  private static final StatusErrors RETRIEVE =
      StatusErrors.of("retrieve the account", "account");
  private static final StatusErrors LIST_FUNDING_SOURCES =
      StatusErrors.of("list account funding sources", "account");
  private static final StatusErrors LIST_TRANSFERS =
      StatusErrors.of("list account transfers", "account");

  private final DwollaRequestExecutor executor;

  public AccountResource(DwollaRequestExecutor executor) {
    this.executor = executor;
  }

  /**
   * Resolves the account through the API root's {@code account} link.
   */
  public Account retrieve() {
    ApiRoot root = executor.execute(
        DwollaRequest.get(executor.url("/")).errors(RETRIEVE).build(), ApiRoot.class);
    String accountUrl = root.linkHref("account");
    if (accountUrl == null) {
      throw new DwollaException("API root carried no account link");
    }
    return executor.execute(
        DwollaRequest.get(accountUrl).errors(RETRIEVE).build(), Account.class);
  }

  public List<FundingSource> listFundingSources(Account account) {
    String url = relatedUrl(account, "funding-sources");
    return executor.executeList(DwollaRequest.get(url).errors(LIST_FUNDING_SOURCES).build(),
        FundingSource.class, "funding-sources");
  }

  public List<Transfer> listTransfers(Account account) {
    String url = relatedUrl(account, "transfers");
    return executor.executeList(DwollaRequest.get(url).errors(LIST_TRANSFERS).build(),
        Transfer.class, "transfers");
  }

  private String relatedUrl(Account account, String relation) {
    String href = account.linkHref(relation);
    if (href != null) {
      return href;
    }
    String self = account.linkHref("self");
    if (self != null) {
      return self + "/" + relation;
    }
    return executor.url("/accounts/" + account.getId() + "/" + relation);
  }
}
