package com.checkout.dwolla.resource;

import com.checkout.dwolla.client.DwollaRequest;
import com.checkout.dwolla.client.DwollaRequestExecutor;
import com.checkout.dwolla.client.StatusErrors;
import com.checkout.dwolla.model.FundingSource;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Funding sources addressed directly by ID.
 */
public class FundingSourceResource {

  private static final Logger LOG = LoggerFactory.getLogger(FundingSourceResource.class);

  private static final StatusErrors GET =
      StatusErrors.of("retrieve the funding source", "funding source");
  private static final StatusErrors REMOVE =
      StatusErrors.of("remove the funding source", "funding source")
          .validationMessage("funding source already removed or validation error");

  private final DwollaRequestExecutor executor;

  public FundingSourceResource(DwollaRequestExecutor executor) {
    this.executor = executor;
  }

  public FundingSource get(String fundingSourceId) {
    return executor.execute(
        DwollaRequest.get(fundingSourceUrl(fundingSourceId)).errors(GET).build(),
        FundingSource.class);
  }

  /**
   * Soft-removes the funding source. Dwolla keeps it, with {@code removed = true}.
   */
  public FundingSource remove(String fundingSourceId) {
    FundingSource removed = executor.execute(
        DwollaRequest.post(fundingSourceUrl(fundingSourceId))
            .body(Map.of("removed", true))
            .errors(REMOVE)
            .build(),
        FundingSource.class);
    LOG.info("event=funding_source.removed fundingSourceId={}", fundingSourceId);
    return removed;
  }

  private String fundingSourceUrl(String fundingSourceId) {
    return executor.url("/funding-sources/" + fundingSourceId);
  }
}
