package com.checkout.dwolla.resource;

import com.checkout.dwolla.client.DwollaRequest;
import com.checkout.dwolla.client.DwollaRequestExecutor;
import com.checkout.dwolla.client.StatusErrors;
import com.checkout.dwolla.model.OnDemandAuthorization;
import com.checkout.dwolla.model.Transfer;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;

/**
 * Transfers and on-demand authorizations.
 */
public class TransferResource {

  private static final Logger LOG = LoggerFactory.getLogger(TransferResource.class);

  private static final StatusErrors CREATE = StatusErrors.of("create transfers", "account")
      .validationMessage("invalid transfer or validation error");
  private static final StatusErrors GET = StatusErrors.of("retrieve the transfer", "transfer");
  private static final StatusErrors CANCEL = StatusErrors.of("cancel the transfer", "transfer")
      .validationMessage("transfer cannot be cancelled or validation error");
  private static final StatusErrors ON_DEMAND =
      StatusErrors.of("create on-demand authorizations", "account");

  private final DwollaRequestExecutor executor;

  public TransferResource(DwollaRequestExecutor executor) {
    this.executor = executor;
  }

  /**
   * Initiates a transfer.
   *
   * @return the new transfer's ID, read from the {@code Location} header
   */
  public String create(Transfer transfer) {
    return create(transfer, null);
  }

  public String create(Transfer transfer, String idempotencyKey) {
    String collectionUrl = executor.url("/transfers");
    String id = executor.executeCreate(DwollaRequest.post(collectionUrl)
        .body(transfer)
        .expect(HttpStatus.CREATED)
        .idempotencyKey(idempotencyKey)
        .errors(CREATE)
        .build(), collectionUrl);
    LOG.info("event=transfer.created transferId={} amount={}", id, transfer.getAmount());
    return id;
  }

  public Transfer get(String transferId) {
    return executor.execute(
        DwollaRequest.get(transferUrl(transferId)).errors(GET).build(), Transfer.class);
  }

  /**
   * Cancels a transfer that is still pending.
   */
  public Transfer cancel(String transferId) {
    Transfer cancelled = executor.execute(DwollaRequest.post(transferUrl(transferId))
        .body(Map.of("status", "cancelled"))
        .errors(CANCEL)
        .build(), Transfer.class);
    LOG.info("event=transfer.cancelled transferId={}", transferId);
    return cancelled;
  }

  public OnDemandAuthorization createOnDemandAuthorization() {
    return executor.execute(
        DwollaRequest.post(executor.url("/on-demand-authorizations")).errors(ON_DEMAND).build(),
        OnDemandAuthorization.class);
  }

  private String transferUrl(String transferId) {
    return executor.url("/transfers/" + transferId);
  }
}
