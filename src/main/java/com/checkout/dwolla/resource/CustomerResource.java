package com.checkout.dwolla.resource;

import com.checkout.dwolla.client.DwollaRequest;
import com.checkout.dwolla.client.DwollaRequestExecutor;
import com.checkout.dwolla.client.DwollaResponse;
import com.checkout.dwolla.client.StatusErrors;
import com.checkout.dwolla.exception.SerializationException;
import com.checkout.dwolla.model.Customer;
import com.checkout.dwolla.model.CustomerUpdate;
import com.checkout.dwolla.model.Document;
import com.checkout.dwolla.model.FundingSource;
import com.checkout.dwolla.model.TokenResponse;
import com.checkout.dwolla.model.Transfer;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * Customers and everything hanging off a customer: verification documents, funding sources,
 * funding-source tokens and transfers.
 *
 * <p>The 404 wording of the customer-collection calls is "account not found", as Dwolla
 * reports a missing master account there; {@link
 * com.checkout.dwolla.exception.NotFoundException#getResource()} still names the customer.
 */
public class CustomerResource {

  private static final Logger LOG = LoggerFactory.getLogger(CustomerResource.class);

  private static final String ACCOUNT_NOT_FOUND = "account not found";

  private static final StatusErrors CREATE = StatusErrors.of("create customers", "customer")
      .validationMessage("duplicate customer or validation error")
      .notFoundMessage(ACCOUNT_NOT_FOUND);
  private static final StatusErrors LIST = StatusErrors.of("list customers", "customer")
      .notFoundMessage(ACCOUNT_NOT_FOUND);
  private static final StatusErrors GET = StatusErrors.of("retrieve the customer", "customer")
      .notFoundMessage(ACCOUNT_NOT_FOUND);
  private static final StatusErrors UPDATE = StatusErrors.of("update the customer", "customer")
      .validationMessage("invalid customer update or validation error")
      .notFoundMessage(ACCOUNT_NOT_FOUND);
  private static final StatusErrors UPLOAD_DOCUMENT =
      StatusErrors.of("upload document to customer", "customer")
          .validationMessage("invalid document or validation error")
          .notFoundMessage(ACCOUNT_NOT_FOUND);
  private static final StatusErrors LIST_DOCUMENTS =
      StatusErrors.of("list customer documents", "customer")
          .notFoundMessage(ACCOUNT_NOT_FOUND);
  private static final StatusErrors GET_DOCUMENT =
      StatusErrors.of("retrieve the document", "document");
  private static final StatusErrors CREATE_FUNDING_SOURCE =
      StatusErrors.of("create funding source", "customer")
          .validationMessage("duplicate funding source or validation error. "
              + "Authorization already associated to a funding source");
  private static final StatusErrors FUNDING_SOURCES_TOKEN =
      StatusErrors.of("create a funding sources token", "customer");
  private static final StatusErrors IAV_TOKEN =
      StatusErrors.of("create an IAV token", "customer");
  private static final StatusErrors LIST_FUNDING_SOURCES =
      StatusErrors.of("list funding sources", "customer");
  private static final StatusErrors LIST_TRANSFERS =
      StatusErrors.of("list transfers", "customer");

  private final DwollaRequestExecutor executor;

  public CustomerResource(DwollaRequestExecutor executor) {
    this.executor = executor;
  }

  /**
   * Creates a customer.
   *
   * @return the new customer's ID, read from the {@code Location} header
   */
  public String create(Customer customer) {
    return create(customer, null);
  }

  /**
   * Creates a customer; Dwolla answers a repeated {@code idempotencyKey} with the original
   * result instead of creating a second customer.
   */
  public String create(Customer customer, String idempotencyKey) {
    String collectionUrl = executor.url("/customers");
    String id = executor.executeCreate(DwollaRequest.post(collectionUrl)
        .body(customer)
        .expect(HttpStatus.CREATED)
        .idempotencyKey(idempotencyKey)
        .errors(CREATE)
        .build(), collectionUrl);
    LOG.info("event=customer.created customerId={}", id);
    return id;
  }

  public List<Customer> list() {
    return executor.executeList(
        DwollaRequest.get(executor.url("/customers")).errors(LIST).build(),
        Customer.class, "customers");
  }

  public Customer get(String customerId) {
    return executor.execute(
        DwollaRequest.get(customerUrl(customerId)).errors(GET).build(), Customer.class);
  }

  /**
   * Submits a sparse patch; see {@link CustomerUpdate} for which fields select which effect.
   *
   * @return the customer as Dwolla holds it after the update
   */
  public Customer update(String customerId, CustomerUpdate update) {
    Customer updated = executor.execute(DwollaRequest.post(customerUrl(customerId))
        .body(update)
        .errors(UPDATE)
        .build(), Customer.class);
    LOG.info("event=customer.updated customerId={} status={}", customerId, updated.getStatus());
    return updated;
  }

  /**
   * Uploads a verification document as {@code multipart/form-data}. Only a 201 counts as
   * success; the response body is not inspected.
   *
   * @param documentType one of Dwolla's document types, e.g. {@code "passport"}
   * @return the document ID when Dwolla returns a {@code Location} header, otherwise
   *     {@code null}
   */
  public String uploadDocument(String customerId, Resource file, String documentType) {
    MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
    parts.add("documentType", documentType);
    parts.add("file", file);

    DwollaResponse response = executor.execute(
        DwollaRequest.post(customerUrl(customerId) + "/documents")
            .multipart(parts)
            .expect(HttpStatus.CREATED)
            .errors(UPLOAD_DOCUMENT)
            .build());
    String documentId = DwollaRequestExecutor.idFromLocation(response.getLocation(),
        executor.url("/documents"));
    LOG.info("event=customer.document_uploaded customerId={} documentType={} documentId={}",
        customerId, documentType, documentId);
    return documentId;
  }

  public String uploadDocument(String customerId, Path file, String documentType) {
    return uploadDocument(customerId, new FileSystemResource(file), documentType);
  }

  public List<Document> listDocuments(String customerId) {
    return executor.executeList(
        DwollaRequest.get(customerUrl(customerId) + "/documents").errors(LIST_DOCUMENTS).build(),
        Document.class, "documents");
  }

  public Document getDocument(String documentId) {
    return executor.execute(
        DwollaRequest.get(executor.url("/documents/" + documentId)).errors(GET_DOCUMENT).build(),
        Document.class);
  }

  /**
   * Attaches a bank account to the customer.
   *
   * @return the new funding source's ID
   */
  public String createFundingSource(String customerId, FundingSource fundingSource) {
    String id = executor.executeCreate(
        DwollaRequest.post(customerUrl(customerId) + "/funding-sources")
            .body(fundingSource)
            .expect(HttpStatus.CREATED)
            .errors(CREATE_FUNDING_SOURCE)
            .build(),
        executor.url("/funding-sources"));
    LOG.info("event=funding_source.created customerId={} fundingSourceId={}", customerId, id);
    return id;
  }

  /** Token for adding a funding source client-side with dwolla.js. */
  public String createFundingSourceToken(String customerId) {
    return requireToken(executor.execute(
        DwollaRequest.post(customerUrl(customerId) + "/funding-sources-token")
            .errors(FUNDING_SOURCES_TOKEN)
            .build(),
        TokenResponse.class), FUNDING_SOURCES_TOKEN);
  }

  /** Token for adding and instantly verifying a bank account. */
  public String createIavToken(String customerId) {
    return requireToken(executor.execute(
        DwollaRequest.post(customerUrl(customerId) + "/iav-token")
            .errors(IAV_TOKEN)
            .build(),
        TokenResponse.class), IAV_TOKEN);
  }

  /** All funding sources of the customer, removed ones included. */
  public List<FundingSource> listFundingSources(String customerId) {
    return executor.executeList(
        DwollaRequest.get(customerUrl(customerId) + "/funding-sources")
            .errors(LIST_FUNDING_SOURCES)
            .build(),
        FundingSource.class, "funding-sources");
  }

  /**
   * @param includeRemoved when false, Dwolla leaves soft-removed funding sources out
   */
  public List<FundingSource> listFundingSources(String customerId, boolean includeRemoved) {
    if (includeRemoved) {
      return listFundingSources(customerId);
    }
    return executor.executeList(
        DwollaRequest.get(customerUrl(customerId) + "/funding-sources?removed=false")
            .errors(LIST_FUNDING_SOURCES)
            .build(),
        FundingSource.class, "funding-sources");
  }

  /**
   * Lists the customer's transfers through its {@code self} link, or through
   * {@code /customers/{id}/transfers} when the customer has none.
   */
  public List<Transfer> listTransfers(Customer customer) {
    String self = customer.linkHref("self");
    String base = self != null ? self : customerUrl(customer.getId());
    return executor.executeList(
        DwollaRequest.get(base + "/transfers").errors(LIST_TRANSFERS).build(),
        Transfer.class, "transfers");
  }

  private static String requireToken(TokenResponse response, StatusErrors errors) {
    String token = response.getToken();
    if (token == null || token.isBlank()) {
      throw new SerializationException("token response carried no token to "
          + errors.getAction());
    }
    return token;
  }

  private String customerUrl(String customerId) {
    return executor.url("/customers/" + customerId);
  }
}
