package com.checkout.dwolla.service;

import com.checkout.dwolla.model.Account;
import com.checkout.dwolla.model.Customer;
import com.checkout.dwolla.model.CustomerUpdate;
import com.checkout.dwolla.model.Document;
import com.checkout.dwolla.model.FundingSource;
import com.checkout.dwolla.model.OnDemandAuthorization;
import com.checkout.dwolla.model.Transfer;
import java.nio.file.Path;
import java.util.List;

/**
 * Single entry point to the Dwolla API for calling applications.
 *
 * <p>Every method is one blocking round trip (two for {@link #retrieveAccount()}). Failures are
 * reported as subclasses of {@link com.checkout.dwolla.exception.DwollaException}:
 * <ul>
 *   <li>{@code ValidationException} for HTTP 400</li>
 *   <li>{@code AuthorizationException} for HTTP 403</li>
 *   <li>{@code NotFoundException} for HTTP 404</li>
 *   <li>{@code PassthroughException} for any other unexpected status</li>
 *   <li>{@code NetworkException}, {@code SerializationException} and {@code AuthException}
 *       for failures that never reached a status code</li>
 * </ul>
 */
public interface DwollaGatewayService {

  /** Returns the master account tied to the credentials. */
  Account retrieveAccount();

  List<FundingSource> listAccountFundingSources(Account account);

  List<Transfer> listAccountTransfers(Account account);

  /**
   * Creates a customer.
   *
   * @return the ID Dwolla assigned
   */
  String createCustomer(Customer customer);

  /**
   * Creates a customer; a repeated {@code idempotencyKey} returns the original customer ID.
   */
  String createCustomer(Customer customer, String idempotencyKey);

  List<Customer> listCustomers();

  Customer getCustomer(String customerId);

  /**
   * Edits, verifies, suspends, deactivates or reactivates a customer depending on which
   * fields of {@code update} are set.
   */
  Customer updateCustomer(String customerId, CustomerUpdate update);

  /**
   * @return the document ID when Dwolla reports one, otherwise {@code null}
   */
  String uploadDocument(String customerId, Path file, String documentType);

  List<Document> listDocuments(String customerId);

  Document getDocument(String documentId);

  String createFundingSource(String customerId, FundingSource fundingSource);

  String createFundingSourceToken(String customerId);

  String createIavToken(String customerId);

  List<FundingSource> listFundingSources(String customerId);

  List<FundingSource> listFundingSources(String customerId, boolean includeRemoved);

  List<Transfer> listCustomerTransfers(Customer customer);

  FundingSource getFundingSource(String fundingSourceId);

  FundingSource removeFundingSource(String fundingSourceId);

  /**
   * Creates a transfer between the source and destination funding sources it links to.
   *
   * @return the ID Dwolla assigned
   */
  String createTransfer(Transfer transfer);

  String createTransfer(Transfer transfer, String idempotencyKey);

  Transfer getTransfer(String transferId);

  Transfer cancelTransfer(String transferId);

  OnDemandAuthorization createOnDemandAuthorization();
}
