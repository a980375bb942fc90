package com.checkout.dwolla.service;

import com.checkout.dwolla.client.DwollaClient;
import com.checkout.dwolla.client.DwollaClientImpl;
import com.checkout.dwolla.client.DwollaRequestExecutor;
import com.checkout.dwolla.client.Environment;
import com.checkout.dwolla.client.JsonMapping;
import com.checkout.dwolla.logging.RequestLoggingInterceptor;
import com.checkout.dwolla.model.Account;
import com.checkout.dwolla.model.Customer;
import com.checkout.dwolla.model.CustomerUpdate;
import com.checkout.dwolla.model.Document;
import com.checkout.dwolla.model.FundingSource;
import com.checkout.dwolla.model.OnDemandAuthorization;
import com.checkout.dwolla.model.Transfer;
import com.checkout.dwolla.resource.AccountResource;
import com.checkout.dwolla.resource.CustomerResource;
import com.checkout.dwolla.resource.FundingSourceResource;
import com.checkout.dwolla.resource.TransferResource;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestTemplate;

/**
 * Delegates every operation to the matching resource module, unchanged.
 */
public class DwollaGatewayServiceImpl implements DwollaGatewayService {

  private final AccountResource accounts;
  private final CustomerResource customers;
  private final FundingSourceResource fundingSources;
  private final TransferResource transfers;

  public DwollaGatewayServiceImpl(AccountResource accounts, CustomerResource customers,
      FundingSourceResource fundingSources, TransferResource transfers) {
    this.accounts = accounts;
    this.customers = customers;
    this.fundingSources = fundingSources;
    this.transfers = transfers;
  }

  /**
   * Builds a ready-to-use gateway without a Spring context.
   */
  public static DwollaGatewayServiceImpl create(Environment environment, String clientId,
      String clientSecret) {
    RestTemplate restTemplate = new RestTemplateBuilder()
        .additionalInterceptors(new RequestLoggingInterceptor())
        .build();
    ObjectMapper objectMapper = JsonMapping.newObjectMapper();
    DwollaClient client = new DwollaClientImpl(restTemplate, objectMapper, Clock.systemUTC(),
        environment, clientId, clientSecret);
    DwollaRequestExecutor executor = new DwollaRequestExecutor(client, restTemplate,
        objectMapper);
    return new DwollaGatewayServiceImpl(new AccountResource(executor),
        new CustomerResource(executor), new FundingSourceResource(executor),
        new TransferResource(executor));
  }

  @Override
  public Account retrieveAccount() {
    return accounts.retrieve();
  }

  @Override
  public List<FundingSource> listAccountFundingSources(Account account) {
    return accounts.listFundingSources(account);
  }

  @Override
  public List<Transfer> listAccountTransfers(Account account) {
    return accounts.listTransfers(account);
  }

  @Override
  public String createCustomer(Customer customer) {
    return customers.create(customer);
  }

  @Override
  public String createCustomer(Customer customer, String idempotencyKey) {
    return customers.create(customer, idempotencyKey);
  }

  @Override
  public List<Customer> listCustomers() {
    return customers.list();
  }

  @Override
  public Customer getCustomer(String customerId) {
    return customers.get(customerId);
  }

  @Override
  public Customer updateCustomer(String customerId, CustomerUpdate update) {
    return customers.update(customerId, update);
  }

  @Override
  public String uploadDocument(String customerId, Path file, String documentType) {
    return customers.uploadDocument(customerId, file, documentType);
  }

  @Override
  public List<Document> listDocuments(String customerId) {
    return customers.listDocuments(customerId);
  }

  @Override
  public Document getDocument(String documentId) {
    return customers.getDocument(documentId);
  }

  @Override
  public String createFundingSource(String customerId, FundingSource fundingSource) {
    return customers.createFundingSource(customerId, fundingSource);
  }

  @Override
  public String createFundingSourceToken(String customerId) {
    return customers.createFundingSourceToken(customerId);
  }

  @Override
  public String createIavToken(String customerId) {
    return customers.createIavToken(customerId);
  }

  @Override
  public List<FundingSource> listFundingSources(String customerId) {
    return customers.listFundingSources(customerId);
  }

  @Override
  public List<FundingSource> listFundingSources(String customerId, boolean includeRemoved) {
    return customers.listFundingSources(customerId, includeRemoved);
  }

  @Override
  public List<Transfer> listCustomerTransfers(Customer customer) {
    return customers.listTransfers(customer);
  }

  @Override
  public FundingSource getFundingSource(String fundingSourceId) {
    return fundingSources.get(fundingSourceId);
  }

  @Override
  public FundingSource removeFundingSource(String fundingSourceId) {
    return fundingSources.remove(fundingSourceId);
  }

  @Override
  public String createTransfer(Transfer transfer) {
    return transfers.create(transfer);
  }

  @Override
  public String createTransfer(Transfer transfer, String idempotencyKey) {
    return transfers.create(transfer, idempotencyKey);
  }

  @Override
  public Transfer getTransfer(String transferId) {
    return transfers.get(transferId);
  }

  @Override
  public Transfer cancelTransfer(String transferId) {
    return transfers.cancel(transferId);
  }

  @Override
  public OnDemandAuthorization createOnDemandAuthorization() {
    return transfers.createOnDemandAuthorization();
  }
}
