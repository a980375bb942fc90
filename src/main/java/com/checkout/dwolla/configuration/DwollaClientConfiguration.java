package com.checkout.dwolla.configuration;

import com.checkout.dwolla.client.DwollaClient;
import com.checkout.dwolla.client.DwollaClientImpl;
import com.checkout.dwolla.client.DwollaRequestExecutor;
import com.checkout.dwolla.client.Environment;
import com.checkout.dwolla.client.JsonMapping;
import com.checkout.dwolla.logging.RequestLoggingInterceptor;
import com.checkout.dwolla.resource.AccountResource;
import com.checkout.dwolla.resource.CustomerResource;
import com.checkout.dwolla.resource.FundingSourceResource;
import com.checkout.dwolla.resource.TransferResource;
import com.checkout.dwolla.service.DwollaGatewayService;
import com.checkout.dwolla.service.DwollaGatewayServiceImpl;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.web.client.RestTemplateAutoConfiguration;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the Dwolla client when {@code dwolla.client-id} is set.
 *
 * <p>Properties:
 * <ul>
 *   <li>{@code dwolla.environment}: {@code sandbox} (default) or {@code production}</li>
 *   <li>{@code dwolla.client-id}, {@code dwolla.client-secret}: OAuth client credentials</li>
 *   <li>{@code dwolla.root-url}: optional replacement for the environment's root URL</li>
 *   <li>{@code dwolla.http.connect-timeout-ms}, {@code dwolla.http.read-timeout-ms}: default
 *       10 seconds each</li>
 * </ul>
 */
@AutoConfiguration(after = RestTemplateAutoConfiguration.class)
@ConditionalOnProperty(prefix = "dwolla", name = "client-id")
public class DwollaClientConfiguration {

  @Bean
  @ConditionalOnMissingBean(name = "dwollaRestTemplate")
  public RestTemplate dwollaRestTemplate(ObjectProvider<RestTemplateBuilder> builders,
      @Value("${dwolla.http.connect-timeout-ms:10000}") long connectTimeoutMs,
      @Value("${dwolla.http.read-timeout-ms:10000}") long readTimeoutMs) {
    return builders.getIfAvailable(RestTemplateBuilder::new)
        .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
        .setReadTimeout(Duration.ofMillis(readTimeoutMs))
        .additionalInterceptors(new RequestLoggingInterceptor())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public DwollaClient dwollaClient(@Qualifier("dwollaRestTemplate") RestTemplate restTemplate,
      Clock clock,
      @Value("${dwolla.environment:sandbox}") String environment,
      @Value("${dwolla.root-url:}") String rootUrl,
      @Value("${dwolla.client-id}") String clientId,
      @Value("${dwolla.client-secret:}") String clientSecret) {
    return new DwollaClientImpl(restTemplate, dwollaObjectMapper(), clock,
        Environment.fromName(environment), rootUrl, clientId, clientSecret);
  }

  @Bean
  @ConditionalOnMissingBean
  public DwollaRequestExecutor dwollaRequestExecutor(DwollaClient dwollaClient,
      @Qualifier("dwollaRestTemplate") RestTemplate restTemplate) {
    return new DwollaRequestExecutor(dwollaClient, restTemplate, dwollaObjectMapper());
  }

  @Bean
  @ConditionalOnMissingBean
  public AccountResource accountResource(DwollaRequestExecutor executor) {
    return new AccountResource(executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public CustomerResource customerResource(DwollaRequestExecutor executor) {
    return new CustomerResource(executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public FundingSourceResource fundingSourceResource(DwollaRequestExecutor executor) {
    return new FundingSourceResource(executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public TransferResource transferResource(DwollaRequestExecutor executor) {
    return new TransferResource(executor);
  }

  @Bean
  @ConditionalOnMissingBean
  public DwollaGatewayService dwollaGatewayService(AccountResource accounts,
      CustomerResource customers, FundingSourceResource fundingSources,
      TransferResource transfers) {
    return new DwollaGatewayServiceImpl(accounts, customers, fundingSources, transfers);
  }

  private static ObjectMapper dwollaObjectMapper() {
    return JsonMapping.newObjectMapper();
  }
}
