package com.checkout.dwolla.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A money movement between two funding sources. Status transitions happen on the Dwolla side.
 *
 * <p>The source and destination are expressed as the {@code source} and {@code destination}
 * links, both on creation and in fetched representations.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Transfer extends HalResource {

  public static final String SOURCE = "source";
  public static final String DESTINATION = "destination";

  private String id;
  private String status;
  private Amount amount;
  @JsonProperty("created")
  private String createdAt;
  private Map<String, Object> metadata = new LinkedHashMap<>();
  private String correlationId;

  /**
   * Builds a creation payload moving {@code amount} from one funding source URL to another.
   */
  public static Transfer between(String sourceFundingSourceUrl,
      String destinationFundingSourceUrl, Amount amount) {
    Transfer transfer = new Transfer();
    transfer.getLinks().put(SOURCE, Link.to(sourceFundingSourceUrl));
    transfer.getLinks().put(DESTINATION, Link.to(destinationFundingSourceUrl));
    transfer.setAmount(amount);
    return transfer;
  }

  @JsonIgnore
  public String getSourceHref() {
    return linkHref(SOURCE);
  }

  @JsonIgnore
  public String getDestinationHref() {
    return linkHref(DESTINATION);
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getStatus() {
    return status;
  }

  public void setStatus(String status) {
    this.status = status;
  }

  public Amount getAmount() {
    return amount;
  }

  public void setAmount(Amount amount) {
    this.amount = amount;
  }

  public String getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(String createdAt) {
    this.createdAt = createdAt;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, Object> metadata) {
    this.metadata = metadata == null ? new LinkedHashMap<>() : metadata;
  }

  public String getCorrelationId() {
    return correlationId;
  }

  public void setCorrelationId(String correlationId) {
    this.correlationId = correlationId;
  }
}
