package com.checkout.dwolla.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.checkout.dwolla.client.JsonMapping;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Vendor JSON mapping")
class CustomerJsonTest {

  private final ObjectMapper objectMapper = JsonMapping.newObjectMapper();

  @Test
  @DisplayName("Should send only the fields that are set on a new customer")
  void shouldOmitUnsetCustomerFields() throws Exception {
    // given
    Customer customer = new Customer();
    customer.setFirstName("Jane");
    customer.setLastName("Doe");
    customer.setEmail("jane@example.com");
    customer.setAddress("1 Main St");

    // when
    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(customer));

    // then
    assertEquals("Jane", json.get("firstName").asText());
    assertEquals("1 Main St", json.get("address1").asText());
    assertFalse(json.has("id"));
    assertFalse(json.has("created"));
    assertFalse(json.has("_links"));
    assertEquals(4, json.size());
  }

  @Test
  @DisplayName("Should read vendor field names and ignore unknown ones")
  void shouldReadVendorFieldNames() throws Exception {
    Customer customer = objectMapper.readValue("{\"id\":\"c-1\",\"created\":\"2025-01-15\","
        + "\"address1\":\"1 Main St\",\"correlationId\":\"x\",\"_links\":{\"self\":"
        + "{\"href\":\"https://api/customers/c-1\",\"resource-type\":\"customer\"}}}",
        Customer.class);

    assertEquals("2025-01-15", customer.getCreatedAt());
    assertEquals("1 Main St", customer.getAddress());
    assertEquals("customer", customer.getLinks().get("self").getResourceType());
  }

  @Test
  @DisplayName("Should keep every populated customer field across a round trip")
  void shouldRoundTripCustomer() throws Exception {
    Customer customer = new Customer();
    customer.setFirstName("Jane");
    customer.setType("personal");
    customer.setDateOfBirth("1980-01-01");
    customer.setSsn("1234");
    customer.setCity("Des Moines");
    customer.setPostalCode("50309");

    Customer copy = objectMapper.readValue(objectMapper.writeValueAsString(customer),
        Customer.class);

    assertEquals(objectMapper.writeValueAsString(customer), objectMapper.writeValueAsString(copy));
    assertEquals("personal", copy.getType());
    assertEquals("50309", copy.getPostalCode());
  }

  @Test
  @DisplayName("Should send a status change as a single field")
  void shouldSendSparseUpdate() throws Exception {
    String json = objectMapper.writeValueAsString(
        CustomerUpdate.withStatus(CustomerUpdate.DEACTIVATED));

    assertEquals("{\"status\":\"deactivated\"}", json);
  }

  @Test
  @DisplayName("Should express transfer endpoints as links")
  void shouldWriteTransferLinks() throws Exception {
    Transfer transfer = Transfer.between("https://api/funding-sources/a",
        "https://api/funding-sources/b", Amount.usd("12.50"));

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(transfer));

    assertEquals("https://api/funding-sources/a", json.at("/_links/source/href").asText());
    assertEquals("https://api/funding-sources/b", json.at("/_links/destination/href").asText());
    assertEquals("12.50", json.at("/amount/value").asText());
    assertFalse(json.has("sourceHref"));
    assertFalse(json.has("metadata"));
  }

  @Test
  @DisplayName("Should default missing embedded collections to empty")
  void shouldDefaultMissingEmbeddedCollection() {
    HalCollection<Customer> collection = new HalCollection<>();

    assertTrue(collection.embedded("customers").isEmpty());
  }

  @Test
  @DisplayName("Should report absent links as null")
  void shouldReturnNullForAbsentLink() {
    assertNull(new Account().linkHref("funding-sources"));
  }
}
