package com.checkout.dwolla.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sparse payload for {@code POST /customers/{id}}.
 *
 * <p>Dwolla uses the same call for several effects and picks the effect from the fields that
 * are present. Only set the fields the intended effect needs; unset fields are not sent.
 * <ul>
 *   <li>Profile edit: {@code email}, {@code ipAddress}, {@code phone}, address fields.</li>
 *   <li>Upgrade an unverified customer: {@code type} ({@code personal} or {@code business})
 *       with the identity fields ({@code firstName}, {@code lastName}, {@code dateOfBirth},
 *       {@code ssn}, address fields).</li>
 *   <li>Suspend: {@code status = "suspended"}.</li>
 *   <li>Deactivate: {@code status = "deactivated"}.</li>
 *   <li>Reactivate: {@code status = "reactivated"}.</li>
 *   <li>Retry verification: all identity fields again, with the full nine-digit {@code ssn}.</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class CustomerUpdate {

  public static final String SUSPENDED = "suspended";
  public static final String DEACTIVATED = "deactivated";
  public static final String REACTIVATED = "reactivated";

  private String firstName;
  private String lastName;
  private String email;
  private String type;
  private String status;
  private String businessName;
  private String ipAddress;
  private String dateOfBirth;
  private String ssn;
  private String phone;
  @JsonProperty("address1")
  private String address;
  private String address2;
  private String city;
  private String state;
  private String postalCode;

  public static CustomerUpdate withStatus(String status) {
    CustomerUpdate update = new CustomerUpdate();
    update.setStatus(status);
    return update;
  }

  public String getFirstName() {
    return firstName;
  }

  public void setFirstName(String firstName) {
    this.firstName = firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public void setLastName(String lastName) {
    this.lastName = lastName;
  }

  public String getEmail() {
    return email;
  }

  public void setEmail(String email) {
    this.email = email;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getStatus() {
    return status;
  }

  public void setStatus(String status) {
    this.status = status;
  }

  public String getBusinessName() {
    return businessName;
  }

  public void setBusinessName(String businessName) {
    this.businessName = businessName;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public void setIpAddress(String ipAddress) {
    this.ipAddress = ipAddress;
  }

  public String getDateOfBirth() {
    return dateOfBirth;
  }

  public void setDateOfBirth(String dateOfBirth) {
    this.dateOfBirth = dateOfBirth;
  }

  public String getSsn() {
    return ssn;
  }

  public void setSsn(String ssn) {
    this.ssn = ssn;
  }

  public String getPhone() {
    return phone;
  }

  public void setPhone(String phone) {
    this.phone = phone;
  }

  public String getAddress() {
    return address;
  }

  public void setAddress(String address) {
    this.address = address;
  }

  public String getAddress2() {
    return address2;
  }

  public void setAddress2(String address2) {
    this.address2 = address2;
  }

  public String getCity() {
    return city;
  }

  public void setCity(String city) {
    this.city = city;
  }

  public String getState() {
    return state;
  }

  public void setState(String state) {
    this.state = state;
  }

  public String getPostalCode() {
    return postalCode;
  }

  public void setPostalCode(String postalCode) {
    this.postalCode = postalCode;
  }
}
