package com.checkout.dwolla.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * A monetary value as Dwolla encodes it: the value is a decimal string, e.g. {@code "10.00"}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Amount {

  private String currency;
  private String value;

  public Amount() {
  }

  public Amount(String currency, String value) {
    this.currency = currency;
    this.value = value;
  }

  public static Amount usd(String value) {
    return new Amount("USD", value);
  }

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }

  public String getValue() {
    return value;
  }

  public void setValue(String value) {
    this.value = value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Amount)) {
      return false;
    }
    Amount amount = (Amount) o;
    return Objects.equals(currency, amount.currency) && Objects.equals(value, amount.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(currency, value);
  }

  @Override
  public String toString() {
    return value + " " + currency;
  }
}
