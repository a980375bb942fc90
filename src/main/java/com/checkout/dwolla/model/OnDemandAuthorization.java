package com.checkout.dwolla.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Authorization a customer grants for future debits. The {@code self} link is what gets
 * attached to the funding source the customer links afterwards.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OnDemandAuthorization extends HalResource {

  private String bodyText;
  private String buttonText;

  @JsonIgnore
  public String getHref() {
    return linkHref("self");
  }

  public String getBodyText() {
    return bodyText;
  }

  public void setBodyText(String bodyText) {
    this.bodyText = bodyText;
  }

  public String getButtonText() {
    return buttonText;
  }

  public void setButtonText(String buttonText) {
    this.buttonText = buttonText;
  }
}
