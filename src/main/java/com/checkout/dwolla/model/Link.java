package com.checkout.dwolla.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A hypermedia link from a {@code _links} object. The relation name is the map key.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Link {

  private String href;
  private String type;
  @JsonProperty("resource-type")
  private String resourceType;

  public Link() {
  }

  public Link(String href) {
    this.href = href;
  }

  public static Link to(String href) {
    return new Link(href);
  }

  public String getHref() {
    return href;
  }

  public void setHref(String href) {
    this.href = href;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getResourceType() {
    return resourceType;
  }

  public void setResourceType(String resourceType) {
    this.resourceType = resourceType;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Link)) {
      return false;
    }
    Link link = (Link) o;
    return Objects.equals(href, link.href)
        && Objects.equals(type, link.type)
        && Objects.equals(resourceType, link.resourceType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(href, type, resourceType);
  }

  @Override
  public String toString() {
    return "Link{" + href + "}";
  }
}
