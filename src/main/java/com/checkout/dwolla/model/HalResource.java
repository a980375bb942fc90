package com.checkout.dwolla.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common base for vendor representations that carry a {@code _links} object.
 */
public abstract class HalResource {

  @JsonProperty("_links")
  private Map<String, Link> links = new LinkedHashMap<>();

  public Map<String, Link> getLinks() {
    return links;
  }

  public void setLinks(Map<String, Link> links) {
    this.links = links == null ? new LinkedHashMap<>() : links;
  }

  /**
   * Returns the href of the named relation, or {@code null} when the link is absent.
   */
  @JsonIgnore
  public String linkHref(String relation) {
    Link link = links.get(relation);
    return link == null ? null : link.getHref();
  }
}
