package com.checkout.dwolla.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * List envelope: {@code _embedded} maps a collection name such as {@code "customers"} to the
 * entities of that collection.
 *
 * @param <T> the embedded entity type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HalCollection<T> extends HalResource {

  @JsonProperty("_embedded")
  private Map<String, List<T>> embedded = new LinkedHashMap<>();
  private Integer total;

  /**
   * Returns the entities under {@code name}; an absent or null key yields an empty list.
   */
  public List<T> embedded(String name) {
    List<T> items = embedded.get(name);
    return items == null ? Collections.emptyList() : items;
  }

  public Map<String, List<T>> getEmbedded() {
    return embedded;
  }

  public void setEmbedded(Map<String, List<T>> embedded) {
    this.embedded = embedded == null ? new LinkedHashMap<>() : embedded;
  }

  public Integer getTotal() {
    return total;
  }

  public void setTotal(Integer total) {
    this.total = total;
  }
}
