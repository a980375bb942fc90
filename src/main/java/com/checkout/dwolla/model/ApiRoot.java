package com.checkout.dwolla.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Representation of {@code GET /}: only links, among them {@code account}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiRoot extends HalResource {
}
