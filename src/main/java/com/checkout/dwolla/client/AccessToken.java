package com.checkout.dwolla.client;

import java.time.Duration;
import java.time.Instant;

/**
 * A bearer token together with the instant it stops being valid.
 */
final class AccessToken {

  private final String value;
  private final Instant expiresAt;

  AccessToken(String value, Instant expiresAt) {
    this.value = value;
    this.expiresAt = expiresAt;
  }

  String value() {
    return value;
  }

  Instant expiresAt() {
    return expiresAt;
  }

  /** True when less than {@code margin} of lifetime is left at {@code now}. */
  boolean expiresWithin(Instant now, Duration margin) {
    return !now.plus(margin).isBefore(expiresAt);
  }
}
