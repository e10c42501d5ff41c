package com.gentoro.onellm.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff: attempt {@code n} (1-based) waits {@code baseDelay *
 * multiplier^(n-1)} before attempt {@code n+1}, capped at {@code maxDelay}.
 */
public record RetrySettings(
    int maxAttempts, Duration baseDelay, Duration maxDelay, double multiplier) {

  public static final RetrySettings DEFAULT =
      new RetrySettings(3, Duration.ofSeconds(4), Duration.ofSeconds(10), 2.0);

  public RetrySettings {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("Retry delays must not be negative");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
  }
}
