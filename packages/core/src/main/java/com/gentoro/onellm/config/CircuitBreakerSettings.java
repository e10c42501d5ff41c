package com.gentoro.onellm.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-provider circuit breaker tuning.
 *
 * @param enabled when false every call is let through and no state is tracked
 * @param failureThreshold number of recent calls the failure rate is computed over; the breaker
 *     never opens before this many calls were recorded
 * @param failureRateThreshold percentage of failed calls among the recent ones that opens the
 *     breaker
 * @param halfOpenCalls trial calls allowed once the recovery timeout has elapsed
 * @param recoveryTimeout how long an open breaker rejects calls before allowing trial calls
 */
public record CircuitBreakerSettings(
    boolean enabled,
    int failureThreshold,
    float failureRateThreshold,
    int halfOpenCalls,
    Duration recoveryTimeout) {

  public static final CircuitBreakerSettings DEFAULT =
      new CircuitBreakerSettings(true, 5, 50.0f, 3, Duration.ofSeconds(60));

  public CircuitBreakerSettings {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be at least 1");
    }
    if (failureRateThreshold <= 0.0f || failureRateThreshold > 100.0f) {
      throw new IllegalArgumentException("failureRateThreshold must be in (0, 100]");
    }
    if (halfOpenCalls < 1) {
      throw new IllegalArgumentException("halfOpenCalls must be at least 1");
    }
    Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
    if (recoveryTimeout.toMillis() < 1) {
      throw new IllegalArgumentException("recoveryTimeout must be at least 1ms");
    }
  }
}
