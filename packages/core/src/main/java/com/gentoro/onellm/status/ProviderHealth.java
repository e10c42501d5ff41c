package com.gentoro.onellm.status;

import java.time.Instant;

/**
 * Aggregated health of one provider, built from the events the board has seen.
 *
 * @param requestCount generation attempts observed, successful or not
 * @param failureCount failed generation attempts
 * @param averageResponseMs mean latency of all observed generation attempts
 * @param lastError error of the most recent failed observation, {@code null} when none failed
 *     since the last success
 */
public record ProviderHealth(
    String provider,
    boolean available,
    CircuitState circuitState,
    long requestCount,
    long failureCount,
    double averageResponseMs,
    String lastError,
    Instant lastUpdated) {

  static ProviderHealth empty(String provider, Instant now) {
    return new ProviderHealth(provider, false, CircuitState.CLOSED, 0L, 0L, 0.0, null, now);
  }

  ProviderHealth apply(ProviderStatusEvent event) {
    return switch (event.phase()) {
      case CIRCUIT ->
          new ProviderHealth(
              provider,
              available,
              event.circuitState(),
              requestCount,
              failureCount,
              averageResponseMs,
              lastError,
              event.timestamp());
      case PROBE ->
          new ProviderHealth(
              provider,
              event.available(),
              circuitState,
              requestCount,
              failureCount,
              averageResponseMs,
              event.available() ? lastError : event.error(),
              event.timestamp());
      case ATTEMPT -> {
        long requests = requestCount + 1;
        double average = averageResponseMs + (event.latencyMs() - averageResponseMs) / requests;
        yield new ProviderHealth(
            provider,
            event.available(),
            circuitState,
            requests,
            event.available() ? failureCount : failureCount + 1,
            average,
            event.available() ? null : event.error(),
            event.timestamp());
      }
    };
  }
}
