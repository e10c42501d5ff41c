package com.gentoro.onellm.status;

import java.time.Instant;
import java.util.Objects;

/**
 * One observation about a provider's health.
 *
 * @param provider provider name
 * @param available whether the provider answered successfully, or for a {@link Phase#CIRCUIT}
 *     event whether its breaker lets calls through
 * @param error error text, {@code null} when available
 * @param latencyMs wall time of the observed call in milliseconds
 * @param phase where the observation came from
 * @param timestamp when the observation was made
 * @param circuitState new breaker state of a {@link Phase#CIRCUIT} event, otherwise {@code null}
 */
public record ProviderStatusEvent(
    String provider,
    boolean available,
    String error,
    long latencyMs,
    Phase phase,
    Instant timestamp,
    CircuitState circuitState) {

  public enum Phase {
    PROBE,
    ATTEMPT,
    CIRCUIT
  }

  public ProviderStatusEvent {
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(phase, "phase");
    Objects.requireNonNull(timestamp, "timestamp");
    if (phase == Phase.CIRCUIT) {
      Objects.requireNonNull(circuitState, "circuitState");
    }
  }

  public ProviderStatusEvent(
      String provider,
      boolean available,
      String error,
      long latencyMs,
      Phase phase,
      Instant timestamp) {
    this(provider, available, error, latencyMs, phase, timestamp, null);
  }

  /** Breaker transition of {@code provider} to {@code state}. */
  public static ProviderStatusEvent circuit(
      String provider, CircuitState state, Instant timestamp) {
    boolean open = state == CircuitState.OPEN;
    return new ProviderStatusEvent(
        provider, !open, open ? "circuit breaker open" : null, 0L, Phase.CIRCUIT, timestamp, state);
  }
}
