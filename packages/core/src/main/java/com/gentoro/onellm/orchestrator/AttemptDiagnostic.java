package com.gentoro.onellm.orchestrator;

/**
 * What happened to one candidate provider during a request.
 *
 * @param attempts number of generation calls made; 0 when the provider was skipped
 * @param error error text, {@code null} on success
 * @param latencyMs time spent on this candidate, probe included
 */
public record AttemptDiagnostic(
    String provider, Outcome outcome, int attempts, String error, long latencyMs) {

  public enum Outcome {
    SUCCEEDED,
    UNAVAILABLE,
    CIRCUIT_OPEN,
    NOT_CONFIGURED,
    TRANSIENT_EXHAUSTED,
    PERMANENT_FAILURE,
    CANCELLED
  }
}
