package com.gentoro.onellm.orchestrator;

import java.util.List;

/**
 * Outcome of one orchestrated request. Exactly one of {@code text} and {@code error} is set.
 *
 * @param chosenProvider provider that produced {@code text}, {@code null} on failure
 * @param attempts per-candidate diagnostics in the order candidates were tried
 */
public record FallbackResult(
    String text, String chosenProvider, String error, List<AttemptDiagnostic> attempts) {

  public static final String NO_PROVIDERS = "No LLM providers are configured";

  public FallbackResult {
    attempts = List.copyOf(attempts);
  }

  public static FallbackResult success(
      String text, String provider, List<AttemptDiagnostic> attempts) {
    return new FallbackResult(text, provider, null, attempts);
  }

  public static FallbackResult failure(String error, List<AttemptDiagnostic> attempts) {
    return new FallbackResult(null, null, error, attempts);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
