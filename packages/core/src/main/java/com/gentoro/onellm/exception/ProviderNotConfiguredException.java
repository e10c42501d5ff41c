package com.gentoro.onellm.exception;

import java.util.Map;

/** Raised when a provider name was never successfully built by the registry. */
public class ProviderNotConfiguredException extends OneLlmException {
  private final String provider;

  public ProviderNotConfiguredException(String provider) {
    super(
        OneLlmErrorCode.NOT_FOUND,
        "LLM provider '%s' is not configured".formatted(provider),
        Map.of("provider", String.valueOf(provider)));
    this.provider = provider;
  }

  public String getProvider() {
    return provider;
  }
}
