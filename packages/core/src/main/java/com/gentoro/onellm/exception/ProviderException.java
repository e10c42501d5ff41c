package com.gentoro.onellm.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure reported by a provider adapter. Adapters never throw this type directly; they throw
 * either {@link TransientProviderException} or {@link PermanentProviderException} so that retry
 * decisions only depend on the exception type.
 */
public abstract class ProviderException extends OneLlmException {
  private final String provider;
  private final int statusCode;

  protected ProviderException(
      OneLlmErrorCode code, String provider, int statusCode, String message, Throwable cause) {
    super(code, message, context(provider, statusCode), cause);
    this.provider = provider;
    this.statusCode = statusCode;
  }

  public String getProvider() {
    return provider;
  }

  /** HTTP status reported by the backend, or {@code -1} when the call never got a response. */
  public int getStatusCode() {
    return statusCode;
  }

  public abstract boolean isRetriable();

  private static Map<String, Object> context(String provider, int statusCode) {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("provider", String.valueOf(provider));
    if (statusCode >= 0) {
      context.put("statusCode", statusCode);
    }
    return context;
  }
}
