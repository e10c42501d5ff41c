package com.gentoro.onellm.exception;

/** The provider's circuit breaker rejected the call without contacting the backend. */
public class CircuitOpenException extends ProviderException {
  public CircuitOpenException(String provider, String message, Throwable cause) {
    super(OneLlmErrorCode.UNAVAILABLE, provider, -1, message, cause);
  }

  @Override
  public boolean isRetriable() {
    return false;
  }
}
