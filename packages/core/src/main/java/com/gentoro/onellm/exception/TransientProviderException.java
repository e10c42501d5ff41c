package com.gentoro.onellm.exception;

/** Retriable provider failure: rate limiting, 5xx, network failure or timeout. */
public class TransientProviderException extends ProviderException {
  public TransientProviderException(String provider, String message) {
    this(provider, -1, message, null);
  }

  public TransientProviderException(String provider, String message, Throwable cause) {
    this(provider, -1, message, cause);
  }

  public TransientProviderException(
      String provider, int statusCode, String message, Throwable cause) {
    super(
        statusCode == 429 ? OneLlmErrorCode.RESOURCE_EXHAUSTED : OneLlmErrorCode.UNAVAILABLE,
        provider,
        statusCode,
        message,
        cause);
  }

  @Override
  public boolean isRetriable() {
    return true;
  }
}
