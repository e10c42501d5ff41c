package com.gentoro.onellm.exception;

/**
 * Non-retriable provider failure: bad credentials, malformed request, unknown model or an
 * unusable response.
 */
public class PermanentProviderException extends ProviderException {
  public PermanentProviderException(String provider, String message) {
    this(provider, -1, message, null);
  }

  public PermanentProviderException(String provider, String message, Throwable cause) {
    this(provider, -1, message, cause);
  }

  public PermanentProviderException(
      String provider, int statusCode, String message, Throwable cause) {
    super(codeFor(statusCode), provider, statusCode, message, cause);
  }

  @Override
  public boolean isRetriable() {
    return false;
  }

  /** True when the failure says the credential itself is rejected. */
  public boolean isAuthenticationFailure() {
    return getCode() == OneLlmErrorCode.UNAUTHENTICATED;
  }

  private static OneLlmErrorCode codeFor(int statusCode) {
    return switch (statusCode) {
      case 401, 403 -> OneLlmErrorCode.UNAUTHENTICATED;
      case 400, 404, 422 -> OneLlmErrorCode.INVALID_ARGUMENT;
      default -> OneLlmErrorCode.FAILED_PRECONDITION;
    };
  }
}
