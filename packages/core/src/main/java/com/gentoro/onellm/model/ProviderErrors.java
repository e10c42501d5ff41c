package com.gentoro.onellm.model;

import com.gentoro.onellm.exception.ExceptionUtil;
import com.gentoro.onellm.exception.PermanentProviderException;
import com.gentoro.onellm.exception.ProviderException;
import com.gentoro.onellm.exception.TransientProviderException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

/** Maps SDK and transport failures onto the transient / permanent taxonomy. */
public final class ProviderErrors {
  private ProviderErrors() {}

  /** 408, 409, 429 and every 5xx are worth retrying; any other status is not. */
  public static boolean isTransientStatus(int statusCode) {
    return statusCode == 408 || statusCode == 409 || statusCode == 429 || statusCode >= 500;
  }

  public static ProviderException fromStatus(
      String provider, int statusCode, String message, Throwable cause) {
    String text = "%s returned HTTP %d: %s".formatted(provider, statusCode, message);
    return isTransientStatus(statusCode)
        ? new TransientProviderException(provider, statusCode, text, cause)
        : new PermanentProviderException(provider, statusCode, text, cause);
  }

  /**
   * Classifies a failure without an HTTP status. Network I/O problems and timeouts anywhere in
   * the cause chain are transient; anything else is permanent.
   */
  public static ProviderException fromThrowable(String provider, Throwable cause) {
    if (cause instanceof ProviderException providerException) {
      return providerException;
    }
    String text = "%s call failed: %s".formatted(provider, ExceptionUtil.describe(cause));
    if (ExceptionUtil.hasCause(cause, IOException.class)
        || ExceptionUtil.hasCause(cause, TimeoutException.class)) {
      return new TransientProviderException(provider, text, cause);
    }
    return new PermanentProviderException(provider, text, cause);
  }
}
