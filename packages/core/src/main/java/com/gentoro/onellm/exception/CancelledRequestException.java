package com.gentoro.onellm.exception;

/** The caller abandoned the request while an attempt or a backoff wait was in flight. */
public class CancelledRequestException extends OneLlmException {
  public CancelledRequestException(String message) {
    super(OneLlmErrorCode.CANCELLED, message);
  }

  public CancelledRequestException(String message, Throwable cause) {
    super(OneLlmErrorCode.CANCELLED, message, cause);
  }
}
