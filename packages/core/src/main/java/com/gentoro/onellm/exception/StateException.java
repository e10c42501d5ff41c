package com.gentoro.onellm.exception;

/** A component was used before it was initialized, or after it was shut down. */
public class StateException extends OneLlmException {
  public StateException(String message) {
    super(OneLlmErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(OneLlmErrorCode.STATE_ERROR, message, cause);
  }
}
