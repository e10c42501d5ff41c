package com.gentoro.onellm.exception;

/** Failures while reading or writing structured content (YAML, JSON). */
public class SerializationException extends OneLlmException {
  public SerializationException(String message) {
    super(OneLlmErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(OneLlmErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
