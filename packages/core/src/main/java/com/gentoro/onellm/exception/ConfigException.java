package com.gentoro.onellm.exception;

/** Invalid, missing or placeholder configuration. Never retried. */
public class ConfigException extends OneLlmException {
  public ConfigException(String message) {
    super(OneLlmErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(OneLlmErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
