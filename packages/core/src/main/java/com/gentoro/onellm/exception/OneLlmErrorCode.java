package com.gentoro.onellm.exception;

/**
 * Canonical error codes for OneLLM. Codes are stable and suitable for downstream services and
 * logs. Prefer choosing the most specific code that reflects the failure origin and actionability.
 */
public enum OneLlmErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  UNAUTHENTICATED,
  RESOURCE_EXHAUSTED,
  UNAVAILABLE,
  DEADLINE_EXCEEDED,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
  STATE_ERROR,

  // Domain specific
  LLM_ERROR,
}
