package com.gentoro.onellm.status;

/** Circuit breaker state of one provider as seen by status sinks. */
public enum CircuitState {
  CLOSED,
  OPEN,
  HALF_OPEN,
  DISABLED
}
