package com.gentoro.onellm.status;

import java.util.List;

/**
 * Sink for provider health observations. Implementations must be thread-safe; callers never let
 * a reporter failure affect a request.
 */
@FunctionalInterface
public interface StatusReporter {

  void report(ProviderStatusEvent event);

  static StatusReporter noop() {
    return event -> {};
  }

  /** Wraps {@code delegate} so that its failures are logged and never propagate. */
  static StatusReporter guarded(StatusReporter delegate) {
    return delegate instanceof GuardedStatusReporter
        ? delegate
        : new GuardedStatusReporter(delegate);
  }

  /** Fans one event out to every reporter in order. */
  static StatusReporter composite(List<StatusReporter> reporters) {
    List<StatusReporter> copy = List.copyOf(reporters);
    return event -> copy.forEach(r -> r.report(event));
  }
}
