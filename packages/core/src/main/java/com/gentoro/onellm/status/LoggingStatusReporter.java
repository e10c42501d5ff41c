package com.gentoro.onellm.status;

/** Writes every provider status event to the log. */
public final class LoggingStatusReporter implements StatusReporter {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(LoggingStatusReporter.class);

  @Override
  public void report(ProviderStatusEvent event) {
    if (event.available()) {
      log.debug(
          "Provider {} available ({} {}ms)",
          event.provider(),
          event.phase(),
          event.latencyMs());
    } else {
      log.info(
          "Provider {} unavailable ({} {}ms): {}",
          event.provider(),
          event.phase(),
          event.latencyMs(),
          event.error());
    }
  }
}
