package com.gentoro.onellm.status;

import com.gentoro.onellm.exception.ExceptionUtil;
import java.util.Objects;

final class GuardedStatusReporter implements StatusReporter {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(GuardedStatusReporter.class);

  private final StatusReporter delegate;

  GuardedStatusReporter(StatusReporter delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public void report(ProviderStatusEvent event) {
    try {
      delegate.report(event);
    } catch (RuntimeException e) {
      log.warn(
          "Status reporter failed for provider {}: {}",
          event.provider(),
          ExceptionUtil.describe(e));
    }
  }
}
