package com.gentoro.onellm.retry;

import com.gentoro.onellm.config.RetrySettings;
import com.gentoro.onellm.exception.CancelledRequestException;
import com.gentoro.onellm.exception.TransientProviderException;
import java.time.Duration;
import java.util.Objects;

/**
 * Runs one provider call with bounded exponential backoff.
 *
 * <p>Only {@link TransientProviderException} is retried. Any other exception, including {@link
 * com.gentoro.onellm.exception.PermanentProviderException}, propagates on its first occurrence.
 * Once {@link RetrySettings#maxAttempts()} attempts have failed the last transient error is
 * rethrown.
 */
public class RetryPolicy {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(RetryPolicy.class);

  /** One attempt; {@code attemptNumber} starts at 1. */
  @FunctionalInterface
  public interface Attempt<T> {
    T run(int attemptNumber);
  }

  /** Observes each failed attempt before the policy decides what to do next. */
  @FunctionalInterface
  public interface FailureListener {
    void onFailure(int attemptNumber, RuntimeException failure);
  }

  private final RetrySettings settings;
  private final Sleeper sleeper;

  public RetryPolicy(RetrySettings settings) {
    this(settings, Sleeper.SYSTEM);
  }

  public RetryPolicy(RetrySettings settings, Sleeper sleeper) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /** Wait after failed attempt {@code attemptNumber} (1-based), capped at the maximum delay. */
  public Duration backoff(int attemptNumber) {
    double millis =
        settings.baseDelay().toMillis() * Math.pow(settings.multiplier(), attemptNumber - 1);
    long capped = (long) Math.min(millis, (double) settings.maxDelay().toMillis());
    return Duration.ofMillis(capped);
  }

  public <T> T execute(String provider, Attempt<T> attempt) {
    return execute(provider, attempt, (n, failure) -> {});
  }

  /**
   * @throws TransientProviderException the last transient failure once attempts are exhausted
   * @throws CancelledRequestException when interrupted while backing off
   */
  public <T> T execute(String provider, Attempt<T> attempt, FailureListener listener) {
    for (int attemptNumber = 1; ; attemptNumber++) {
      try {
        return attempt.run(attemptNumber);
      } catch (TransientProviderException e) {
        listener.onFailure(attemptNumber, e);
        if (attemptNumber >= settings.maxAttempts()) {
          log.warn(
              "Provider {} failed after {} attempt(s): {}",
              provider,
              attemptNumber,
              e.getMessage());
          throw e;
        }
        Duration wait = backoff(attemptNumber);
        log.info(
            "Provider {} attempt {}/{} failed ({}), retrying in {}ms",
            provider,
            attemptNumber,
            settings.maxAttempts(),
            e.getMessage(),
            wait.toMillis());
        pause(provider, wait);
      } catch (RuntimeException e) {
        listener.onFailure(attemptNumber, e);
        throw e;
      }
    }
  }

  private void pause(String provider, Duration wait) {
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancelledRequestException(
          "Interrupted while backing off before retrying " + provider, e);
    }
  }
}
