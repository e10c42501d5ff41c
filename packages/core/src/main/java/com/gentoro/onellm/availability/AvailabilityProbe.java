package com.gentoro.onellm.availability;

import com.gentoro.onellm.exception.CancelledRequestException;
import com.gentoro.onellm.exception.ExceptionUtil;
import com.gentoro.onellm.exception.ProviderException;
import com.gentoro.onellm.status.ProviderStatusEvent;
import com.gentoro.onellm.status.StatusReporter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides whether a provider is worth attempting, caching each verdict for a TTL.
 *
 * <p>Checks for the same provider are serialized, so concurrent requests arriving while a probe
 * is in flight wait for its verdict instead of probing again. Checks for different providers run
 * independently.
 *
 * <p>The cache is versioned by a generation number. Callers read {@link #generation()} before
 * they take a registry snapshot and pass it back with every check or failure. {@link
 * #invalidate()} starts a new generation, so verdicts about clients from an older snapshot are
 * returned to their caller but never cached.
 */
public class AvailabilityProbe {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(AvailabilityProbe.class);

  /** One probe call. Throws {@link ProviderException} when the provider is unusable. */
  @FunctionalInterface
  public interface ProbeCall {
    void run();
  }

  private record Stamped(AvailabilityRecord record, long generation) {}

  private final Clock clock;
  private final StatusReporter reporter;
  private final AtomicLong generation = new AtomicLong();
  private final Map<String, Stamped> records = new ConcurrentHashMap<>();
  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public AvailabilityProbe(StatusReporter reporter) {
    this(Clock.systemUTC(), reporter);
  }

  public AvailabilityProbe(Clock clock, StatusReporter reporter) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.reporter = StatusReporter.guarded(Objects.requireNonNull(reporter, "reporter"));
  }

  public long generation() {
    return generation.get();
  }

  /**
   * Returns the cached record for {@code provider} while it is younger than {@code ttl};
   * otherwise runs {@code probe} once and records the outcome.
   *
   * @param observedGeneration the value of {@link #generation()} read before the caller obtained
   *     the client behind {@code probe}
   * @throws CancelledRequestException when interrupted while waiting for or running the probe
   */
  public AvailabilityRecord check(
      String provider, Duration ttl, long observedGeneration, ProbeCall probe) {
    ReentrantLock lock = locks.computeIfAbsent(provider, k -> new ReentrantLock());
    try {
      lock.lockInterruptibly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancelledRequestException("Interrupted while checking " + provider, e);
    }
    try {
      AvailabilityRecord cached = current(provider);
      if (observedGeneration == generation.get()
          && cached != null
          && cached.isFresh(clock.instant(), ttl)) {
        log.trace("Using cached availability for {}: {}", provider, cached.available());
        return cached;
      }
      return runProbe(provider, observedGeneration, probe);
    } finally {
      lock.unlock();
    }
  }

  private AvailabilityRecord runProbe(String provider, long observedGeneration, ProbeCall probe) {
    long start = clock.millis();
    String error = null;
    try {
      probe.run();
    } catch (CancelledRequestException e) {
      throw e;
    } catch (ProviderException e) {
      error = e.getMessage();
    } catch (RuntimeException e) {
      error = ExceptionUtil.describe(e);
    }
    long latency = Math.max(0L, clock.millis() - start);
    Instant now = clock.instant();
    boolean available = error == null;
    AvailabilityRecord record = store(provider, observedGeneration, available, error, now, latency);
    if (available) {
      log.debug("Provider {} probe succeeded in {}ms", provider, latency);
    } else {
      log.warn("Provider {} probe failed: {}", provider, error);
    }
    reporter.report(
        new ProviderStatusEvent(
            provider, available, error, latency, ProviderStatusEvent.Phase.PROBE, now));
    return record;
  }

  /**
   * Marks {@code provider} unavailable until its record expires. Used after a generation failure
   * that survived retries. Ignored when the cache was invalidated after {@code
   * observedGeneration} was read.
   */
  public void markFailure(String provider, String error, long observedGeneration) {
    store(provider, observedGeneration, false, error, clock.instant(), 0L);
    log.debug("Provider {} marked unavailable: {}", provider, error);
  }

  /** Drops every cached verdict and starts a new generation. */
  public void invalidate() {
    long next = generation.incrementAndGet();
    records.clear();
    log.debug("Availability cache cleared, generation {}", next);
  }

  /** Current records, sorted by provider name. */
  public Map<String, AvailabilityRecord> snapshot() {
    Map<String, AvailabilityRecord> sorted = new LinkedHashMap<>();
    records.keySet().stream()
        .sorted()
        .forEach(
            name -> {
              AvailabilityRecord record = current(name);
              if (record != null) {
                sorted.put(name, record);
              }
            });
    return sorted;
  }

  private AvailabilityRecord current(String provider) {
    Stamped stamped = records.get(provider);
    return stamped != null && stamped.generation() == generation.get() ? stamped.record() : null;
  }

  private AvailabilityRecord store(
      String provider,
      long observedGeneration,
      boolean available,
      String error,
      Instant checkedAt,
      long latency) {
    AvailabilityRecord[] written = {null};
    records.compute(
        provider,
        (name, existing) -> {
          if (observedGeneration != generation.get()) {
            return existing;
          }
          AvailabilityRecord previous =
              existing != null && existing.generation() == observedGeneration
                  ? existing.record()
                  : AvailabilityRecord.initial(name, checkedAt);
          written[0] = previous.next(available, error, checkedAt, latency);
          return new Stamped(written[0], observedGeneration);
        });
    if (written[0] != null) {
      return written[0];
    }
    log.debug("Discarding stale availability verdict for {}", provider);
    return AvailabilityRecord.initial(provider, checkedAt)
        .next(available, error, checkedAt, latency);
  }
}
