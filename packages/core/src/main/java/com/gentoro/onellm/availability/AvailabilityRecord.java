package com.gentoro.onellm.availability;

import java.time.Duration;
import java.time.Instant;

/**
 * Last known availability of one provider. Kept in memory only.
 *
 * @param lastError error text of the last failed check, {@code null} when available
 * @param latencyMs wall time of the last probe, 0 when the record came from a generation failure
 */
public record AvailabilityRecord(
    String provider,
    boolean available,
    String lastError,
    Instant lastChecked,
    long latencyMs,
    int consecutiveSuccesses,
    int consecutiveFailures) {

  /** True while the record is younger than {@code ttl}. A zero TTL is never fresh. */
  public boolean isFresh(Instant now, Duration ttl) {
    return !ttl.isZero() && !ttl.isNegative() && lastChecked.plus(ttl).isAfter(now);
  }

  AvailabilityRecord next(boolean nowAvailable, String error, Instant checkedAt, long latency) {
    return new AvailabilityRecord(
        provider,
        nowAvailable,
        nowAvailable ? null : error,
        checkedAt,
        latency,
        nowAvailable ? consecutiveSuccesses + 1 : 0,
        nowAvailable ? 0 : consecutiveFailures + 1);
  }

  static AvailabilityRecord initial(String provider, Instant checkedAt) {
    return new AvailabilityRecord(provider, false, null, checkedAt, 0L, 0, 0);
  }
}
