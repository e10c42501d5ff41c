package com.gentoro.onellm.status;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory status board: the latest event per provider, a bounded history and running health
 * figures (request count, average response time, breaker state). Nothing is persisted; a restart
 * starts from an empty board.
 */
public final class ProviderStatusBoard implements StatusReporter {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(ProviderStatusBoard.class);

  public static final int DEFAULT_HISTORY_LIMIT = 1000;

  private final int historyLimit;
  private final Map<String, ProviderStatusEvent> latest = new ConcurrentHashMap<>();
  private final Map<String, ProviderHealth> health = new ConcurrentHashMap<>();
  private final Map<String, Deque<ProviderStatusEvent>> history = new ConcurrentHashMap<>();

  public ProviderStatusBoard() {
    this(DEFAULT_HISTORY_LIMIT);
  }

  public ProviderStatusBoard(int historyLimit) {
    if (historyLimit < 1) {
      throw new IllegalArgumentException("historyLimit must be positive");
    }
    this.historyLimit = historyLimit;
  }

  @Override
  public void report(ProviderStatusEvent event) {
    ProviderStatusEvent previous = latest.put(event.provider(), event);
    if (previous != null && previous.available() != event.available()) {
      log.info(
          "Provider {} is now {}",
          event.provider(),
          event.available() ? "available" : "unavailable: " + event.error());
    }
    health.compute(
        event.provider(),
        (name, current) ->
            (current == null ? ProviderHealth.empty(name, event.timestamp()) : current)
                .apply(event));
    Deque<ProviderStatusEvent> events =
        history.computeIfAbsent(event.provider(), k -> new ArrayDeque<>());
    synchronized (events) {
      events.addLast(event);
      while (events.size() > historyLimit) {
        events.removeFirst();
      }
    }
  }

  public Optional<ProviderStatusEvent> latest(String provider) {
    return Optional.ofNullable(latest.get(provider));
  }

  public Optional<ProviderHealth> health(String provider) {
    return Optional.ofNullable(health.get(provider));
  }

  /** Health per provider, sorted by provider name. */
  public Map<String, ProviderHealth> healthAll() {
    Map<String, ProviderHealth> sorted = new LinkedHashMap<>();
    health.keySet().stream().sorted().forEach(name -> sorted.put(name, health.get(name)));
    return sorted;
  }

  /** History for {@code provider}, oldest first. */
  public List<ProviderStatusEvent> history(String provider) {
    Deque<ProviderStatusEvent> events = history.get(provider);
    if (events == null) {
      return List.of();
    }
    synchronized (events) {
      return List.copyOf(events);
    }
  }
}
