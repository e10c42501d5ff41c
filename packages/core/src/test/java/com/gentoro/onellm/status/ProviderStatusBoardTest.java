package com.gentoro.onellm.status;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProviderStatusBoardTest {

  private static ProviderStatusEvent event(String provider, boolean available, long latency) {
    return new ProviderStatusEvent(
        provider,
        available,
        available ? null : "down",
        latency,
        ProviderStatusEvent.Phase.PROBE,
        Instant.EPOCH.plusMillis(latency));
  }

  @Test
  @DisplayName("Keeps the latest event per provider")
  void latestPerProvider() {
    ProviderStatusBoard board = new ProviderStatusBoard();
    board.report(event("b", true, 1));
    board.report(event("a", false, 2));
    board.report(event("a", true, 3));

    assertTrue(board.latest("a").orElseThrow().available());
    assertEquals(List.of("a", "b"), List.copyOf(board.healthAll().keySet()));
    assertTrue(board.latest("zzz").isEmpty());
  }

  private static ProviderStatusEvent attempt(boolean available, long latency) {
    return new ProviderStatusEvent(
        "a",
        available,
        available ? null : "timeout",
        latency,
        ProviderStatusEvent.Phase.ATTEMPT,
        Instant.EPOCH.plusMillis(latency));
  }

  @Test
  @DisplayName("Health counts requests and failures and averages response times")
  void aggregatesAttempts() {
    ProviderStatusBoard board = new ProviderStatusBoard();
    board.report(attempt(true, 100));
    board.report(attempt(false, 300));
    board.report(attempt(true, 200));

    ProviderHealth health = board.health("a").orElseThrow();
    assertEquals(3, health.requestCount());
    assertEquals(1, health.failureCount());
    assertEquals(200.0, health.averageResponseMs(), 0.001);
    assertTrue(health.available());
    assertNull(health.lastError());
  }

  @Test
  @DisplayName("Probe results do not count as requests")
  void probesOnlyUpdateAvailability() {
    ProviderStatusBoard board = new ProviderStatusBoard();
    board.report(attempt(true, 100));
    board.report(event("a", false, 40));

    ProviderHealth health = board.health("a").orElseThrow();
    assertEquals(1, health.requestCount());
    assertEquals(100.0, health.averageResponseMs(), 0.001);
    assertFalse(health.available());
    assertEquals("down", health.lastError());
  }

  @Test
  @DisplayName("Circuit events update the breaker state and keep the counters")
  void tracksCircuitState() {
    ProviderStatusBoard board = new ProviderStatusBoard();
    board.report(attempt(false, 50));
    board.report(ProviderStatusEvent.circuit("a", CircuitState.OPEN, Instant.EPOCH));

    ProviderHealth open = board.health("a").orElseThrow();
    assertEquals(CircuitState.OPEN, open.circuitState());
    assertEquals(1, open.failureCount());
    assertEquals("timeout", open.lastError());

    board.report(ProviderStatusEvent.circuit("a", CircuitState.CLOSED, Instant.EPOCH));
    assertEquals(CircuitState.CLOSED, board.health("a").orElseThrow().circuitState());
    assertTrue(board.health("b").isEmpty());
  }

  @Test
  @DisplayName("History is bounded and keeps the newest events")
  void boundedHistory() {
    ProviderStatusBoard board = new ProviderStatusBoard(3);
    for (int i = 1; i <= 5; i++) {
      board.report(event("a", true, i));
    }

    assertEquals(
        List.of(3L, 4L, 5L),
        board.history("a").stream().map(ProviderStatusEvent::latencyMs).toList());
  }

  @Test
  @DisplayName("Composite reporters fan out in order")
  void compositeFansOut() {
    ProviderStatusBoard first = new ProviderStatusBoard();
    ProviderStatusBoard second = new ProviderStatusBoard();

    StatusReporter.composite(List.of(first, second)).report(event("a", true, 1));

    assertTrue(first.latest("a").isPresent());
    assertTrue(second.latest("a").isPresent());
  }

  @Test
  @DisplayName("A guarded reporter swallows delegate failures")
  void guardedReporter() {
    StatusReporter failing =
        e -> {
          throw new IllegalStateException("sink down");
        };

    assertDoesNotThrow(() -> StatusReporter.guarded(failing).report(event("a", true, 1)));
  }
}
