package com.gentoro.onellm.breaker;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onellm.config.CircuitBreakerSettings;
import com.gentoro.onellm.exception.CircuitOpenException;
import com.gentoro.onellm.exception.PermanentProviderException;
import com.gentoro.onellm.exception.TransientProviderException;
import com.gentoro.onellm.status.CircuitState;
import com.gentoro.onellm.status.ProviderStatusEvent;
import com.gentoro.onellm.support.RecordingStatusReporter;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProviderCircuitBreakersTest {
  private static final Duration RECOVERY = Duration.ofMillis(50);

  private final RecordingStatusReporter reporter = new RecordingStatusReporter();
  private final AtomicInteger calls = new AtomicInteger();

  private static CircuitBreakerSettings settings(int threshold) {
    return new CircuitBreakerSettings(true, threshold, 50.0f, 1, RECOVERY);
  }

  private String succeed() {
    calls.incrementAndGet();
    return "ok";
  }

  private static void fail(ProviderCircuitBreakers.Scope scope, RuntimeException failure) {
    RuntimeException thrown =
        assertThrows(
            RuntimeException.class,
            () ->
                scope.execute(
                    "a",
                    () -> {
                      throw failure;
                    }));
    assertSame(failure, thrown);
  }

  private static TransientProviderException overloaded() {
    return new TransientProviderException("a", 503, "overloaded", null);
  }

  private static void waitForRecovery() throws InterruptedException {
    Thread.sleep(RECOVERY.toMillis() * 3);
  }

  private List<CircuitState> transitions() {
    return reporter.eventsFor("a").stream()
        .filter(e -> e.phase() == ProviderStatusEvent.Phase.CIRCUIT)
        .map(ProviderStatusEvent::circuitState)
        .toList();
  }

  @Test
  @DisplayName("Repeated transient failures open the breaker and reject further calls")
  void opensAfterThreshold() {
    ProviderCircuitBreakers breakers = new ProviderCircuitBreakers(settings(2), reporter);
    ProviderCircuitBreakers.Scope scope = breakers.scope();

    fail(scope, overloaded());
    assertEquals(CircuitState.CLOSED, scope.state("a"));
    fail(scope, overloaded());

    assertEquals(CircuitState.OPEN, scope.state("a"));
    assertFalse(scope.allows("a"));
    CircuitOpenException rejected =
        assertThrows(CircuitOpenException.class, () -> scope.execute("a", this::succeed));
    assertEquals("a", rejected.getProvider());
    assertFalse(rejected.isRetriable());
    assertEquals(0, calls.get());
    assertEquals(List.of(CircuitState.OPEN), transitions());
  }

  @Test
  @DisplayName("After the recovery timeout a successful trial call closes the breaker")
  void halfOpenTrialSuccessCloses() throws Exception {
    ProviderCircuitBreakers.Scope scope =
        new ProviderCircuitBreakers(settings(2), reporter).scope();
    fail(scope, overloaded());
    fail(scope, overloaded());

    waitForRecovery();

    assertTrue(scope.allows("a"));
    assertEquals(CircuitState.HALF_OPEN, scope.state("a"));
    assertEquals("ok", scope.execute("a", this::succeed));
    assertEquals(CircuitState.CLOSED, scope.state("a"));
    assertEquals(
        List.of(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.CLOSED), transitions());
  }

  @Test
  @DisplayName("A failed trial call sends a half-open breaker back to open")
  void halfOpenTrialFailureReopens() throws Exception {
    ProviderCircuitBreakers.Scope scope =
        new ProviderCircuitBreakers(settings(2), reporter).scope();
    fail(scope, overloaded());
    fail(scope, overloaded());

    waitForRecovery();
    assertTrue(scope.allows("a"));
    fail(scope, overloaded());

    assertEquals(CircuitState.OPEN, scope.state("a"));
    assertFalse(scope.allows("a"));
    assertEquals(
        List.of(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.OPEN), transitions());
  }

  @Test
  @DisplayName("Rejected credentials count as failures, bad requests do not")
  void onlyBackendFailuresCount() {
    ProviderCircuitBreakers.Scope scope =
        new ProviderCircuitBreakers(settings(2), reporter).scope();

    for (int i = 0; i < 5; i++) {
      fail(scope, new PermanentProviderException("a", 400, "bad request", null));
    }
    assertEquals(CircuitState.CLOSED, scope.state("a"));

    fail(scope, new PermanentProviderException("a", 401, "invalid key", null));
    fail(scope, new PermanentProviderException("a", 403, "forbidden", null));
    assertEquals(CircuitState.OPEN, scope.state("a"));
  }

  @Test
  @DisplayName("Breakers are kept per provider")
  void providersAreIndependent() {
    ProviderCircuitBreakers.Scope scope =
        new ProviderCircuitBreakers(settings(2), reporter).scope();
    fail(scope, overloaded());
    fail(scope, overloaded());

    assertFalse(scope.allows("a"));
    assertTrue(scope.allows("b"));
    assertEquals("ok", scope.execute("b", this::succeed));
    assertEquals(CircuitState.CLOSED, scope.state("b"));
  }

  @Test
  @DisplayName("A disabled breaker passes every call through")
  void disabledPassesThrough() {
    CircuitBreakerSettings disabled = new CircuitBreakerSettings(false, 1, 50.0f, 1, RECOVERY);
    ProviderCircuitBreakers.Scope scope = new ProviderCircuitBreakers(disabled, reporter).scope();

    for (int i = 0; i < 3; i++) {
      fail(scope, overloaded());
    }

    assertTrue(scope.allows("a"));
    assertEquals("ok", scope.execute("a", this::succeed));
    assertEquals(CircuitState.DISABLED, scope.state("a"));
    assertTrue(transitions().isEmpty());
  }

  @Test
  @DisplayName("reset() starts with closed breakers and reports the change")
  void resetClosesBreakers() {
    ProviderCircuitBreakers breakers = new ProviderCircuitBreakers(settings(2), reporter);
    ProviderCircuitBreakers.Scope old = breakers.scope();
    fail(old, overloaded());
    fail(old, overloaded());

    breakers.reset(settings(2));

    assertNotSame(old, breakers.scope());
    assertTrue(breakers.scope().allows("a"));
    assertEquals(CircuitState.CLOSED, breakers.scope().state("a"));
    assertEquals(List.of(CircuitState.OPEN, CircuitState.CLOSED), transitions());
  }

  @Test
  @DisplayName("Outcomes recorded on a replaced scope are not reported")
  void replacedScopeStaysQuiet() {
    ProviderCircuitBreakers breakers = new ProviderCircuitBreakers(settings(2), reporter);
    ProviderCircuitBreakers.Scope old = breakers.scope();
    breakers.reset(settings(2));

    fail(old, overloaded());
    fail(old, overloaded());

    assertEquals(CircuitState.OPEN, old.state("a"));
    assertEquals(CircuitState.CLOSED, breakers.scope().state("a"));
    assertTrue(transitions().isEmpty());
  }
}
