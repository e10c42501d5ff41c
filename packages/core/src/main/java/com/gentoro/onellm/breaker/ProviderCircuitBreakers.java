package com.gentoro.onellm.breaker;

import com.gentoro.onellm.config.CircuitBreakerSettings;
import com.gentoro.onellm.exception.CircuitOpenException;
import com.gentoro.onellm.exception.PermanentProviderException;
import com.gentoro.onellm.exception.TransientProviderException;
import com.gentoro.onellm.status.CircuitState;
import com.gentoro.onellm.status.ProviderStatusEvent;
import com.gentoro.onellm.status.StatusReporter;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * One Resilience4j circuit breaker per provider.
 *
 * <p>Only failures that say something about the backend are recorded: transient failures and
 * rejected credentials. Bad requests, unexpected adapter errors and cancellations are ignored by
 * the breaker and left to the fallback chain.
 *
 * <p>Breakers are grouped in a {@link Scope}. {@link #reset(CircuitBreakerSettings)} replaces the
 * scope after a configuration refresh; requests keep the scope they started with, so outcomes of
 * old clients never reach the new breakers.
 */
public class ProviderCircuitBreakers {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(ProviderCircuitBreakers.class);

  private final StatusReporter reporter;
  private final Clock clock;
  private final AtomicReference<Scope> current = new AtomicReference<>();

  public ProviderCircuitBreakers(CircuitBreakerSettings settings, StatusReporter reporter) {
    this(settings, reporter, Clock.systemUTC());
  }

  public ProviderCircuitBreakers(
      CircuitBreakerSettings settings, StatusReporter reporter, Clock clock) {
    this.reporter = StatusReporter.guarded(Objects.requireNonNull(reporter, "reporter"));
    this.clock = Objects.requireNonNull(clock, "clock");
    this.current.set(new Scope(Objects.requireNonNull(settings, "settings")));
  }

  /** Breakers of the current configuration. Hold on to the result for one request. */
  public Scope scope() {
    return current.get();
  }

  /** Starts over with fresh breakers built from {@code settings}. */
  public void reset(CircuitBreakerSettings settings) {
    Scope fresh = new Scope(Objects.requireNonNull(settings, "settings"));
    Scope previous = current.getAndSet(fresh);
    previous.breakers.forEach(
        (provider, breaker) -> {
          CircuitState now = fresh.state(provider);
          if (toCircuitState(breaker.getState()) != now) {
            reporter.report(ProviderStatusEvent.circuit(provider, now, clock.instant()));
          }
        });
    log.debug("Circuit breakers reset; enabled={}", settings.enabled());
  }

  static boolean countsAsFailure(Throwable failure) {
    return failure instanceof TransientProviderException
        || (failure instanceof PermanentProviderException permanent
            && permanent.isAuthenticationFailure());
  }

  private static CircuitBreakerConfig toConfig(CircuitBreakerSettings settings) {
    return CircuitBreakerConfig.custom()
        .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
        .slidingWindowSize(settings.failureThreshold())
        .minimumNumberOfCalls(settings.failureThreshold())
        .failureRateThreshold(settings.failureRateThreshold())
        .permittedNumberOfCallsInHalfOpenState(settings.halfOpenCalls())
        .waitDurationInOpenState(settings.recoveryTimeout())
        .automaticTransitionFromOpenToHalfOpenEnabled(false)
        .recordException(ProviderCircuitBreakers::countsAsFailure)
        .ignoreException(failure -> !countsAsFailure(failure))
        .build();
  }

  private static CircuitState toCircuitState(CircuitBreaker.State state) {
    return switch (state) {
      case CLOSED -> CircuitState.CLOSED;
      case OPEN, FORCED_OPEN -> CircuitState.OPEN;
      case HALF_OPEN -> CircuitState.HALF_OPEN;
      default -> CircuitState.DISABLED;
    };
  }

  /** Breakers built from one configuration. */
  public final class Scope {
    private final CircuitBreakerSettings settings;
    private final CircuitBreakerConfig config;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    private Scope(CircuitBreakerSettings settings) {
      this.settings = settings;
      this.config = toConfig(settings);
    }

    /**
     * True when a call to {@code provider} would currently be let through. An open breaker whose
     * recovery timeout has elapsed moves to half-open here.
     */
    public boolean allows(String provider) {
      if (!settings.enabled()) {
        return true;
      }
      CircuitBreaker breaker = breaker(provider);
      if (!breaker.tryAcquirePermission()) {
        return false;
      }
      breaker.releasePermission();
      return true;
    }

    /**
     * Runs {@code call} through the breaker of {@code provider}.
     *
     * @throws CircuitOpenException when the breaker rejects the call
     */
    public <T> T execute(String provider, Supplier<T> call) {
      if (!settings.enabled()) {
        return call.get();
      }
      try {
        return breaker(provider).executeSupplier(call);
      } catch (CallNotPermittedException e) {
        throw new CircuitOpenException(
            provider, "Circuit breaker for %s is open".formatted(provider), e);
      }
    }

    public CircuitState state(String provider) {
      if (!settings.enabled()) {
        return CircuitState.DISABLED;
      }
      CircuitBreaker breaker = breakers.get(provider);
      return breaker == null ? CircuitState.CLOSED : toCircuitState(breaker.getState());
    }

    private CircuitBreaker breaker(String provider) {
      return breakers.computeIfAbsent(
          provider,
          name -> {
            CircuitBreaker breaker = CircuitBreaker.of(name, config);
            breaker
                .getEventPublisher()
                .onStateTransition(
                    event -> {
                      CircuitBreaker.State to = event.getStateTransition().getToState();
                      onTransition(name, toCircuitState(to));
                    });
            return breaker;
          });
    }

    private void onTransition(String provider, CircuitState state) {
      if (current.get() != this) {
        log.debug("Ignoring breaker transition of {} from a replaced configuration", provider);
        return;
      }
      if (state == CircuitState.OPEN) {
        log.warn("Circuit breaker for {} opened", provider);
      } else {
        log.info("Circuit breaker for {} is now {}", provider, state);
      }
      reporter.report(ProviderStatusEvent.circuit(provider, state, clock.instant()));
    }
  }
}
