package com.gentoro.onellm.orchestrator;

import com.gentoro.onellm.availability.AvailabilityProbe;
import com.gentoro.onellm.availability.AvailabilityRecord;
import com.gentoro.onellm.breaker.ProviderCircuitBreakers;
import com.gentoro.onellm.config.LlmSettings;
import com.gentoro.onellm.exception.CancelledRequestException;
import com.gentoro.onellm.exception.CircuitOpenException;
import com.gentoro.onellm.exception.ExceptionUtil;
import com.gentoro.onellm.exception.PermanentProviderException;
import com.gentoro.onellm.exception.ProviderException;
import com.gentoro.onellm.exception.ProviderNotConfiguredException;
import com.gentoro.onellm.exception.TransientProviderException;
import com.gentoro.onellm.logging.LoggingService;
import com.gentoro.onellm.model.LlmClient;
import com.gentoro.onellm.model.RequestSpec;
import com.gentoro.onellm.orchestrator.AttemptDiagnostic.Outcome;
import com.gentoro.onellm.registry.ProviderRegistry;
import com.gentoro.onellm.retry.RetryPolicy;
import com.gentoro.onellm.retry.Sleeper;
import com.gentoro.onellm.status.ProviderStatusEvent;
import com.gentoro.onellm.status.StatusReporter;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Resolves one request against the configured providers.
 *
 * <p>Candidates are the explicitly requested provider (if any) followed by the default provider
 * and the priority list, deduplicated and filtered to configured providers. A candidate whose
 * circuit breaker is open is skipped; the others are probed first, and an unavailable candidate is
 * skipped without spending retry budget. An available candidate is called through {@link
 * RetryPolicy}, each attempt passing through its circuit breaker. The first success wins; when
 * every candidate fails the result carries an aggregate error ending with the most recent failure.
 *
 * <p>Expected failures never escape as exceptions: they are reported through {@link
 * FallbackResult}. Each request owns its candidate list and diagnostics, so any number of
 * requests can run concurrently.
 */
public class FallbackOrchestrator {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(FallbackOrchestrator.class);

  private final ProviderRegistry registry;
  private final AvailabilityProbe availability;
  private final ProviderCircuitBreakers breakers;
  private final StatusReporter reporter;
  private final ExecutorService requestExecutor;
  private final Executor callExecutor;
  private final Sleeper sleeper;
  private final Clock clock;

  public FallbackOrchestrator(
      ProviderRegistry registry,
      AvailabilityProbe availability,
      ProviderCircuitBreakers breakers,
      StatusReporter reporter,
      ExecutorService requestExecutor,
      Executor callExecutor) {
    this(
        registry,
        availability,
        breakers,
        reporter,
        requestExecutor,
        callExecutor,
        Sleeper.SYSTEM,
        Clock.systemUTC());
  }

  public FallbackOrchestrator(
      ProviderRegistry registry,
      AvailabilityProbe availability,
      ProviderCircuitBreakers breakers,
      StatusReporter reporter,
      ExecutorService requestExecutor,
      Executor callExecutor,
      Sleeper sleeper,
      Clock clock) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.availability = Objects.requireNonNull(availability, "availability");
    this.breakers = Objects.requireNonNull(breakers, "breakers");
    this.reporter = StatusReporter.guarded(Objects.requireNonNull(reporter, "reporter"));
    this.requestExecutor = Objects.requireNonNull(requestExecutor, "requestExecutor");
    this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Runs {@code request} on the request executor. {@code cancel(true)} abandons it. */
  public Future<FallbackResult> submit(RequestSpec request) {
    Objects.requireNonNull(request, "request");
    return requestExecutor.submit(() -> generate(request));
  }

  public FallbackResult generate(String prompt) {
    return generate(RequestSpec.ofPrompt(prompt));
  }

  public FallbackResult generate(RequestSpec request) {
    Objects.requireNonNull(request, "request");
    try (LoggingService.MdcScope ignored = LoggingService.withRequestId(request.requestId())) {
      long generation = availability.generation();
      ProviderCircuitBreakers.Scope breakerScope = breakers.scope();
      return new RequestRun(request, generation, breakerScope, registry.snapshot()).run();
    }
  }

  /**
   * Probes every configured provider once, bypassing the availability cache. Each probe is bounded
   * by the request timeout.
   */
  public Map<String, AvailabilityRecord> probeAll() {
    long generation = availability.generation();
    ProviderRegistry.Snapshot snapshot = registry.snapshot();
    Duration timeout = snapshot.settings().requestTimeout();
    Map<String, AvailabilityRecord> results = new LinkedHashMap<>();
    for (String name : snapshot.configuredNames()) {
      LlmClient client = snapshot.get(name);
      results.put(
          name,
          availability.check(
              name, Duration.ZERO, generation, () -> probeWithDeadline(name, client, timeout)));
    }
    return results;
  }

  private void probeWithDeadline(String provider, LlmClient client, Duration timeout) {
    callWithDeadline(
        provider,
        "probe",
        timeout,
        () -> {
          client.probe();
          return Boolean.TRUE;
        });
  }

  /**
   * Runs one adapter call on the call executor and waits at most {@code timeout} for it. An
   * abandoned call may still finish in the background; its result is discarded.
   */
  private <T> T callWithDeadline(
      String provider, String operation, Duration timeout, Supplier<T> call) {
    CompletableFuture<T> future;
    try {
      future = CompletableFuture.supplyAsync(call, callExecutor);
    } catch (RejectedExecutionException e) {
      throw new PermanentProviderException(
          provider, "Cannot schedule %s call for %s".formatted(operation, provider), e);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new TransientProviderException(
          provider,
          "%s %s call timed out after %dms".formatted(provider, operation, timeout.toMillis()),
          e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new CancelledRequestException(
          "Interrupted during %s call to %s".formatted(operation, provider), e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof ProviderException providerException) {
        throw providerException;
      }
      if (cause instanceof CancelledRequestException cancelled) {
        throw cancelled;
      }
      log.error(
          "Unexpected failure from provider {}:\n{}",
          provider,
          ExceptionUtil.formatCompactStackTrace(cause));
      throw new PermanentProviderException(
          provider,
          "%s %s call failed unexpectedly: %s"
              .formatted(provider, operation, ExceptionUtil.describe(cause)),
          cause);
    }
  }

  /** State of one request: candidate list, diagnostics and the most recent failure. */
  private final class RequestRun {
    private final RequestSpec request;
    private final long generation;
    private final ProviderCircuitBreakers.Scope breakerScope;
    private final ProviderRegistry.Snapshot snapshot;
    private final LlmSettings settings;
    private final RetryPolicy retryPolicy;
    private final List<AttemptDiagnostic> attempts = new ArrayList<>();
    private String lastProvider;
    private String lastError;

    RequestRun(
        RequestSpec request,
        long generation,
        ProviderCircuitBreakers.Scope breakerScope,
        ProviderRegistry.Snapshot snapshot) {
      this.request = request;
      this.generation = generation;
      this.breakerScope = breakerScope;
      this.snapshot = snapshot;
      this.settings = snapshot.settings();
      this.retryPolicy = new RetryPolicy(settings.retry(), sleeper);
    }

    FallbackResult run() {
      List<String> candidates = candidates();
      log.debug("Request {} candidates: {}", request.requestId(), candidates);
      if (candidates.isEmpty() && attempts.isEmpty()) {
        log.warn(FallbackResult.NO_PROVIDERS);
        return FallbackResult.failure(FallbackResult.NO_PROVIDERS, attempts);
      }
      for (String provider : candidates) {
        if (Thread.currentThread().isInterrupted()) {
          return cancelled(provider, 0, 0L);
        }
        FallbackResult result = attempt(provider);
        if (result != null) {
          return result;
        }
      }
      String error =
          "All LLM providers failed; last error from %s: %s".formatted(lastProvider, lastError);
      log.warn(error);
      return FallbackResult.failure(error, attempts);
    }

    private List<String> candidates() {
      Set<String> ordered = new LinkedHashSet<>();
      String explicit = request.provider();
      if (explicit != null) {
        if (snapshot.isConfigured(explicit)) {
          ordered.add(explicit);
        } else {
          String error = new ProviderNotConfiguredException(explicit).getMessage();
          recordFailure(new AttemptDiagnostic(explicit, Outcome.NOT_CONFIGURED, 0, error, 0L));
          log.warn("Requested provider {} is not configured", explicit);
        }
      }
      ordered.addAll(snapshot.priority());
      return List.copyOf(ordered);
    }

    /** Returns a final result, or {@code null} to move on to the next candidate. */
    private FallbackResult attempt(String provider) {
      LlmClient client = snapshot.get(provider);
      long start = clock.millis();
      if (!breakerScope.allows(provider)) {
        log.info("Skipping provider {}: circuit breaker open", provider);
        recordFailure(
            new AttemptDiagnostic(
                provider, Outcome.CIRCUIT_OPEN, 0, "Circuit breaker open", elapsed(start)));
        return null;
      }
      int[] calls = {0};
      long[] callStart = {start};
      try {
        AvailabilityRecord status =
            availability.check(
                provider,
                settings.availabilityTtl(),
                generation,
                () -> probeWithDeadline(provider, client, settings.requestTimeout()));
        if (!status.available()) {
          log.info("Skipping unavailable provider {}: {}", provider, status.lastError());
          recordFailure(
              new AttemptDiagnostic(
                  provider, Outcome.UNAVAILABLE, 0, status.lastError(), elapsed(start)));
          return null;
        }

        String text =
            retryPolicy.execute(
                provider,
                attemptNumber -> {
                  calls[0] = attemptNumber;
                  callStart[0] = clock.millis();
                  String generated =
                      breakerScope.execute(
                          provider,
                          () ->
                              callWithDeadline(
                                  provider,
                                  "generate",
                                  settings.requestTimeout(),
                                  () -> client.generateText(request)));
                  report(provider, true, null, elapsed(callStart[0]));
                  return generated;
                },
                (attemptNumber, failure) -> {
                  if (!(failure instanceof CircuitOpenException)) {
                    report(provider, false, failure.getMessage(), elapsed(callStart[0]));
                  }
                });
        attempts.add(
            new AttemptDiagnostic(provider, Outcome.SUCCEEDED, calls[0], null, elapsed(start)));
        log.info("Request {} served by {}", request.requestId(), provider);
        return FallbackResult.success(text, provider, attempts);
      } catch (CircuitOpenException e) {
        log.info("Provider {} rejected by its circuit breaker", provider);
        recordFailure(
            new AttemptDiagnostic(
                provider, Outcome.CIRCUIT_OPEN, calls[0] - 1, e.getMessage(), elapsed(start)));
        return null;
      } catch (TransientProviderException e) {
        availability.markFailure(provider, e.getMessage(), generation);
        recordFailure(
            new AttemptDiagnostic(
                provider, Outcome.TRANSIENT_EXHAUSTED, calls[0], e.getMessage(), elapsed(start)));
        return null;
      } catch (PermanentProviderException e) {
        if (e.isAuthenticationFailure()) {
          availability.markFailure(provider, e.getMessage(), generation);
        }
        log.warn("Provider {} failed permanently: {}", provider, e.getMessage());
        recordFailure(
            new AttemptDiagnostic(
                provider, Outcome.PERMANENT_FAILURE, calls[0], e.getMessage(), elapsed(start)));
        return null;
      } catch (CancelledRequestException e) {
        return cancelled(provider, calls[0], elapsed(start));
      }
    }

    private FallbackResult cancelled(String provider, int calls, long latencyMs) {
      String error = "Request was cancelled";
      attempts.add(new AttemptDiagnostic(provider, Outcome.CANCELLED, calls, error, latencyMs));
      log.info("Request {} cancelled while on provider {}", request.requestId(), provider);
      return FallbackResult.failure(error, attempts);
    }

    private void recordFailure(AttemptDiagnostic diagnostic) {
      attempts.add(diagnostic);
      lastProvider = diagnostic.provider();
      lastError = diagnostic.error();
    }

    private void report(String provider, boolean available, String error, long latencyMs) {
      reporter.report(
          new ProviderStatusEvent(
              provider,
              available,
              error,
              latencyMs,
              ProviderStatusEvent.Phase.ATTEMPT,
              clock.instant()));
    }

    private long elapsed(long start) {
      return Math.max(0L, clock.millis() - start);
    }
  }
}
