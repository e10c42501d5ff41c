package com.gentoro.onellm;

import com.gentoro.onellm.availability.AvailabilityProbe;
import com.gentoro.onellm.availability.AvailabilityRecord;
import com.gentoro.onellm.breaker.ProviderCircuitBreakers;
import com.gentoro.onellm.config.LlmSettings;
import com.gentoro.onellm.exception.StateException;
import com.gentoro.onellm.logging.LoggingService;
import com.gentoro.onellm.orchestrator.FallbackOrchestrator;
import com.gentoro.onellm.registry.ProviderRegistry;
import com.gentoro.onellm.status.LoggingStatusReporter;
import com.gentoro.onellm.status.ProviderStatusBoard;
import com.gentoro.onellm.status.StatusReporter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: loads configuration, wires the provider layer and owns its executors.
 *
 * <p>Typical use:
 *
 * <pre>
 *   OneLlm oneLlm = new OneLlm("classpath:application.yaml");
 *   oneLlm.initialize();
 *   FallbackResult result = oneLlm.orchestrator().generate("Hello");
 *   oneLlm.shutdown();
 * </pre>
 */
public class OneLlm implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(OneLlm.class);

  private final Supplier<Configuration> configurationSource;
  private volatile Configuration configuration;
  private ProviderStatusBoard statusBoard;
  private AvailabilityProbe availability;
  private ProviderCircuitBreakers breakers;
  private ProviderRegistry registry;
  private FallbackOrchestrator orchestrator;
  private ExecutorService requestExecutor;
  private ExecutorService callExecutor;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  /** Reads configuration from {@code location}; {@link #refresh()} reads it again. */
  public OneLlm(String location) {
    this(() -> new ConfigurationProvider(location).config());
  }

  public OneLlm(Supplier<Configuration> configurationSource) {
    this.configurationSource = Objects.requireNonNull(configurationSource, "configurationSource");
  }

  public void initialize() {
    if (!initialized.compareAndSet(false, true)) {
      throw new StateException("OneLlm already initialized");
    }
    this.configuration = configurationSource.get();
    LoggingService.applyConfiguration(configuration);

    this.statusBoard = new ProviderStatusBoard();
    StatusReporter reporter =
        StatusReporter.composite(List.of(statusBoard, new LoggingStatusReporter()));
    this.availability = new AvailabilityProbe(reporter);
    this.breakers =
        new ProviderCircuitBreakers(LlmSettings.from(configuration).circuitBreaker(), reporter);
    this.registry = new ProviderRegistry(() -> LlmSettings.from(configuration()));
    this.requestExecutor = Executors.newCachedThreadPool(namedThreads("onellm-request"));
    this.callExecutor = Executors.newCachedThreadPool(namedThreads("onellm-call"));
    this.orchestrator =
        new FallbackOrchestrator(
            registry, availability, breakers, reporter, requestExecutor, callExecutor);

    log.info("OneLlm initialized; configured providers: {}", registry.configuredNames());
  }

  /**
   * Re-reads configuration, rebuilds every provider client, clears the availability cache and
   * starts every circuit breaker over. Requests already running keep using the registry snapshot
   * they started with; their outcomes no longer reach the cache or the breakers.
   */
  public void refresh() {
    requireInitialized();
    Configuration reloaded = configurationSource.get();
    LlmSettings settings = LlmSettings.from(reloaded);
    this.configuration = reloaded;
    LoggingService.applyConfiguration(reloaded);
    registry.refresh(settings);
    availability.invalidate();
    breakers.reset(settings.circuitBreaker());
  }

  /**
   * Probes every configured provider once, bypassing the availability cache.
   *
   * @see FallbackOrchestrator#probeAll()
   */
  public Map<String, AvailabilityRecord> probeAll() {
    requireInitialized();
    return orchestrator.probeAll();
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    shutdownExecutor(requestExecutor);
    shutdownExecutor(callExecutor);
    log.info("OneLlm shut down");
  }

  @Override
  public void close() {
    shutdown();
  }

  private void shutdownExecutor(ExecutorService executor) {
    if (executor == null) {
      return;
    }
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Executor did not terminate within 5s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory namedThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private void requireInitialized() {
    if (!initialized.get()) {
      throw new StateException("OneLlm not initialized. Call initialize() first.");
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configuration == null) {
      throw new StateException("OneLlm not initialized. Call initialize() first.");
    }
    return configuration;
  }

  public ProviderRegistry registry() {
    return registry;
  }

  public AvailabilityProbe availability() {
    return availability;
  }

  public ProviderCircuitBreakers circuitBreakers() {
    return breakers;
  }

  public ProviderStatusBoard statusBoard() {
    return statusBoard;
  }

  public FallbackOrchestrator orchestrator() {
    return orchestrator;
  }
}
