package com.gentoro.onellm.registry;

import com.gentoro.onellm.config.LlmSettings;
import com.gentoro.onellm.config.ProviderConfig;
import com.gentoro.onellm.exception.ExceptionUtil;
import com.gentoro.onellm.exception.ProviderNotConfiguredException;
import com.gentoro.onellm.model.LlmClient;
import com.gentoro.onellm.model.LlmClientFactory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds one {@link LlmClient} per usable provider.
 *
 * <p>The client map is built lazily on first access and replaced wholesale by {@link #refresh}.
 * Readers always see one complete {@link Snapshot}: either the one before a refresh or the one
 * after it, never a mixture.
 *
 * <p>A provider is usable when its credential is present and not a placeholder, its adapter type
 * is known and its client can be constructed. Everything else is excluded and logged once per
 * build.
 */
public class ProviderRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(ProviderRegistry.class);

  /** Creates a client for one provider; must not perform network I/O. */
  @FunctionalInterface
  public interface ClientBuilder {
    LlmClient build(ProviderConfig config);
  }

  private final Supplier<LlmSettings> settingsSource;
  private final ClientBuilder clientBuilder;
  private final AtomicReference<Snapshot> current = new AtomicReference<>();

  public ProviderRegistry(Supplier<LlmSettings> settingsSource) {
    this(settingsSource, LlmClientFactory::create);
  }

  public ProviderRegistry(Supplier<LlmSettings> settingsSource, ClientBuilder clientBuilder) {
    this.settingsSource = Objects.requireNonNull(settingsSource, "settingsSource");
    this.clientBuilder = Objects.requireNonNull(clientBuilder, "clientBuilder");
  }

  /** Current snapshot, building it on first use. */
  public Snapshot snapshot() {
    Snapshot snapshot = current.get();
    if (snapshot != null) {
      return snapshot;
    }
    Snapshot built = build(settingsSource.get());
    return current.compareAndSet(null, built) ? built : current.get();
  }

  /**
   * @throws ProviderNotConfiguredException when {@code name} is not a usable provider
   */
  public LlmClient get(String name) {
    return snapshot().get(name);
  }

  public List<String> configuredNames() {
    return snapshot().configuredNames();
  }

  public boolean isConfigured(String name) {
    return snapshot().isConfigured(name);
  }

  /** Re-reads settings from the configured source and swaps in a new snapshot. */
  public Snapshot refresh() {
    return refresh(settingsSource.get());
  }

  /** Builds a new snapshot from {@code settings} and publishes it with one atomic write. */
  public Snapshot refresh(LlmSettings settings) {
    Snapshot built = build(settings);
    current.set(built);
    log.info("Provider registry refreshed: configured providers {}", built.configuredNames());
    return built;
  }

  private Snapshot build(LlmSettings settings) {
    Map<String, LlmClient> clients = new LinkedHashMap<>();
    Map<String, String> excluded = new LinkedHashMap<>();
    for (ProviderConfig config : settings.providers().values()) {
      if (settings.placeholderPolicy().isPlaceholder(config.apiKey())) {
        excluded.put(config.name(), "missing or placeholder credential");
        continue;
      }
      try {
        clients.put(config.name(), clientBuilder.build(config));
      } catch (RuntimeException e) {
        excluded.put(config.name(), ExceptionUtil.describe(e));
      }
    }
    excluded.forEach(
        (name, reason) -> log.warn("Provider {} is not available: {}", name, reason));
    for (String name : clients.keySet()) {
      if (!settings.effectivePriority().contains(name)) {
        log.warn(
            "Provider {} is configured but not in llm.priority; it is only used when requested"
                + " explicitly",
            name);
      }
    }
    return new Snapshot(settings, clients, excluded);
  }

  /** Immutable view of the registry at one point in time. */
  public static final class Snapshot {
    private final LlmSettings settings;
    private final Map<String, LlmClient> clients;
    private final Map<String, String> excluded;

    Snapshot(LlmSettings settings, Map<String, LlmClient> clients, Map<String, String> excluded) {
      this.settings = settings;
      this.clients = Collections.unmodifiableMap(new LinkedHashMap<>(clients));
      this.excluded = Collections.unmodifiableMap(new LinkedHashMap<>(excluded));
    }

    public LlmSettings settings() {
      return settings;
    }

    public LlmClient get(String name) {
      LlmClient client = clients.get(name);
      if (client == null) {
        throw new ProviderNotConfiguredException(name);
      }
      return client;
    }

    public boolean isConfigured(String name) {
      return name != null && clients.containsKey(name);
    }

    /** Usable provider names in configuration order. */
    public List<String> configuredNames() {
      return List.copyOf(clients.keySet());
    }

    /** Providers left out of this snapshot, with the reason. */
    public Map<String, String> excluded() {
      return excluded;
    }

    /** Default provider and priority list, filtered to usable providers. */
    public List<String> priority() {
      return settings.effectivePriority().stream().filter(clients::containsKey).toList();
    }
  }
}
