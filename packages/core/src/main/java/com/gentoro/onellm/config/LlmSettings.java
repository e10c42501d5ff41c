package com.gentoro.onellm.config;

import com.gentoro.onellm.exception.ConfigException;
import com.gentoro.onellm.utility.StringUtility;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Typed, immutable view over the {@code llm.*} configuration namespace.
 *
 * <p>Example configuration:
 *
 * <pre>
 *   llm:
 *     default-provider: anthropic
 *     priority: [anthropic, openrouter, zai, openai, gemini]
 *     request-timeout: 120s
 *     availability:
 *       ttl: 60s
 *     retry:
 *       max-attempts: 3
 *       base-delay: 4s
 *       max-delay: 10s
 *     circuit-breaker:
 *       failure-threshold: 5
 *       recovery-timeout: 60s
 *     defaults:
 *       temperature: 0.7
 *       max-tokens: 2048
 *     providers:
 *       anthropic:
 *         type: anthropic
 *         apiKey: ${env:ANTHROPIC_API_KEY}
 *         model: claude-3-5-sonnet-20241022
 * </pre>
 *
 * <p>A new instance is produced for every configuration read; registry refreshes swap whole
 * instances and never mutate one.
 */
public final class LlmSettings {
  public static final List<String> DEFAULT_PRIORITY =
      List.of("anthropic", "openrouter", "zai", "openai", "gemini");
  public static final double DEFAULT_TEMPERATURE = 0.7;
  public static final int DEFAULT_MAX_TOKENS = 2048;
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(120);
  public static final Duration DEFAULT_PROVIDER_TIMEOUT = Duration.ofSeconds(60);
  public static final Duration DEFAULT_AVAILABILITY_TTL = Duration.ofSeconds(60);

  private final String defaultProvider;
  private final List<String> priority;
  private final Duration requestTimeout;
  private final Duration availabilityTtl;
  private final RetrySettings retry;
  private final CircuitBreakerSettings circuitBreaker;
  private final double defaultTemperature;
  private final int defaultMaxTokens;
  private final Map<String, ProviderConfig> providers;
  private final PlaceholderPolicy placeholderPolicy;

  private LlmSettings(Builder builder) {
    this.defaultProvider = builder.defaultProvider;
    this.priority = List.copyOf(builder.priority);
    this.requestTimeout = Objects.requireNonNull(builder.requestTimeout, "requestTimeout");
    this.availabilityTtl = Objects.requireNonNull(builder.availabilityTtl, "availabilityTtl");
    this.retry = Objects.requireNonNull(builder.retry, "retry");
    this.circuitBreaker = Objects.requireNonNull(builder.circuitBreaker, "circuitBreaker");
    this.defaultTemperature = builder.defaultTemperature;
    this.defaultMaxTokens = builder.defaultMaxTokens;
    this.providers = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(builder.providers));
    this.placeholderPolicy =
        Objects.requireNonNull(builder.placeholderPolicy, "placeholderPolicy");
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads settings from the {@code llm.*} subset of {@code configuration}.
   *
   * @throws ConfigException when a value cannot be parsed
   */
  public static LlmSettings from(Configuration configuration) {
    Configuration llm = configuration.subset("llm");
    Builder builder = builder();
    try {
      builder.defaultProvider(normalize(llm.getString("default-provider", null)));
      List<String> priority = llm.getList(String.class, "priority", DEFAULT_PRIORITY);
      builder.priority(priority.stream().map(LlmSettings::normalize).toList());
      builder.requestTimeout(duration(llm, "request-timeout", DEFAULT_REQUEST_TIMEOUT));
      builder.availabilityTtl(duration(llm, "availability.ttl", DEFAULT_AVAILABILITY_TTL));
      builder.retry(
          new RetrySettings(
              llm.getInt("retry.max-attempts", RetrySettings.DEFAULT.maxAttempts()),
              duration(llm, "retry.base-delay", RetrySettings.DEFAULT.baseDelay()),
              duration(llm, "retry.max-delay", RetrySettings.DEFAULT.maxDelay()),
              llm.getDouble("retry.multiplier", RetrySettings.DEFAULT.multiplier())));
      CircuitBreakerSettings breakerDefaults = CircuitBreakerSettings.DEFAULT;
      builder.circuitBreaker(
          new CircuitBreakerSettings(
              llm.getBoolean("circuit-breaker.enabled", breakerDefaults.enabled()),
              llm.getInt("circuit-breaker.failure-threshold", breakerDefaults.failureThreshold()),
              llm.getFloat(
                  "circuit-breaker.failure-rate", breakerDefaults.failureRateThreshold()),
              llm.getInt("circuit-breaker.half-open-calls", breakerDefaults.halfOpenCalls()),
              duration(
                  llm, "circuit-breaker.recovery-timeout", breakerDefaults.recoveryTimeout())));
      builder.defaultTemperature(llm.getDouble("defaults.temperature", DEFAULT_TEMPERATURE));
      builder.defaultMaxTokens(llm.getInt("defaults.max-tokens", DEFAULT_MAX_TOKENS));
      builder.placeholderPolicy(
          new PlaceholderPolicy(llm.getList(String.class, "placeholders", List.of())));

      Configuration providers = llm.subset("providers");
      for (String name : providerNames(providers)) {
        builder.provider(providerConfig(name, providers.subset(name), builder));
      }
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid llm configuration: " + e.getMessage(), e);
    }
    return builder.build();
  }

  private static Set<String> providerNames(Configuration providers) {
    Set<String> names = new LinkedHashSet<>();
    Iterator<String> keys = providers.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      int dot = key.indexOf('.');
      names.add(dot < 0 ? key : key.substring(0, dot));
    }
    return names;
  }

  private static ProviderConfig providerConfig(
      String rawName, Configuration sub, Builder defaults) {
    String name = normalize(rawName);
    String type = normalize(sub.getString("type", name));
    List<String> allowed = sub.getList(String.class, "allowed-options", null);

    Map<String, String> headers = new LinkedHashMap<>();
    Configuration headerConfig = sub.subset("headers");
    Iterator<String> headerKeys = headerConfig.getKeys();
    while (headerKeys.hasNext()) {
      String header = headerKeys.next();
      headers.put(header, headerConfig.getString(header));
    }

    return new ProviderConfig(
        name,
        type,
        trimToNull(sub.getString("apiKey", null)),
        trimToNull(sub.getString("model", null)),
        trimToNull(sub.getString("baseUrl", null)),
        allowed == null ? null : new LinkedHashSet<>(allowed),
        sub.getDouble("temperature", defaults.defaultTemperature),
        sub.getInt("max-tokens", defaults.defaultMaxTokens),
        duration(sub, "timeout", DEFAULT_PROVIDER_TIMEOUT),
        headers);
  }

  private static Duration duration(Configuration cfg, String key, Duration fallback) {
    String raw = cfg.getString(key, null);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return StringUtility.parseDuration(raw);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid duration for '%s': %s".formatted(key, raw), e);
    }
  }

  private static String normalize(String value) {
    return value == null || value.isBlank() ? null : value.trim().toLowerCase(Locale.ROOT);
  }

  private static String trimToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  public String defaultProvider() {
    return defaultProvider;
  }

  public List<String> priority() {
    return priority;
  }

  /**
   * Selection order: the default provider (when set) followed by the priority list, duplicates
   * removed.
   */
  public List<String> effectivePriority() {
    Set<String> ordered = new LinkedHashSet<>();
    if (defaultProvider != null) {
      ordered.add(defaultProvider);
    }
    ordered.addAll(priority);
    return List.copyOf(ordered);
  }

  public Duration requestTimeout() {
    return requestTimeout;
  }

  public Duration availabilityTtl() {
    return availabilityTtl;
  }

  public RetrySettings retry() {
    return retry;
  }

  public CircuitBreakerSettings circuitBreaker() {
    return circuitBreaker;
  }

  public double defaultTemperature() {
    return defaultTemperature;
  }

  public int defaultMaxTokens() {
    return defaultMaxTokens;
  }

  /** Declared providers in configuration order, including unusable ones. */
  public Map<String, ProviderConfig> providers() {
    return providers;
  }

  public PlaceholderPolicy placeholderPolicy() {
    return placeholderPolicy;
  }

  public static final class Builder {
    private String defaultProvider;
    private List<String> priority = DEFAULT_PRIORITY;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private Duration availabilityTtl = DEFAULT_AVAILABILITY_TTL;
    private RetrySettings retry = RetrySettings.DEFAULT;
    private CircuitBreakerSettings circuitBreaker = CircuitBreakerSettings.DEFAULT;
    private double defaultTemperature = DEFAULT_TEMPERATURE;
    private int defaultMaxTokens = DEFAULT_MAX_TOKENS;
    private final Map<String, ProviderConfig> providers = new LinkedHashMap<>();
    private PlaceholderPolicy placeholderPolicy = PlaceholderPolicy.defaults();

    private Builder() {}

    public Builder defaultProvider(String defaultProvider) {
      this.defaultProvider = defaultProvider;
      return this;
    }

    public Builder priority(List<String> priority) {
      this.priority = new ArrayList<>(priority == null ? List.of() : priority);
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder availabilityTtl(Duration availabilityTtl) {
      this.availabilityTtl = availabilityTtl;
      return this;
    }

    public Builder retry(RetrySettings retry) {
      this.retry = retry;
      return this;
    }

    public Builder circuitBreaker(CircuitBreakerSettings circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    public Builder defaultTemperature(double defaultTemperature) {
      this.defaultTemperature = defaultTemperature;
      return this;
    }

    public Builder defaultMaxTokens(int defaultMaxTokens) {
      this.defaultMaxTokens = defaultMaxTokens;
      return this;
    }

    public Builder provider(ProviderConfig provider) {
      if (providers.putIfAbsent(provider.name(), provider) != null) {
        throw new ConfigException("Duplicate provider name: " + provider.name());
      }
      return this;
    }

    public Builder placeholderPolicy(PlaceholderPolicy placeholderPolicy) {
      this.placeholderPolicy = placeholderPolicy;
      return this;
    }

    public LlmSettings build() {
      return new LlmSettings(this);
    }
  }
}
