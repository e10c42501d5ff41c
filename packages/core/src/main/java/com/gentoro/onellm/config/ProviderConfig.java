package com.gentoro.onellm.config;

import com.gentoro.onellm.utility.StringUtility;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable settings for one configured provider.
 *
 * @param name registry name, unique per deployment (e.g. {@code openrouter})
 * @param type adapter id resolved through {@link com.gentoro.onellm.model.LlmClientProvider}
 * @param apiKey credential; never logged
 * @param model default model id, or {@code null} to use the adapter default
 * @param baseUrl endpoint override, or {@code null} for the adapter default
 * @param allowedOptions extra option names this deployment accepts, or {@code null} to accept
 *     every option the adapter understands
 * @param temperature default temperature for requests that do not set one
 * @param maxTokens default completion limit for requests that do not set one
 * @param timeout connect/read timeout applied by the SDK client
 * @param headers extra HTTP headers sent with every call
 */
public record ProviderConfig(
    String name,
    String type,
    String apiKey,
    String model,
    String baseUrl,
    Set<String> allowedOptions,
    double temperature,
    int maxTokens,
    Duration timeout,
    Map<String, String> headers) {

  public ProviderConfig {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(timeout, "timeout");
    allowedOptions = allowedOptions == null ? null : Set.copyOf(allowedOptions);
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public String modelOr(String fallback) {
    return model == null || model.isBlank() ? fallback : model;
  }

  public String baseUrlOr(String fallback) {
    return baseUrl == null || baseUrl.isBlank() ? fallback : baseUrl;
  }

  /**
   * Narrows the options an adapter supports to those this deployment allows. The result never
   * contains an option the adapter does not support.
   */
  public Set<String> effectiveOptions(Set<String> supported) {
    if (allowedOptions == null) {
      return supported;
    }
    return supported.stream()
        .filter(allowedOptions::contains)
        .collect(java.util.stream.Collectors.toUnmodifiableSet());
  }

  @Override
  public String toString() {
    return "ProviderConfig{name="
        + name
        + ", type="
        + type
        + ", apiKey="
        + StringUtility.mask(apiKey)
        + ", model="
        + model
        + ", baseUrl="
        + baseUrl
        + ", timeout="
        + timeout
        + '}';
  }
}
