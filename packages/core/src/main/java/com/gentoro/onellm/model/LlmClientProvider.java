package com.gentoro.onellm.model;

import com.gentoro.onellm.config.ProviderConfig;

/**
 * Service Provider Interface (SPI) for pluggable LLM adapters.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Each adapter identifies
 * itself with a stable {@code providerId} (e.g. "openai", "anthropic", "openrouter", "zai",
 * "gemini") which is matched against {@link ProviderConfig#type()}.
 *
 * <p>To register an adapter, add its fully qualified class name to the service resource: {@code
 * META-INF/services/com.gentoro.onellm.model.LlmClientProvider}.
 */
public interface LlmClientProvider {

  /** A stable, lowercase identifier for this adapter (e.g. "openai"). */
  String providerId();

  /**
   * Creates a configured {@link LlmClient}. Must not perform network I/O.
   *
   * @throws IllegalArgumentException when the configuration is invalid
   */
  LlmClient create(ProviderConfig config);
}
