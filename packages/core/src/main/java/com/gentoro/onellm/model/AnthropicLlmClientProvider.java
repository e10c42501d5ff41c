package com.gentoro.onellm.model;

import com.anthropic.client.AnthropicClient;
import com.anthropic.client.okhttp.AnthropicOkHttpClient;
import com.gentoro.onellm.config.ProviderConfig;

/** SPI provider for Anthropic-based {@link LlmClient} implementations. */
public final class AnthropicLlmClientProvider implements LlmClientProvider {

  @Override
  public String providerId() {
    return "anthropic";
  }

  @Override
  public LlmClient create(ProviderConfig config) {
    if (config.apiKey() == null || config.apiKey().isBlank()) {
      throw new IllegalArgumentException(
          "Missing llm.providers.%s.apiKey in configuration".formatted(config.name()));
    }
    AnthropicOkHttpClient.Builder builder =
        AnthropicOkHttpClient.builder()
            .apiKey(config.apiKey())
            .timeout(config.timeout())
            .maxRetries(0);
    if (config.baseUrl() != null && !config.baseUrl().isBlank()) {
      builder.baseUrl(config.baseUrl());
    }
    config.headers().forEach(builder::putHeader);
    AnthropicClient client = builder.build();
    return new AnthropicLlmClient(config, client);
  }
}
