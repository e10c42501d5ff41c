package com.gentoro.onellm.model;

import com.gentoro.onellm.config.ProviderConfig;
import com.google.genai.Client;
import com.google.genai.types.HttpOptions;

/** SPI provider for Google Gemini {@link LlmClient} implementations. */
public final class GeminiLlmClientProvider implements LlmClientProvider {

  @Override
  public String providerId() {
    return "gemini";
  }

  @Override
  public LlmClient create(ProviderConfig config) {
    if (config.apiKey() == null || config.apiKey().isBlank()) {
      throw new IllegalArgumentException(
          "Missing llm.providers.%s.apiKey in configuration".formatted(config.name()));
    }
    HttpOptions.Builder httpOptions =
        HttpOptions.builder().timeout((int) config.timeout().toMillis());
    if (config.baseUrl() != null && !config.baseUrl().isBlank()) {
      httpOptions.baseUrl(config.baseUrl());
    }
    if (!config.headers().isEmpty()) {
      httpOptions.headers(config.headers());
    }
    Client client =
        Client.builder().apiKey(config.apiKey()).httpOptions(httpOptions.build()).build();
    return new GeminiLlmClient(config, client);
  }
}
