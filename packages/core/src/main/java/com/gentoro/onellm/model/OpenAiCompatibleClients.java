package com.gentoro.onellm.model;

import com.gentoro.onellm.config.ProviderConfig;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import java.util.Map;

/** Builds SDK clients for every backend speaking the OpenAI chat-completions protocol. */
final class OpenAiCompatibleClients {
  private OpenAiCompatibleClients() {}

  static OpenAiLlmClient create(
      ProviderConfig config, OpenAiDialect dialect, Map<String, String> defaultHeaders) {
    if (config.apiKey() == null || config.apiKey().isBlank()) {
      throw new IllegalArgumentException(
          "Missing llm.providers.%s.apiKey in configuration".formatted(config.name()));
    }
    OpenAIOkHttpClient.Builder builder =
        OpenAIOkHttpClient.builder()
            .apiKey(config.apiKey())
            .timeout(config.timeout())
            .maxRetries(0);
    String baseUrl = config.baseUrlOr(dialect.defaultBaseUrl());
    if (baseUrl != null) {
      builder.baseUrl(baseUrl);
    }
    defaultHeaders.forEach(
        (name, value) -> {
          if (!config.headers().containsKey(name)) {
            builder.putHeader(name, value);
          }
        });
    config.headers().forEach(builder::putHeader);
    OpenAIClient client = builder.build();
    return new OpenAiLlmClient(config, client, dialect);
  }
}
