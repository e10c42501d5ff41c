package com.gentoro.onellm.model;

import com.gentoro.onellm.config.ProviderConfig;
import java.util.Map;

/**
 * SPI provider for OpenRouter. Sends the attribution headers OpenRouter expects unless the
 * configuration overrides them.
 */
public final class OpenRouterLlmClientProvider implements LlmClientProvider {
  static final Map<String, String> DEFAULT_HEADERS =
      Map.of("HTTP-Referer", "https://github.com/gentoro-gt/onellm", "X-Title", "OneLLM");

  @Override
  public String providerId() {
    return "openrouter";
  }

  @Override
  public LlmClient create(ProviderConfig config) {
    return OpenAiCompatibleClients.create(config, OpenAiDialect.OPENROUTER, DEFAULT_HEADERS);
  }
}
