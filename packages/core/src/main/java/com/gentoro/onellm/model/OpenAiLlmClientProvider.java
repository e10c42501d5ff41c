package com.gentoro.onellm.model;

import com.gentoro.onellm.config.ProviderConfig;
import java.util.Map;

/** SPI provider for the OpenAI API. */
public final class OpenAiLlmClientProvider implements LlmClientProvider {

  @Override
  public String providerId() {
    return "openai";
  }

  @Override
  public LlmClient create(ProviderConfig config) {
    return OpenAiCompatibleClients.create(config, OpenAiDialect.OPENAI, Map.of());
  }
}
