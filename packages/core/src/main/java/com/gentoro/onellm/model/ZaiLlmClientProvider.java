package com.gentoro.onellm.model;

import com.gentoro.onellm.config.ProviderConfig;
import java.util.Map;

/** SPI provider for the Z.AI (GLM) coding endpoint. */
public final class ZaiLlmClientProvider implements LlmClientProvider {

  @Override
  public String providerId() {
    return "zai";
  }

  @Override
  public LlmClient create(ProviderConfig config) {
    return OpenAiCompatibleClients.create(config, OpenAiDialect.ZAI, Map.of());
  }
}
