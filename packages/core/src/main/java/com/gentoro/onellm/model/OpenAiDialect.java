package com.gentoro.onellm.model;

import java.util.Set;

/**
 * Differences between backends that speak the OpenAI chat-completions protocol.
 *
 * @param defaultModel model used when the configuration names none
 * @param defaultBaseUrl endpoint used when the configuration names none; {@code null} keeps the
 *     SDK default
 * @param supportedOptions extra request fields the backend understands
 * @param legacyMaxTokens send {@code max_tokens} instead of {@code max_completion_tokens}
 * @param reasoningFallback read {@code reasoning_content} when {@code content} is empty
 */
public record OpenAiDialect(
    String defaultModel,
    String defaultBaseUrl,
    Set<String> supportedOptions,
    boolean legacyMaxTokens,
    boolean reasoningFallback) {

  public static final OpenAiDialect OPENAI =
      new OpenAiDialect(
          "gpt-4",
          null,
          Set.of("stop", "presence_penalty", "frequency_penalty", "logit_bias", "user", "top_p"),
          false,
          false);

  public static final OpenAiDialect OPENROUTER =
      new OpenAiDialect(
          "anthropic/claude-3-haiku",
          "https://openrouter.ai/api/v1",
          Set.of("stop", "top_p", "frequency_penalty", "presence_penalty"),
          true,
          false);

  public static final OpenAiDialect ZAI =
      new OpenAiDialect(
          "glm-4.7", "https://api.z.ai/api/coding/paas/v4", Set.of("top_p", "stop"), true, true);

  public OpenAiDialect {
    supportedOptions = Set.copyOf(supportedOptions);
  }
}
