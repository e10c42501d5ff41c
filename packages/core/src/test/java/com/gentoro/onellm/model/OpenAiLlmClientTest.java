package com.gentoro.onellm.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onellm.config.ProviderConfig;
import com.gentoro.onellm.model.LlmClient.Message;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OpenAiLlmClientTest {

  private static OpenAiLlmClient client(OpenAiDialect dialect) {
    ProviderConfig config =
        new ProviderConfig(
            "p", "openai", "key", null, null, null, 0.7, 256, Duration.ofSeconds(5), Map.of());
    return new OpenAiLlmClient(config, null, dialect);
  }

  private static InferenceRequest request(Map<String, Object> options) {
    return new InferenceRequest(
        "gpt-test",
        List.of(Message.system("sys"), Message.user("hi"), Message.assistant("hello")),
        0.3,
        64,
        options);
  }

  @Test
  @DisplayName("System, user and assistant turns are sent inline in order")
  void keepsMessagesInline() {
    ChatCompletionCreateParams params =
        client(OpenAiDialect.OPENAI).buildParams(request(Map.of()));

    assertEquals(3, params.messages().size());
    assertTrue(params.messages().get(0).isSystem());
    assertTrue(params.messages().get(1).isUser());
    assertTrue(params.messages().get(2).isAssistant());
    assertEquals(0.3, params.temperature().orElseThrow());
  }

  @Test
  @DisplayName("OpenAI uses max_completion_tokens")
  void openAiTokenField() {
    ChatCompletionCreateParams params =
        client(OpenAiDialect.OPENAI).buildParams(request(Map.of()));

    assertEquals(64L, params.maxCompletionTokens().orElseThrow());
    assertTrue(params.maxTokens().isEmpty());
  }

  @Test
  @DisplayName("OpenRouter and Z.AI use max_tokens")
  void compatibleTokenField() {
    ChatCompletionCreateParams params =
        client(OpenAiDialect.ZAI).buildParams(request(Map.of()));

    assertEquals(64L, params.maxTokens().orElseThrow());
    assertTrue(params.maxCompletionTokens().isEmpty());
  }

  @Test
  @DisplayName("Filtered options are forwarded as extra body fields")
  void forwardsOptions() {
    ChatCompletionCreateParams params =
        client(OpenAiDialect.OPENROUTER)
            .buildParams(request(Map.of("top_p", 0.9, "stop", List.of("END"))));

    assertTrue(params._additionalBodyProperties().containsKey("top_p"));
    assertTrue(params._additionalBodyProperties().containsKey("stop"));
  }

  @Test
  @DisplayName("Each dialect exposes its own allow-list without streaming")
  void dialectAllowLists() {
    assertTrue(client(OpenAiDialect.OPENAI).allowedOptions().contains("logit_bias"));
    assertFalse(client(OpenAiDialect.OPENROUTER).allowedOptions().contains("logit_bias"));
    for (OpenAiDialect dialect :
        List.of(OpenAiDialect.OPENAI, OpenAiDialect.OPENROUTER, OpenAiDialect.ZAI)) {
      assertFalse(dialect.supportedOptions().contains("stream"));
    }
  }
}
