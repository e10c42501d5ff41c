package com.gentoro.onellm.model;

import static org.junit.jupiter.api.Assertions.*;

import com.anthropic.models.messages.MessageCreateParams;
import com.anthropic.models.messages.MessageParam;
import com.gentoro.onellm.config.ProviderConfig;
import com.gentoro.onellm.model.LlmClient.Message;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnthropicLlmClientTest {

  private final AnthropicLlmClient client =
      new AnthropicLlmClient(
          new ProviderConfig(
              "anthropic", "anthropic", "key", null, null, null, 0.7, 256, Duration.ofSeconds(5),
              Map.of()),
          null);

  @Test
  @DisplayName("Leading system turns move to the system parameter, the rest keep their order")
  void foldsSystemMessages() {
    MessageCreateParams params =
        client.buildParams(
            new InferenceRequest(
                "claude-test",
                List.of(
                    Message.system("be brief"),
                    Message.user("hi"),
                    Message.assistant("hello"),
                    Message.user("bye")),
                0.2,
                128,
                Map.of()));

    assertTrue(params.system().isPresent());
    assertEquals(128L, params.maxTokens());
    assertEquals(
        List.of(MessageParam.Role.USER, MessageParam.Role.ASSISTANT, MessageParam.Role.USER),
        params.messages().stream().map(MessageParam::role).toList());
  }

  @Test
  @DisplayName("Without system turns no system parameter is sent")
  void noSystem() {
    MessageCreateParams params =
        client.buildParams(
            new InferenceRequest("claude-test", List.of(Message.user("hi")), 0.2, 16, Map.of()));

    assertTrue(params.system().isEmpty());
  }

  @Test
  @DisplayName("Allowed options map onto typed request fields")
  void mapsOptions() {
    MessageCreateParams params =
        client.buildParams(
            new InferenceRequest(
                "claude-test",
                List.of(Message.user("hi")),
                0.2,
                16,
                Map.of("top_p", 0.8, "top_k", 40, "stop_sequences", List.of("END", "STOP"))));

    assertEquals(0.8, params.topP().orElseThrow());
    assertEquals(40L, params.topK().orElseThrow());
    assertEquals(List.of("END", "STOP"), params.stopSequences().orElseThrow());
  }

  @Test
  @DisplayName("Values that cannot be converted are dropped")
  void dropsUnconvertibleValues() {
    MessageCreateParams params =
        client.buildParams(
            new InferenceRequest(
                "claude-test", List.of(Message.user("hi")), 0.2, 16, Map.of("top_k", "many")));

    assertTrue(params.topK().isEmpty());
  }
}
