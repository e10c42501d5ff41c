package com.gentoro.onellm.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onellm.model.LlmClient.Message;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RequestSpecTest {

  @Test
  @DisplayName("Exactly one of prompt or messages is required")
  void promptXorMessages() {
    assertThrows(IllegalArgumentException.class, () -> RequestSpec.builder().build());
    assertThrows(
        IllegalArgumentException.class,
        () -> RequestSpec.builder().prompt("a").addMessage(Message.user("b")).build());
  }

  @Test
  @DisplayName("Non-positive token limits are rejected")
  void rejectsBadMaxTokens() {
    assertThrows(
        IllegalArgumentException.class,
        () -> RequestSpec.builder().prompt("a").maxTokens(0).build());
  }

  @Test
  @DisplayName("The system prompt leads the conversation and message order is kept")
  void conversationOrder() {
    RequestSpec spec =
        RequestSpec.builder()
            .systemPrompt("sys")
            .addMessage(Message.user("one"))
            .addMessage(Message.assistant("two"))
            .addMessage(Message.user("three"))
            .build();

    assertEquals(
        List.of(
            Message.system("sys"),
            Message.user("one"),
            Message.assistant("two"),
            Message.user("three")),
        spec.conversation());
  }

  @Test
  @DisplayName("A prompt becomes a single user turn and a request id is generated")
  void promptConversation() {
    RequestSpec spec = RequestSpec.ofPrompt("hello");

    assertEquals(List.of(Message.user("hello")), spec.conversation());
    assertNotNull(spec.requestId());
    assertNull(spec.provider());
  }
}
