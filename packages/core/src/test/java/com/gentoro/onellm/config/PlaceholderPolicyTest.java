package com.gentoro.onellm.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class PlaceholderPolicyTest {

  private final PlaceholderPolicy policy = new PlaceholderPolicy(List.of("demo-key"));

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(
      strings = {
        "   ",
        "your_openai_api_key_here",
        "YOUR-ANTHROPIC-KEY-HERE",
        "changeme",
        "sk-...",
        "<api key>",
        "${env:OPENAI_API_KEY}",
        "demo-key"
      })
  @DisplayName("Placeholders and unresolved variables are not credentials")
  void recognisesPlaceholders(String value) {
    assertTrue(policy.isPlaceholder(value));
  }

  @ParameterizedTest
  @ValueSource(strings = {"sk-proj-4f9a8b7c6d5e", "or-v1-123", "AIzaSyExample"})
  @DisplayName("Real-looking credentials are accepted")
  void acceptsCredentials(String value) {
    assertFalse(policy.isPlaceholder(value));
  }
}
