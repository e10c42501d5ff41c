package com.gentoro.onellm.model;

import com.gentoro.onellm.model.LlmClient.Message;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One logical generation request: either a single prompt or an ordered, role-tagged message
 * sequence, plus sampling settings and an opaque set of extra options that each provider filters
 * against its own allow-list.
 */
public final class RequestSpec {
  private final String prompt;
  private final List<Message> messages;
  private final String systemPrompt;
  private final Double temperature;
  private final Integer maxTokens;
  private final String provider;
  private final Map<String, Object> options;
  private final String requestId;

  private RequestSpec(Builder builder) {
    this.prompt = builder.prompt;
    this.messages = builder.messages == null ? null : List.copyOf(builder.messages);
    this.systemPrompt = builder.systemPrompt;
    this.temperature = builder.temperature;
    this.maxTokens = builder.maxTokens;
    this.provider = builder.provider;
    this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
    this.requestId = builder.requestId == null ? UUID.randomUUID().toString() : builder.requestId;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static RequestSpec ofPrompt(String prompt) {
    return builder().prompt(prompt).build();
  }

  public String prompt() {
    return prompt;
  }

  /** The explicit message list, or {@code null} for prompt requests. */
  public List<Message> messages() {
    return messages;
  }

  public String systemPrompt() {
    return systemPrompt;
  }

  public Double temperature() {
    return temperature;
  }

  public Integer maxTokens() {
    return maxTokens;
  }

  /** Explicitly requested provider name, or {@code null}. */
  public String provider() {
    return provider;
  }

  public Map<String, Object> options() {
    return options;
  }

  public String requestId() {
    return requestId;
  }

  /**
   * Full conversation to send: the system prompt first (when set), followed by either the prompt
   * as a user turn or the explicit messages in their original order.
   */
  public List<Message> conversation() {
    List<Message> conversation = new ArrayList<>();
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      conversation.add(Message.system(systemPrompt));
    }
    if (messages != null) {
      conversation.addAll(messages);
    } else {
      conversation.add(Message.user(prompt));
    }
    return List.copyOf(conversation);
  }

  @Override
  public String toString() {
    return "RequestSpec{requestId="
        + requestId
        + ", provider="
        + provider
        + ", "
        + (messages == null ? "prompt" : messages.size() + " message(s)")
        + ", options="
        + options.keySet()
        + '}';
  }

  public static final class Builder {
    private String prompt;
    private List<Message> messages;
    private String systemPrompt;
    private Double temperature;
    private Integer maxTokens;
    private String provider;
    private final Map<String, Object> options = new LinkedHashMap<>();
    private String requestId;

    private Builder() {}

    public Builder prompt(String prompt) {
      this.prompt = prompt;
      return this;
    }

    public Builder messages(List<Message> messages) {
      this.messages = messages == null ? null : new ArrayList<>(messages);
      return this;
    }

    public Builder addMessage(Message message) {
      if (this.messages == null) {
        this.messages = new ArrayList<>();
      }
      this.messages.add(Objects.requireNonNull(message, "message"));
      return this;
    }

    public Builder systemPrompt(String systemPrompt) {
      this.systemPrompt = systemPrompt;
      return this;
    }

    public Builder temperature(Double temperature) {
      this.temperature = temperature;
      return this;
    }

    public Builder maxTokens(Integer maxTokens) {
      this.maxTokens = maxTokens;
      return this;
    }

    public Builder provider(String provider) {
      this.provider =
          provider == null || provider.isBlank()
              ? null
              : provider.trim().toLowerCase(java.util.Locale.ROOT);
      return this;
    }

    public Builder option(String name, Object value) {
      this.options.put(Objects.requireNonNull(name, "name"), value);
      return this;
    }

    public Builder options(Map<String, ?> options) {
      if (options != null) {
        options.forEach(this::option);
      }
      return this;
    }

    public Builder requestId(String requestId) {
      this.requestId = requestId;
      return this;
    }

    /**
     * @throws IllegalArgumentException when neither or both of prompt and messages are set, or
     *     when a numeric setting is out of range
     */
    public RequestSpec build() {
      boolean hasPrompt = prompt != null && !prompt.isBlank();
      boolean hasMessages = messages != null && !messages.isEmpty();
      if (hasPrompt == hasMessages) {
        throw new IllegalArgumentException("Exactly one of prompt or messages must be provided");
      }
      if (maxTokens != null && maxTokens <= 0) {
        throw new IllegalArgumentException("maxTokens must be positive");
      }
      if (temperature != null && (temperature < 0.0 || temperature.isNaN())) {
        throw new IllegalArgumentException("temperature must be a non-negative number");
      }
      return new RequestSpec(this);
    }
  }
}
