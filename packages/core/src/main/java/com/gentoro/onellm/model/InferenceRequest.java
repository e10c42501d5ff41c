package com.gentoro.onellm.model;

import com.gentoro.onellm.model.LlmClient.Message;
import java.util.List;
import java.util.Map;

/**
 * A request after provider-specific resolution: model and sampling defaults applied, extra
 * options already filtered to the provider's allow-list.
 */
public record InferenceRequest(
    String model,
    List<Message> messages,
    double temperature,
    int maxTokens,
    Map<String, Object> options) {

  public InferenceRequest {
    messages = List.copyOf(messages);
    options = Map.copyOf(options);
  }
}
