package com.gentoro.onellm.model;

import java.util.Objects;

/**
 * Primary abstraction over one text-generation backend.
 *
 * <p>Implementations translate a generic {@link RequestSpec} into the backend's wire format and
 * parse the response. Failures are always reported as {@link
 * com.gentoro.onellm.exception.TransientProviderException} (rate limits, 5xx, network failures,
 * timeouts) or {@link com.gentoro.onellm.exception.PermanentProviderException} (everything else),
 * and never retried internally.
 *
 * <p>Concrete clients are created through {@link LlmClientFactory}, which resolves a {@link
 * LlmClientProvider} with {@link java.util.ServiceLoader}. One instance exists per configured
 * provider name and is replaced wholesale when the registry is refreshed.
 */
public interface LlmClient {

  /** Registry name of the provider this client talks to. */
  String providerName();

  /**
   * Generates text for {@code request}. Extra options outside this provider's allow-list are
   * dropped before the payload is built.
   *
   * @return generated text, never blank
   */
  String generateText(RequestSpec request);

  /**
   * Issues one minimal, low-cost request to check that the provider answers. Never retried.
   *
   * @throws com.gentoro.onellm.exception.ProviderException when the provider is unusable
   */
  void probe();

  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  record Message(Role role, String content) {
    public Message {
      Objects.requireNonNull(role, "role");
      Objects.requireNonNull(content, "content");
    }

    public static Message system(String content) {
      return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
      return new Message(Role.USER, content);
    }

    public static Message assistant(String content) {
      return new Message(Role.ASSISTANT, content);
    }
  }
}
