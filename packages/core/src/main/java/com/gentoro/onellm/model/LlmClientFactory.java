package com.gentoro.onellm.model;

import com.gentoro.onellm.config.ProviderConfig;
import com.gentoro.onellm.exception.ConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Factory utility to create {@link LlmClient} instances from provider settings.
 *
 * <p>Resolution uses Java's {@link ServiceLoader} to locate a matching {@link LlmClientProvider}
 * by {@code providerId()}.
 */
public final class LlmClientFactory {
  private LlmClientFactory() {}

  public static Optional<LlmClientProvider> findProvider(String type) {
    String id = type.trim().toLowerCase(Locale.ROOT);
    for (LlmClientProvider p : ServiceLoader.load(LlmClientProvider.class)) {
      if (id.equals(p.providerId())) {
        return Optional.of(p);
      }
    }
    return Optional.empty();
  }

  public static List<String> availableProviderIds() {
    List<String> ids = new ArrayList<>();
    ServiceLoader.load(LlmClientProvider.class).forEach(p -> ids.add(p.providerId()));
    return ids;
  }

  /**
   * Creates a client for {@code config}.
   *
   * @throws ConfigException when no adapter handles {@code config.type()} or the adapter rejects
   *     the settings
   */
  public static LlmClient create(ProviderConfig config) {
    LlmClientProvider provider =
        findProvider(config.type())
            .orElseThrow(
                () ->
                    new ConfigException(
                        "Unknown llm.providers.%s.type: %s (known: %s)"
                            .formatted(config.name(), config.type(), availableProviderIds())));
    try {
      return provider.create(config);
    } catch (IllegalArgumentException e) {
      throw new ConfigException(e.getMessage(), e);
    }
  }
}
