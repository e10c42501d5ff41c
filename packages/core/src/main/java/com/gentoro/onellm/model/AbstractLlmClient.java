package com.gentoro.onellm.model;

import com.gentoro.onellm.config.ProviderConfig;
import com.gentoro.onellm.exception.PermanentProviderException;
import com.gentoro.onellm.exception.ProviderException;
import com.gentoro.onellm.model.LlmClient.Message;
import com.gentoro.onellm.model.LlmClient.Role;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Base {@link LlmClient} with the plumbing every adapter shares.
 *
 * <p>Subclasses implement {@link #runInference(InferenceRequest)} to execute a single call with a
 * concrete provider SDK, and {@link #classify(RuntimeException)} to map SDK failures onto the
 * transient / permanent taxonomy. This class resolves model and sampling defaults, filters extra
 * options down to the provider's allow-list and rejects blank responses.
 */
public abstract class AbstractLlmClient implements LlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(AbstractLlmClient.class);

  static final String PROBE_PROMPT = "Hello";
  static final int PROBE_MAX_TOKENS = 16;

  protected final ProviderConfig config;
  private final Set<String> allowedOptions;

  protected AbstractLlmClient(ProviderConfig config, Set<String> supportedOptions) {
    this.config = config;
    this.allowedOptions = config.effectiveOptions(supportedOptions);
  }

  @Override
  public String providerName() {
    return config.name();
  }

  /** Extra option names this client forwards; everything else is dropped. */
  public Set<String> allowedOptions() {
    return allowedOptions;
  }

  /** Model id used when the configuration does not name one. */
  protected abstract String defaultModel();

  /** Executes one call against the provider. Must not retry. */
  protected abstract String runInference(InferenceRequest request);

  /** Converts an SDK failure into a {@link ProviderException}. */
  protected abstract ProviderException classify(RuntimeException failure);

  @Override
  public final String generateText(RequestSpec request) {
    return execute(prepare(request), "generate");
  }

  @Override
  public final void probe() {
    execute(
        new InferenceRequest(
            config.modelOr(defaultModel()),
            List.of(Message.user(PROBE_PROMPT)),
            0.0,
            PROBE_MAX_TOKENS,
            Map.of()),
        "probe");
  }

  InferenceRequest prepare(RequestSpec request) {
    double temperature =
        request.temperature() != null ? request.temperature() : config.temperature();
    int maxTokens = request.maxTokens() != null ? request.maxTokens() : config.maxTokens();
    return new InferenceRequest(
        config.modelOr(defaultModel()),
        request.conversation(),
        temperature,
        maxTokens,
        filterOptions(request.options()));
  }

  Map<String, Object> filterOptions(Map<String, Object> options) {
    Map<String, Object> accepted = new LinkedHashMap<>();
    Set<String> dropped = new TreeSet<>();
    options.forEach(
        (name, value) -> {
          if (value != null && allowedOptions.contains(name)) {
            accepted.put(name, value);
          } else {
            dropped.add(name);
          }
        });
    if (!dropped.isEmpty()) {
      log.debug("Dropping options not accepted by provider {}: {}", providerName(), dropped);
    }
    return accepted;
  }

  private String execute(InferenceRequest request, String operation) {
    long start = System.currentTimeMillis();
    log.trace(
        "{}() on provider {} with model {} ({} message(s))",
        operation,
        providerName(),
        request.model(),
        request.messages().size());
    String text;
    try {
      text = runInference(request);
    } catch (ProviderException e) {
      throw e;
    } catch (RuntimeException e) {
      throw classify(e);
    } finally {
      log.trace(
          "{}() on provider {} took {}ms",
          operation,
          providerName(),
          System.currentTimeMillis() - start);
    }
    if (text == null || text.isBlank()) {
      throw new PermanentProviderException(
          providerName(), providerName() + " returned an empty response");
    }
    return text;
  }

  /**
   * Splits off leading system turns for providers that carry the system prompt out of band.
   * Leading system messages are joined with a blank line; a system message appearing after the
   * first non-system turn becomes a user turn prefixed with {@code [system]}.
   */
  protected static SystemSplit splitSystem(List<Message> messages) {
    StringBuilder system = new StringBuilder();
    int index = 0;
    while (index < messages.size() && messages.get(index).role() == Role.SYSTEM) {
      if (system.length() > 0) {
        system.append("\n\n");
      }
      system.append(messages.get(index).content());
      index++;
    }
    List<Message> rest = new ArrayList<>();
    for (Message message : messages.subList(index, messages.size())) {
      rest.add(
          message.role() == Role.SYSTEM
              ? Message.user("[system] " + message.content())
              : message);
    }
    return new SystemSplit(system.length() == 0 ? null : system.toString(), List.copyOf(rest));
  }

  protected record SystemSplit(String system, List<Message> conversation) {}

  protected Optional<Double> optionAsDouble(Map<String, Object> options, String name) {
    Object value = options.get(name);
    if (value instanceof Number number) {
      return Optional.of(number.doubleValue());
    }
    if (value instanceof String text) {
      try {
        return Optional.of(Double.parseDouble(text.trim()));
      } catch (NumberFormatException e) {
        log.warn(
            "Ignoring option {}={} for provider {}: not a number", name, value, providerName());
        return Optional.empty();
      }
    }
    if (value != null) {
      log.warn("Ignoring option {}={} for provider {}: not a number", name, value, providerName());
    }
    return Optional.empty();
  }

  protected Optional<Long> optionAsLong(Map<String, Object> options, String name) {
    return optionAsDouble(options, name).map(Double::longValue);
  }

  protected Optional<List<String>> optionAsStringList(Map<String, Object> options, String name) {
    Object value = options.get(name);
    if (value instanceof String text) {
      return Optional.of(List.of(text));
    }
    if (value instanceof Collection<?> items) {
      return Optional.of(items.stream().map(String::valueOf).toList());
    }
    if (value != null) {
      log.warn(
          "Ignoring option {}={} for provider {}: expected string or list",
          name,
          value,
          providerName());
    }
    return Optional.empty();
  }
}
