package com.gentoro.onellm;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Command line arguments in {@code --name value} form.
 *
 * <p>Modes: {@code prompt} sends one request through the fallback chain, {@code probe} checks
 * every configured provider, {@code status} prints the provider status board after probing and
 * {@code help} prints usage.
 */
public class StartupParameters {
  private static final Set<String> MODES = Set.of("prompt", "probe", "status", "help");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "prompt");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;

      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }

    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }

    if ("prompt".equals(mode)
        && (parameters.get("prompt") == null || parameters.get("prompt").toString().isBlank())) {
      throw new IllegalArgumentException("Mode 'prompt' requires --prompt <text>");
    }

    convertNumber("temperature", Double::valueOf, t -> t >= 0.0, "a number >= 0");
    convertNumber("max-tokens", Integer::valueOf, n -> n > 0, "a positive integer");
  }

  /** Replaces the raw text of {@code name} with its parsed value, rejecting malformed input. */
  private <T> void convertNumber(
      String name, Function<String, T> parser, Predicate<T> valid, String expected) {
    if (!parameters.containsKey(name)) {
      return;
    }
    Object raw = parameters.get(name);
    T value;
    try {
      value = raw == null ? null : parser.apply(raw.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "--%s must be %s, got '%s'".formatted(name, expected, raw), e);
    }
    if (value == null || !valid.test(value)) {
      throw new IllegalArgumentException(
          "--%s must be %s, got '%s'".formatted(name, expected, raw));
    }
    parameters.put(name, value);
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/onellm.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  public Optional<Double> temperature() {
    return getOptionalParameter("temperature", Double.class);
  }

  public Optional<Integer> maxTokens() {
    return getOptionalParameter("max-tokens", Integer.class);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return String.join(
        "\n",
        "Usage: onellm [--config-file <location>] --mode <prompt|probe|status|help>",
        "  --prompt <text>      prompt to send (mode prompt)",
        "  --system <text>      optional system prompt",
        "  --provider <name>    explicit provider to try first",
        "  --temperature <num>  sampling temperature",
        "  --max-tokens <num>   completion token limit");
  }
}
